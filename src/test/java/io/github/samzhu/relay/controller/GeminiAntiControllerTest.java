package io.github.samzhu.relay.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.relay.config.ErrorReportingProperties;
import io.github.samzhu.relay.exception.GlobalExceptionHandler;
import io.github.samzhu.relay.exception.InvalidRequestException;
import io.github.samzhu.relay.exception.UpstreamException;
import io.github.samzhu.relay.handler.NonStreamingAntiTruncationHandler;
import io.github.samzhu.relay.handler.StreamingAntiTruncationHandler;
import io.github.samzhu.relay.model.Candidate;
import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationResponse;
import io.github.samzhu.relay.model.Part;
import io.github.samzhu.relay.util.ErrorDetailsSanitizer;

class GeminiAntiControllerTest {

    private static final String BODY = """
        {"contents":[{"role":"user","parts":[{"text":"Hello"}]}],"generationConfig":{"temperature":0.2}}
        """;

    private final NonStreamingAntiTruncationHandler nonStreamingHandler = mock(NonStreamingAntiTruncationHandler.class);
    private final StreamingAntiTruncationHandler streamingHandler = mock(StreamingAntiTruncationHandler.class);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ErrorDetailsSanitizer sanitizer = new ErrorDetailsSanitizer(new ErrorReportingProperties(false));
        mockMvc = MockMvcBuilders
            .standaloneSetup(new GeminiAntiController(nonStreamingHandler, streamingHandler))
            .setControllerAdvice(new GlobalExceptionHandler(sanitizer))
            .build();
    }

    @Test
    void shouldRouteGenerateContentToNonStreamingHandler() throws Exception {
        GenerationResponse response = new GenerationResponse(
            List.of(new Candidate(new Content("model", List.of(Part.ofText("Hi there"))), "STOP", null, null)),
            null, null, null, null);
        when(nonStreamingHandler.handle(eq("gemini-2.5-pro"), any(), isNull(), eq("203.0.113.7")))
            .thenReturn(ResponseEntity.ok(response));

        mockMvc.perform(post("/api/gemini-anti/v1beta/models/gemini-2.5-pro:generateContent")
                .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.candidates[0].content.parts[0].text").value("Hi there"));

        verifyNoInteractions(streamingHandler);
    }

    @Test
    void shouldRouteStreamGenerateContentToStreamingHandler() throws Exception {
        mockMvc.perform(post("/api/gemini-anti/v1beta/models/gemini-2.5-flash:streamGenerateContent?alt=sse")
                .header("X-Real-IP", "198.51.100.2")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isOk());

        verify(streamingHandler).handle(eq("gemini-2.5-flash"), any(), eq("alt=sse"), eq("198.51.100.2"), any());
        verifyNoInteractions(nonStreamingHandler);
    }

    @Test
    void shouldRejectPathWithoutModel() throws Exception {
        mockMvc.perform(post("/api/gemini-anti/v1beta/generateContent")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid model path"))
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.timestamp").exists());

        verifyNoInteractions(nonStreamingHandler, streamingHandler);
    }

    @Test
    void shouldReportUnsupportedModel() throws Exception {
        when(nonStreamingHandler.handle(eq("gemini-1.0-pro"), any(), any(), any()))
            .thenThrow(InvalidRequestException.unsupportedModel("gemini-1.0-pro"));

        mockMvc.perform(post("/api/gemini-anti/v1beta/models/gemini-1.0-pro:generateContent")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Model not supported"))
            .andExpect(jsonPath("$.details").value("Model 'gemini-1.0-pro' is not supported for anti-truncation"));
    }

    @Test
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/gemini-anti/v1beta/models/gemini-2.5-pro:generateContent")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contents\": ["))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid request body"));
    }

    @Test
    void shouldMapExhaustedUpstreamRetriesTo503() throws Exception {
        when(nonStreamingHandler.handle(any(), any(), any(), any()))
            .thenThrow(UpstreamException.forStatus(503, "model overloaded", true));

        mockMvc.perform(post("/api/gemini-anti/v1beta/models/gemini-2.5-pro:generateContent")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Gemini request failed"))
            .andExpect(jsonPath("$.details").value("Gemini API error after retries: 503 - model overloaded"));
    }

    @Test
    void shouldExtractModelFromPath() {
        assertThat(GeminiAntiController.extractModel("/api/gemini-anti/v1beta/models/gemini-2.5-pro:generateContent"))
            .isEqualTo("gemini-2.5-pro");
        assertThatThrownBy(() -> GeminiAntiController.extractModel("/api/gemini-anti/v1beta/models/gemini-2.5-pro"))
            .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void shouldResolveClientIdFromProxyHeaders() {
        MockHttpServletRequest forwarded = new MockHttpServletRequest();
        forwarded.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1");
        forwarded.addHeader("X-Real-IP", "198.51.100.2");
        assertThat(GeminiAntiController.resolveClientId(forwarded)).isEqualTo("203.0.113.7");

        MockHttpServletRequest realIp = new MockHttpServletRequest();
        realIp.addHeader("X-Real-IP", "198.51.100.2");
        assertThat(GeminiAntiController.resolveClientId(realIp)).isEqualTo("198.51.100.2");

        assertThat(GeminiAntiController.resolveClientId(new MockHttpServletRequest())).isEqualTo("unknown");
    }
}
