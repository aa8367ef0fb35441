package io.github.samzhu.relay.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.github.samzhu.relay.exception.ErrorCategory;
import io.github.samzhu.relay.exception.UpstreamException;
import io.github.samzhu.relay.filter.GeminiApiKeyInterceptor;
import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.service.GeminiUpstreamClient;
import io.github.samzhu.relay.service.UpstreamRetryPolicy;
import io.github.samzhu.relay.service.UpstreamStream;

class GeminiClientConfigTest {

    private static final int EVENT_COUNT = 5;
    private static final long EVENT_INTERVAL_MS = 400;

    private final GenerationRequest request = GenerationRequest.of(List.of(Content.userText("Count to five")));

    private HttpServer server;
    private ExecutorService executor;
    private GeminiUpstreamClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1beta/models/gemini-2.5-pro:streamGenerateContent", this::slowStream);
        server.createContext("/v1beta/models/gemini-2.5-pro:generateContent", this::slowGenerate);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();

        GeminiProperties properties = new GeminiProperties(
            "http://127.0.0.1:" + server.getAddress().getPort(), "test-key", null,
            Duration.ofMillis(1000), Duration.ofSeconds(2), 0, null, null, Set.of(503));
        GeminiClientConfig config = new GeminiClientConfig();
        GeminiApiKeyInterceptor interceptor = new GeminiApiKeyInterceptor(properties);
        client = config.geminiUpstreamClient(
            config.geminiRestClient(RestClient.builder(), properties, interceptor),
            config.geminiStreamRestClient(RestClient.builder(), properties, interceptor),
            properties,
            UpstreamRetryPolicy.from(properties, duration -> { }),
            new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void slowStream(HttpExchange exchange) throws IOException {
        exchange.getRequestBody().readAllBytes();
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream body = exchange.getResponseBody()) {
            for (int i = 0; i < EVENT_COUNT; i++) {
                body.write(("data: {\"n\":" + i + "}\n\n").getBytes(StandardCharsets.UTF_8));
                body.flush();
                sleep(EVENT_INTERVAL_MS);
            }
        }
    }

    private void slowGenerate(HttpExchange exchange) throws IOException {
        exchange.getRequestBody().readAllBytes();
        sleep(3000);
        byte[] body = "{\"candidates\":[]}".getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(body);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void shouldReadStreamLongerThanRequestTimeoutToTheEnd() throws Exception {
        String received;
        try (UpstreamStream stream = client.openStream(request, "gemini-2.5-pro", "alt=sse");
             InputStream body = stream.getBody()) {
            received = new String(body.readAllBytes(), StandardCharsets.UTF_8);
        }

        for (int i = 0; i < EVENT_COUNT; i++) {
            assertThat(received).contains("data: {\"n\":" + i + "}\n\n");
        }
    }

    @Test
    void shouldStillTimeOutSlowGenerateContent() {
        assertThatThrownBy(() -> client.generate(request, "gemini-2.5-pro", null))
            .isInstanceOfSatisfying(UpstreamException.class,
                e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.TIMEOUT));
    }
}
