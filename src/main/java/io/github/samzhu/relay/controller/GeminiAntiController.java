package io.github.samzhu.relay.controller;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import io.github.samzhu.relay.exception.InvalidRequestException;
import io.github.samzhu.relay.handler.NonStreamingAntiTruncationHandler;
import io.github.samzhu.relay.handler.StreamingAntiTruncationHandler;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.model.GenerationResponse;

/**
 * Gemini 防截斷 API 入口
 *
 * <p>路徑格式：{@code POST /api/gemini-anti/{version}/models/{model}:{action}}
 * <ul>
 *   <li>{@code generateContent} - 非串流，必要時自動續寫</li>
 *   <li>{@code streamGenerateContent} - 串流（通常搭配 {@code ?alt=sse}），即時移除協定標記</li>
 * </ul>
 *
 * <p>客戶端識別依序取自 {@code X-Forwarded-For} 第一個位址、{@code X-Real-IP}，都沒有時為 {@code unknown}。
 *
 * @see NonStreamingAntiTruncationHandler
 * @see StreamingAntiTruncationHandler
 */
@RestController
@RequestMapping("/api/gemini-anti")
public class GeminiAntiController {

    private static final Logger log = LoggerFactory.getLogger(GeminiAntiController.class);

    private static final Pattern MODEL_PATTERN = Pattern.compile("/models/([^:/]+):");
    private static final String STREAM_ACTION = "streamGenerateContent";
    private static final String UNKNOWN_CLIENT = "unknown";

    private final NonStreamingAntiTruncationHandler nonStreamingHandler;
    private final StreamingAntiTruncationHandler streamingHandler;

    public GeminiAntiController(NonStreamingAntiTruncationHandler nonStreamingHandler,
                                StreamingAntiTruncationHandler streamingHandler) {
        this.nonStreamingHandler = nonStreamingHandler;
        this.streamingHandler = streamingHandler;
    }

    /**
     * 處理防截斷請求
     *
     * <p>串流請求直接寫出到 {@code servletResponse}，此時回傳 null。
     */
    @PostMapping("/**")
    public ResponseEntity<GenerationResponse> generate(@RequestBody GenerationRequest body,
                                                       HttpServletRequest servletRequest,
                                                       HttpServletResponse servletResponse) {
        String path = servletRequest.getRequestURI();
        String model = extractModel(path);
        String clientId = resolveClientId(servletRequest);
        String query = servletRequest.getQueryString();
        boolean streaming = path.contains(STREAM_ACTION);

        log.debug("Routing anti-truncation request: model={}, streaming={}, clientId={}", model, streaming, clientId);

        if (streaming) {
            streamingHandler.handle(model, body, query, clientId, servletResponse);
            return null;
        }
        return nonStreamingHandler.handle(model, body, query, clientId);
    }

    static String extractModel(String path) {
        Matcher matcher = MODEL_PATTERN.matcher(path);
        if (!matcher.find()) {
            throw InvalidRequestException.invalidModelPath();
        }
        return matcher.group(1);
    }

    static String resolveClientId(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return UNKNOWN_CLIENT;
    }
}
