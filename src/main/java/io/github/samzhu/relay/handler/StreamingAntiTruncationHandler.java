package io.github.samzhu.relay.handler;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.tracing.Tracer;
import jakarta.servlet.http.HttpServletResponse;

import io.github.samzhu.relay.config.GeminiProperties;
import io.github.samzhu.relay.exception.InvalidRequestException;
import io.github.samzhu.relay.exception.UpstreamErrorClassifier;
import io.github.samzhu.relay.exception.UpstreamException;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.model.UsageEventData;
import io.github.samzhu.relay.protocol.PromptAugmenter;
import io.github.samzhu.relay.protocol.ResponseCleaner;
import io.github.samzhu.relay.protocol.StreamChunkTransformer;
import io.github.samzhu.relay.service.GeminiUpstreamClient;
import io.github.samzhu.relay.service.UpstreamStream;
import io.github.samzhu.relay.service.UsageEventPublisher;
import io.github.samzhu.relay.util.UsageMetadataExtractor;

/**
 * 串流防截斷處理器
 *
 * <p>處理 {@code streamGenerateContent} 請求：
 * <ul>
 *   <li>檢查模型白名單、注入完成協定後開啟上游串流</li>
 *   <li>逐塊讀取上游 {@code text/event-stream}，經 {@link StreamChunkTransformer} 移除協定標記後立即寫回客戶端</li>
 *   <li>串流結束後發送 CloudEvents 格式的用量事件</li>
 * </ul>
 *
 * <p>串流模式不做續寫。開啟上游串流之前的失敗交由
 * {@link io.github.samzhu.relay.exception.GlobalExceptionHandler} 轉為錯誤回應；
 * 開始寫出之後的失敗只記錄日誌並結束串流。
 *
 * <p>在請求所在的 Virtual Thread 上同步寫出，一次讀一塊、寫一塊並 flush，
 * Trace Context 全程留在同一執行緒。
 *
 * @see NonStreamingAntiTruncationHandler
 */
@Component
public class StreamingAntiTruncationHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamingAntiTruncationHandler.class);

    static final int BUFFER_SIZE = 8192;

    private final GeminiProperties properties;
    private final GeminiUpstreamClient upstreamClient;
    private final PromptAugmenter promptAugmenter;
    private final ResponseCleaner responseCleaner;
    private final UsageEventPublisher usageEventPublisher;
    private final ObjectMapper objectMapper;
    private final Tracer tracer;

    public StreamingAntiTruncationHandler(
            GeminiProperties properties,
            GeminiUpstreamClient upstreamClient,
            PromptAugmenter promptAugmenter,
            ResponseCleaner responseCleaner,
            UsageEventPublisher usageEventPublisher,
            ObjectMapper objectMapper,
            Tracer tracer) {
        this.properties = properties;
        this.upstreamClient = upstreamClient;
        this.promptAugmenter = promptAugmenter;
        this.responseCleaner = responseCleaner;
        this.usageEventPublisher = usageEventPublisher;
        this.objectMapper = objectMapper;
        this.tracer = tracer;
    }

    /**
     * 處理串流請求，直接寫出到 servlet 回應
     *
     * @param model 模型名稱（從路徑解析）
     * @param request 客戶端請求
     * @param query 客戶端 query string（例如 {@code alt=sse}），可為 null
     * @param clientId 客戶端識別
     * @param servletResponse 寫出串流的 servlet 回應
     * @throws InvalidRequestException 模型不在白名單
     * @throws UpstreamException 開啟上游串流失敗
     */
    public void handle(String model, GenerationRequest request, String query, String clientId,
                       HttpServletResponse servletResponse) {
        if (!properties.isAllowedModel(model)) {
            throw InvalidRequestException.unsupportedModel(model);
        }

        String traceId = getCurrentTraceId();
        UsageMetadataExtractor usageExtractor = new UsageMetadataExtractor(model);
        GenerationRequest augmented = promptAugmenter.augment(request);

        UpstreamStream upstream;
        try {
            upstream = upstreamClient.openStream(augmented, model, query);
        } catch (UpstreamException e) {
            publishUsageEvent(usageExtractor, "error", e.getErrorType(), clientId, traceId);
            throw e;
        }

        servletResponse.setStatus(HttpServletResponse.SC_OK);
        servletResponse.setContentType(MediaType.TEXT_EVENT_STREAM_VALUE);
        servletResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());
        servletResponse.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
        servletResponse.setHeader("X-Accel-Buffering", "no");

        StreamChunkTransformer transformer = new StreamChunkTransformer(objectMapper, responseCleaner, usageExtractor);
        String status = "success";
        String errorType = null;

        try (upstream; Reader reader = new InputStreamReader(upstream.getBody(), StandardCharsets.UTF_8)) {
            OutputStream output = servletResponse.getOutputStream();
            char[] buffer = new char[BUFFER_SIZE];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                write(output, transformer.transform(new String(buffer, 0, read)));
            }
            write(output, transformer.flush());
        } catch (IOException e) {
            if (isClientDisconnectedException(e)) {
                log.warn("Client disconnected during streaming: {}", e.getMessage());
                status = "client_disconnected";
            } else {
                log.error("IO error during streaming: {}", e.getMessage(), e);
                status = "error";
                errorType = UpstreamErrorClassifier.classify(e).name();
            }
        } catch (RuntimeException e) {
            if (isClientDisconnectedException(e)) {
                log.warn("Client disconnected during streaming: {}", e.getMessage());
                status = "client_disconnected";
            } else {
                log.error("Unexpected error during streaming: {}", e.getMessage(), e);
                status = "error";
                errorType = e.getClass().getSimpleName();
            }
        } finally {
            publishUsageEvent(usageExtractor, status, errorType, clientId, traceId);
        }
    }

    private void write(OutputStream output, String text) throws IOException {
        if (text.isEmpty()) {
            return;
        }
        output.write(text.getBytes(StandardCharsets.UTF_8));
        output.flush();
    }

    private void publishUsageEvent(UsageMetadataExtractor usageExtractor, String status, String errorType,
                                   String clientId, String traceId) {
        UsageEventData eventData = usageExtractor.usageEventBuilder()
            .clientId(clientId)
            .stream(true)
            .status(status)
            .errorType(errorType)
            .traceId(traceId)
            .build();
        usageEventPublisher.publish(eventData);

        log.info("Token usage: clientId={}, model={}, promptTokens={}, candidatesTokens={}, totalTokens={}, status={}, latencyMs={}",
            clientId, eventData.model(), eventData.promptTokens(), eventData.candidatesTokens(),
            eventData.totalTokens(), status, eventData.latencyMs());
    }

    /**
     * 取得當前 OpenTelemetry Trace ID
     */
    private String getCurrentTraceId() {
        var currentSpan = tracer.currentSpan();
        if (currentSpan != null && currentSpan.context() != null) {
            return currentSpan.context().traceId();
        }
        return null;
    }

    /**
     * 檢查異常是否為客戶端斷開連接導致
     * <p>常見情況：
     * <ul>
     *   <li>Broken pipe - 客戶端關閉連接後伺服器嘗試寫入</li>
     *   <li>ClientAbortException - Tomcat 檢測到客戶端中斷</li>
     *   <li>AsyncRequestNotUsableException - Spring 偵測到回應已無法使用</li>
     * </ul>
     */
    private boolean isClientDisconnectedException(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String className = current.getClass().getName();
            if (className.contains("ClientAbortException") || className.contains("AsyncRequestNotUsableException")) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lowerMessage = message.toLowerCase();
                if (lowerMessage.contains("broken pipe") || lowerMessage.contains("client disconnected")) {
                    return true;
                }
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }
}
