package io.github.samzhu.relay.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import io.micrometer.tracing.Tracer;

import io.github.samzhu.relay.config.GeminiProperties;
import io.github.samzhu.relay.exception.InvalidRequestException;
import io.github.samzhu.relay.exception.UpstreamException;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.model.GenerationResponse;
import io.github.samzhu.relay.model.UsageEventData;
import io.github.samzhu.relay.protocol.CompletionDetector;
import io.github.samzhu.relay.protocol.CompletionStatus;
import io.github.samzhu.relay.protocol.ContinuationBuilder;
import io.github.samzhu.relay.protocol.PromptAugmenter;
import io.github.samzhu.relay.protocol.ResponseCleaner;
import io.github.samzhu.relay.protocol.ResponseCombiner;
import io.github.samzhu.relay.service.GeminiUpstreamClient;
import io.github.samzhu.relay.service.UsageEventPublisher;
import io.github.samzhu.relay.util.UsageMetadataExtractor;

/**
 * 非串流防截斷處理器
 *
 * <p>處理 {@code generateContent} 請求，流程：
 * <ol>
 *   <li>檢查模型白名單</li>
 *   <li>注入完成協定到系統指令</li>
 *   <li>呼叫上游並檢查回應是否包含完成標記</li>
 *   <li>完整：移除標記後回傳</li>
 *   <li>被截斷：建立續寫請求、再呼叫一次上游、合併兩段回應、移除標記後回傳</li>
 * </ol>
 *
 * <p>續寫步驟的任何失敗都只記錄錯誤，並以 200 回傳原本被截斷的回應。
 * 每個請求只續寫一次。
 *
 * @see StreamingAntiTruncationHandler
 */
@Component
public class NonStreamingAntiTruncationHandler {

    private static final Logger log = LoggerFactory.getLogger(NonStreamingAntiTruncationHandler.class);

    private final GeminiProperties properties;
    private final GeminiUpstreamClient upstreamClient;
    private final PromptAugmenter promptAugmenter;
    private final CompletionDetector completionDetector;
    private final ContinuationBuilder continuationBuilder;
    private final ResponseCombiner responseCombiner;
    private final ResponseCleaner responseCleaner;
    private final UsageEventPublisher usageEventPublisher;
    private final Tracer tracer;

    public NonStreamingAntiTruncationHandler(
            GeminiProperties properties,
            GeminiUpstreamClient upstreamClient,
            PromptAugmenter promptAugmenter,
            CompletionDetector completionDetector,
            ContinuationBuilder continuationBuilder,
            ResponseCombiner responseCombiner,
            ResponseCleaner responseCleaner,
            UsageEventPublisher usageEventPublisher,
            Tracer tracer) {
        this.properties = properties;
        this.upstreamClient = upstreamClient;
        this.promptAugmenter = promptAugmenter;
        this.completionDetector = completionDetector;
        this.continuationBuilder = continuationBuilder;
        this.responseCombiner = responseCombiner;
        this.responseCleaner = responseCleaner;
        this.usageEventPublisher = usageEventPublisher;
        this.tracer = tracer;
    }

    /**
     * 處理非串流請求
     *
     * @param model 模型名稱（從路徑解析）
     * @param request 客戶端請求
     * @param query 客戶端 query string，可為 null
     * @param clientId 客戶端識別
     * @return 清理後的回應
     * @throws InvalidRequestException 模型不在白名單
     * @throws UpstreamException 第一次上游呼叫失敗
     */
    public ResponseEntity<GenerationResponse> handle(String model, GenerationRequest request,
                                                     String query, String clientId) {
        if (!properties.isAllowedModel(model)) {
            throw InvalidRequestException.unsupportedModel(model);
        }

        String traceId = getCurrentTraceId();
        UsageMetadataExtractor usageExtractor = new UsageMetadataExtractor(model);
        String status = "error";
        String errorType = null;
        boolean continued = false;

        try {
            GenerationRequest augmented = promptAugmenter.augment(request);
            GenerationResponse first = upstreamClient.generate(augmented, model, query);

            GenerationResponse result;
            if (completionDetector.detect(first) == CompletionStatus.COMPLETE) {
                usageExtractor.process(first);
                result = responseCleaner.clean(first);
            } else {
                ContinuationOutcome outcome = continueGeneration(first, augmented, model, query, usageExtractor);
                continued = outcome.continued();
                result = outcome.response();
            }

            status = "success";
            return ResponseEntity.ok(result);
        } catch (UpstreamException e) {
            errorType = e.getErrorType();
            throw e;
        } catch (RuntimeException e) {
            errorType = e.getClass().getSimpleName();
            throw e;
        } finally {
            publishUsageEvent(usageExtractor, status, errorType, continued, clientId, traceId);
        }
    }

    private ContinuationOutcome continueGeneration(GenerationResponse incomplete, GenerationRequest augmented,
                                                   String model, String query,
                                                   UsageMetadataExtractor usageExtractor) {
        log.info("Incomplete response detected, requesting continuation: model={}, finishReason={}, textLength={}",
            model,
            incomplete.firstCandidate().map(candidate -> candidate.finishReason()).orElse(null),
            incomplete.firstCandidateText().length());

        try {
            GenerationRequest continuationRequest = continuationBuilder.build(incomplete, augmented);
            GenerationResponse continuation = upstreamClient.generate(continuationRequest, model, query);
            GenerationResponse combined = responseCombiner.combine(incomplete, continuation);
            usageExtractor.process(continuation);
            return new ContinuationOutcome(responseCleaner.clean(combined), true);
        } catch (Exception e) {
            log.error("Continuation failed, returning original incomplete response: model={}, error={}",
                model, e.getMessage(), e);
            usageExtractor.process(incomplete);
            return new ContinuationOutcome(incomplete, false);
        }
    }

    private void publishUsageEvent(UsageMetadataExtractor usageExtractor, String status, String errorType,
                                   boolean continued, String clientId, String traceId) {
        UsageEventData eventData = usageExtractor.usageEventBuilder()
            .clientId(clientId)
            .stream(false)
            .continued(continued)
            .status(status)
            .errorType(errorType)
            .traceId(traceId)
            .build();
        usageEventPublisher.publish(eventData);

        log.info("Token usage: clientId={}, model={}, promptTokens={}, candidatesTokens={}, totalTokens={}, continued={}, latencyMs={}",
            clientId, eventData.model(), eventData.promptTokens(), eventData.candidatesTokens(),
            eventData.totalTokens(), continued, eventData.latencyMs());
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

    private record ContinuationOutcome(GenerationResponse response, boolean continued) {
    }
}
