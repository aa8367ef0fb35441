package io.github.samzhu.relay.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.relay.model.GenerationResponse;
import io.github.samzhu.relay.model.UsageEventData;

/**
 * Gemini 回應 Token 用量提取工具
 *
 * <p>從 Gemini 回應（或串流片段）中提取 Token 用量與回應資訊，用於建立用量事件。
 *
 * <p>提取邏輯：
 * <ul>
 *   <li>{@code usageMetadata} - 每個片段都可能攜帶，以最後一次出現的值為準（Gemini 的用量為累計值）</li>
 *   <li>{@code modelVersion}、{@code responseId} - 第一次出現後保留最新值</li>
 *   <li>{@code candidates[0].finishReason} - 通常只出現在最後一個片段</li>
 * </ul>
 *
 * <p>執行緒安全：使用 {@link AtomicInteger} 和 {@link AtomicReference}，
 * 但通常每個請求會獨立使用一個實例。
 *
 * <p>使用方式：
 * <pre>{@code
 * UsageMetadataExtractor extractor = new UsageMetadataExtractor(model);
 * fragments.forEach(extractor::process);
 * UsageEventData data = extractor.usageEventBuilder()
 *     .status("success")
 *     .clientId(clientId)
 *     .build();
 * }</pre>
 *
 * @see UsageEventData
 */
public class UsageMetadataExtractor {

    private final String requestedModel;
    private final AtomicInteger promptTokens = new AtomicInteger(0);
    private final AtomicInteger candidatesTokens = new AtomicInteger(0);
    private final AtomicInteger thoughtsTokens = new AtomicInteger(0);
    private final AtomicInteger cachedContentTokens = new AtomicInteger(0);
    private final AtomicInteger totalTokens = new AtomicInteger(0);
    private final AtomicReference<String> modelVersion = new AtomicReference<>();
    private final AtomicReference<String> responseId = new AtomicReference<>();
    private final AtomicReference<String> finishReason = new AtomicReference<>();
    private final long startTime;

    public UsageMetadataExtractor(String requestedModel) {
        this.requestedModel = requestedModel;
        this.startTime = System.currentTimeMillis();
    }

    /**
     * 處理一個串流片段或完整回應的 JSON 樹
     *
     * @param fragment 回應 JSON
     */
    public void process(JsonNode fragment) {
        if (fragment == null) {
            return;
        }

        JsonNode usage = fragment.get("usageMetadata");
        if (usage != null && usage.isObject()) {
            promptTokens.set(usage.path("promptTokenCount").asInt(0));
            candidatesTokens.set(usage.path("candidatesTokenCount").asInt(0));
            thoughtsTokens.set(usage.path("thoughtsTokenCount").asInt(0));
            cachedContentTokens.set(usage.path("cachedContentTokenCount").asInt(0));
            totalTokens.set(usage.path("totalTokenCount").asInt(0));
        }

        setIfText(modelVersion, fragment.get("modelVersion"));
        setIfText(responseId, fragment.get("responseId"));
        setIfText(finishReason, fragment.path("candidates").path(0).get("finishReason"));
    }

    /**
     * 處理非串流回應
     *
     * @param response Gemini 回應
     */
    public void process(GenerationResponse response) {
        if (response == null) {
            return;
        }
        process(response.usageMetadata() != null ? wrapUsage(response) : null);
        if (response.modelVersion() != null) {
            modelVersion.set(response.modelVersion());
        }
        if (response.responseId() != null) {
            responseId.set(response.responseId());
        }
        response.firstCandidate()
            .map(candidate -> candidate.finishReason())
            .ifPresent(finishReason::set);
    }

    /**
     * 建立已填入用量與回應資訊的事件 builder，由呼叫端補上請求層級的欄位
     */
    public UsageEventData.Builder usageEventBuilder() {
        return UsageEventData.builder()
            .model(modelVersion.get() != null ? modelVersion.get() : requestedModel)
            .promptTokens(promptTokens.get())
            .candidatesTokens(candidatesTokens.get())
            .thoughtsTokens(thoughtsTokens.get())
            .cachedContentTokens(cachedContentTokens.get())
            .totalTokens(totalTokens.get())
            .responseId(responseId.get())
            .finishReason(finishReason.get())
            .eventTime(Instant.now())
            .latencyMs(System.currentTimeMillis() - startTime);
    }

    private static void setIfText(AtomicReference<String> target, JsonNode node) {
        if (node != null && node.isTextual()) {
            target.set(node.asText());
        }
    }

    private static JsonNode wrapUsage(GenerationResponse response) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.set("usageMetadata", response.usageMetadata());
        return node;
    }
}
