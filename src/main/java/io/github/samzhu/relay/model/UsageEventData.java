package io.github.samzhu.relay.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 用量事件資料（CloudEvents data payload）
 *
 * <p>記錄每次 Gemini 呼叫的 Token 用量與請求資訊，作為 CloudEvents 的 data 欄位發送到訊息佇列。
 * <b>Relay 只發布上游 {@code usageMetadata} 的原始數據，不進行任何計算。</b>
 *
 * <h3>Token 欄位對應（Gemini {@code usageMetadata}）</h3>
 * <ul>
 *   <li>{@code prompt_tokens} - {@code promptTokenCount}</li>
 *   <li>{@code candidates_tokens} - {@code candidatesTokenCount}</li>
 *   <li>{@code thoughts_tokens} - {@code thoughtsTokenCount}（2.5 系列思考模型）</li>
 *   <li>{@code cached_content_tokens} - {@code cachedContentTokenCount}</li>
 *   <li>{@code total_tokens} - {@code totalTokenCount}</li>
 * </ul>
 *
 * <p>非串流請求觸發續寫時（{@code continued = true}），用量只取自續寫回應，
 * 與回傳給客戶端的 {@code usageMetadata} 一致。
 *
 * @see io.github.samzhu.relay.service.UsageEventPublisher
 * @see <a href="https://ai.google.dev/api/generate-content#UsageMetadata">Gemini UsageMetadata</a>
 */
public record UsageEventData(
    // === 核心用量 ===
    String model,

    @JsonProperty("prompt_tokens")
    int promptTokens,

    @JsonProperty("candidates_tokens")
    int candidatesTokens,

    @JsonProperty("thoughts_tokens")
    int thoughtsTokens,

    @JsonProperty("cached_content_tokens")
    int cachedContentTokens,

    @JsonProperty("total_tokens")
    int totalTokens,

    // === 請求資訊 ===
    @JsonProperty("client_id")
    String clientId,

    @JsonProperty("event_time")
    Instant eventTime,

    @JsonProperty("response_id")
    String responseId,

    @JsonProperty("latency_ms")
    long latencyMs,

    boolean stream,

    boolean continued,

    @JsonProperty("finish_reason")
    String finishReason,

    // === 狀態追蹤 ===
    String status,

    @JsonProperty("error_type")
    String errorType,

    // === 運維資訊 ===
    @JsonProperty("trace_id")
    String traceId
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String model;
        private int promptTokens;
        private int candidatesTokens;
        private int thoughtsTokens;
        private int cachedContentTokens;
        private int totalTokens;
        private String clientId;
        private Instant eventTime;
        private String responseId;
        private long latencyMs;
        private boolean stream;
        private boolean continued;
        private String finishReason;
        private String status = "success";
        private String errorType;
        private String traceId;

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder promptTokens(int promptTokens) {
            this.promptTokens = promptTokens;
            return this;
        }

        public Builder candidatesTokens(int candidatesTokens) {
            this.candidatesTokens = candidatesTokens;
            return this;
        }

        public Builder thoughtsTokens(int thoughtsTokens) {
            this.thoughtsTokens = thoughtsTokens;
            return this;
        }

        public Builder cachedContentTokens(int cachedContentTokens) {
            this.cachedContentTokens = cachedContentTokens;
            return this;
        }

        public Builder totalTokens(int totalTokens) {
            this.totalTokens = totalTokens;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder eventTime(Instant eventTime) {
            this.eventTime = eventTime;
            return this;
        }

        public Builder responseId(String responseId) {
            this.responseId = responseId;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder continued(boolean continued) {
            this.continued = continued;
            return this;
        }

        public Builder finishReason(String finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder errorType(String errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public UsageEventData build() {
            return new UsageEventData(
                model, promptTokens, candidatesTokens, thoughtsTokens,
                cachedContentTokens, totalTokens,
                clientId, eventTime, responseId, latencyMs, stream, continued,
                finishReason, status, errorType, traceId
            );
        }
    }
}
