package io.github.samzhu.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * Gemini 上游呼叫失敗
 *
 * <p>兩種來源：
 * <ul>
 *   <li>上游狀態碼失敗 - 不可重試的狀態碼，或可重試狀態碼已用盡重試次數；攜帶狀態碼與回應內容摘要</li>
 *   <li>網路層失敗 - 重試用盡後拋出，攜帶 {@link ErrorCategory}</li>
 * </ul>
 */
public class UpstreamException extends GeminiAntiException {

    private final ErrorCategory category;
    private final int upstreamStatus;
    private final String bodyExcerpt;
    private final HttpStatus httpStatus;

    private UpstreamException(String message, ErrorCategory category, int upstreamStatus,
                              String bodyExcerpt, HttpStatus httpStatus, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.upstreamStatus = upstreamStatus;
        this.bodyExcerpt = bodyExcerpt;
        this.httpStatus = httpStatus;
    }

    /**
     * 上游回應錯誤狀態碼
     *
     * @param status 上游狀態碼
     * @param bodyExcerpt 上游回應內容摘要
     * @param retriesExhausted 是否為可重試狀態碼用盡重試
     */
    public static UpstreamException forStatus(int status, String bodyExcerpt, boolean retriesExhausted) {
        String message = retriesExhausted
            ? "Gemini API error after retries: " + status
            : "Gemini API error: " + status;
        HttpStatus httpStatus = retriesExhausted ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        return new UpstreamException(message, null, status, bodyExcerpt, httpStatus, null);
    }

    /**
     * 網路層失敗（重試用盡）
     */
    public static UpstreamException forNetwork(Throwable cause) {
        ErrorCategory category = UpstreamErrorClassifier.classify(cause);
        return new UpstreamException(category.getMessage(), category, 0, null, category.getHttpStatus(), cause);
    }

    /**
     * 上游回傳 2xx 但內容無法解析
     */
    public static UpstreamException forUnreadableBody(String bodyExcerpt, Throwable cause) {
        return new UpstreamException("Gemini API returned an unreadable response", null, 0,
            bodyExcerpt, HttpStatus.BAD_GATEWAY, cause);
    }

    public boolean isNetworkFailure() {
        return category != null;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    public String getBodyExcerpt() {
        return bodyExcerpt;
    }

    /**
     * 用量事件的 error_type
     */
    public String getErrorType() {
        if (category != null) {
            return category.name();
        }
        return upstreamStatus > 0 ? "HTTP_" + upstreamStatus : "INVALID_RESPONSE";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    @Override
    public String getTitle() {
        return category != null ? category.getMessage() : "Gemini request failed";
    }
}
