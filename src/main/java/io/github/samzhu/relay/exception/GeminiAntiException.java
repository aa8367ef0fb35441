package io.github.samzhu.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * 防截斷閘道異常基底類別
 *
 * <p>每個子類別決定對應的 HTTP 狀態碼與對外錯誤標題，
 * 由 {@link GlobalExceptionHandler} 轉換為 {@link io.github.samzhu.relay.model.GatewayError}。
 */
public abstract class GeminiAntiException extends RuntimeException {

    protected GeminiAntiException(String message) {
        super(message);
    }

    protected GeminiAntiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 回應給客戶端的 HTTP 狀態
     */
    public abstract HttpStatus getHttpStatus();

    /**
     * 對外錯誤標題（{@code GatewayError.error}）
     */
    public abstract String getTitle();
}
