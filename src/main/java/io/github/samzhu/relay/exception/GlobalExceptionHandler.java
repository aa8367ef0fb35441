package io.github.samzhu.relay.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.relay.model.GatewayError;
import io.github.samzhu.relay.util.ErrorDetailsSanitizer;

/**
 * 全域異常處理器
 *
 * <p>統一將異常轉換為 {@link GatewayError} 格式，錯誤訊息與細節在 prod 環境會經過
 * {@link ErrorDetailsSanitizer} 過濾。
 *
 * <p>處理的異常類型：
 * <ul>
 *   <li>{@code InvalidRequestException} - 400 Bad Request（路徑格式、模型不支援）</li>
 *   <li>{@code HttpMessageNotReadableException} - 400 Bad Request（請求內容無法解析）</li>
 *   <li>{@code UpstreamException} - 502/503/504（依錯誤分類或上游狀態碼）</li>
 *   <li>{@code MissingApiKeyException} - 503 Service Unavailable（未配置 API Key）</li>
 *   <li>{@code IllegalStateException} - 500 Internal Server Error</li>
 *   <li>{@code Exception} - 500 Internal Server Error（未預期錯誤）</li>
 * </ul>
 *
 * @see GatewayError
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorDetailsSanitizer sanitizer;

    public GlobalExceptionHandler(ErrorDetailsSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    /**
     * 處理客戶端請求錯誤
     */
    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<GatewayError> handleInvalidRequest(InvalidRequestException e) {
        log.warn("Invalid request: {} - {}", e.getTitle(), e.getMessage());
        return error(e.getHttpStatus(), e.getTitle(), e.getMessage());
    }

    /**
     * 處理無法解析的請求內容
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GatewayError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request body", e.getMostSpecificCause().getMessage());
    }

    /**
     * 處理上游失敗
     */
    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<GatewayError> handleUpstream(UpstreamException e) {
        if (e.isNetworkFailure()) {
            log.error("Gemini upstream unreachable: category={}, cause={}",
                e.getCategory(), e.getCause() != null ? e.getCause().getMessage() : "N/A");
            return error(e.getHttpStatus(), e.getTitle(), e.getCause() != null ? e.getCause().getMessage() : null);
        }
        log.error("Gemini upstream failed: upstreamStatus={}, message={}", e.getUpstreamStatus(), e.getMessage());
        String details = e.getBodyExcerpt() != null
            ? e.getMessage() + " - " + e.getBodyExcerpt()
            : e.getMessage();
        return error(e.getHttpStatus(), e.getTitle(), details);
    }

    /**
     * 處理無 API Key 異常
     */
    @ExceptionHandler(MissingApiKeyException.class)
    public ResponseEntity<GatewayError> handleMissingApiKey(MissingApiKeyException e) {
        log.error("Gemini API key missing: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service configuration error", null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<GatewayError> handleIllegalStateException(IllegalStateException e) {
        log.error("Illegal state: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", e.getMessage());
    }

    /**
     * 處理其他未預期異常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<GatewayError> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", e.getMessage());
    }

    private ResponseEntity<GatewayError> error(HttpStatus status, String message, String details) {
        GatewayError body = GatewayError.of(
            sanitizer.sanitize(message), status.value(), sanitizer.sanitize(details));
        return ResponseEntity.status(status).body(body);
    }
}
