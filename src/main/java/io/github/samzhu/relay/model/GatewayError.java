package io.github.samzhu.relay.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 閘道錯誤回應格式
 *
 * <p>錯誤結構：
 * <pre>{@code
 * {
 *   "error": "Model not supported",
 *   "status": 400,
 *   "timestamp": "2025-01-01T00:00:00Z",
 *   "details": "Model 'gemini-1.0-pro' is not supported for anti-truncation"
 * }
 * }</pre>
 *
 * <p>{@code details} 為選填，未提供時不輸出。
 *
 * @see io.github.samzhu.relay.exception.GlobalExceptionHandler
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(
    String error,
    int status,
    Instant timestamp,
    String details
) {

    public static GatewayError of(String message, int status, String details) {
        return new GatewayError(message, status, Instant.now(), details);
    }

    public static GatewayError of(String message, int status) {
        return of(message, status, null);
    }
}
