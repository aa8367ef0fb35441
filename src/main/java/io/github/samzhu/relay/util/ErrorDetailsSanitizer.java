package io.github.samzhu.relay.util;

import java.util.List;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import io.github.samzhu.relay.config.ErrorReportingProperties;

/**
 * 過濾錯誤訊息中的敏感資訊
 *
 * <p>啟用時（{@code relay.errors.hide-sensitive-details=true}），訊息只要符合任一規則，
 * 整段訊息以 {@link #HIDDEN_MESSAGE} 取代：
 * <ul>
 *   <li>包含 key、token、password、secret、auth 等字樣</li>
 *   <li>包含 localhost、127.0.0.1、192.168. 等內部位址</li>
 *   <li>疑似 Base64 編碼的路徑片段（{@code /} 後接 20 字元以上）</li>
 *   <li>32 字元以上的英數字串（可能是金鑰）</li>
 * </ul>
 */
@Component
public class ErrorDetailsSanitizer {

    public static final String HIDDEN_MESSAGE = "Internal service error - details hidden for security";

    private static final List<Pattern> SENSITIVE_PATTERNS = List.of(
        Pattern.compile("key|token|password|secret|auth|api[_-]?key", Pattern.CASE_INSENSITIVE),
        Pattern.compile("localhost|127\\.0\\.0\\.1|192\\.168\\."),
        Pattern.compile("/[a-zA-Z0-9+/=]{20,}"),
        Pattern.compile("[a-zA-Z0-9]{32,}")
    );

    private final boolean enabled;

    public ErrorDetailsSanitizer(ErrorReportingProperties properties) {
        this.enabled = properties.hideSensitiveDetails();
    }

    public String sanitize(String message) {
        if (!enabled || message == null) {
            return message;
        }
        for (Pattern pattern : SENSITIVE_PATTERNS) {
            if (pattern.matcher(message).find()) {
                return HIDDEN_MESSAGE;
            }
        }
        return message;
    }
}
