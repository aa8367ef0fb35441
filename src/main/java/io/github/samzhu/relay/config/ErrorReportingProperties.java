package io.github.samzhu.relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 錯誤回報配置
 *
 * <p>{@code relay.errors.hide-sensitive-details=true} 時（prod profile），
 * 錯誤訊息若疑似包含金鑰、內部位址等資訊，會以固定文字取代。
 *
 * @param hideSensitiveDetails 是否隱藏敏感錯誤細節
 * @see io.github.samzhu.relay.util.ErrorDetailsSanitizer
 */
@ConfigurationProperties(prefix = "relay.errors")
public record ErrorReportingProperties(
    boolean hideSensitiveDetails
) {}
