package io.github.samzhu.relay.config;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gemini API 配置屬性
 *
 * <p>從 application.yaml 中的 {@code gemini.api} 前綴載入配置：
 * <ul>
 *   <li>{@code baseUrl} - Gemini API 基礎 URL（預設: https://generativelanguage.googleapis.com）</li>
 *   <li>{@code key} - Gemini API Key，透過 {@code x-goog-api-key} header 傳遞</li>
 *   <li>{@code allowedModels} - 允許防截斷處理的模型白名單</li>
 *   <li>{@code requestTimeout} - 單次 {@code generateContent} 呼叫逾時（含 body），串流不套用</li>
 *   <li>{@code connectTimeout} - 連線逾時，串流與非串流都套用</li>
 *   <li>{@code maxRetries} / {@code backoffBase} / {@code backoffMax} - 重試與指數退避</li>
 *   <li>{@code retryableStatusCodes} - 需要重試的上游狀態碼</li>
 * </ul>
 *
 * <p>配置範例：
 * <pre>
 * gemini:
 *   api:
 *     base-url: https://generativelanguage.googleapis.com
 *     key: ${GEMINI_API_KEY:}
 *     allowed-models: gemini-2.5-pro,gemini-2.5-flash
 *     max-retries: 3
 * </pre>
 *
 * @param baseUrl Gemini API 基礎 URL
 * @param key Gemini API Key
 * @param allowedModels 模型白名單
 * @param requestTimeout 單次請求逾時
 * @param connectTimeout 連線逾時
 * @param maxRetries 最大重試次數（不含第一次）
 * @param backoffBase 退避基準時間
 * @param backoffMax 退避上限
 * @param retryableStatusCodes 可重試的 HTTP 狀態碼
 * @see io.github.samzhu.relay.service.UpstreamRetryPolicy
 */
@ConfigurationProperties(prefix = "gemini.api")
public record GeminiProperties(
    String baseUrl,
    String key,
    List<String> allowedModels,
    Duration requestTimeout,
    Duration connectTimeout,
    Integer maxRetries,
    Duration backoffBase,
    Duration backoffMax,
    Set<Integer> retryableStatusCodes
) {
    public GeminiProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://generativelanguage.googleapis.com";
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (allowedModels == null || allowedModels.isEmpty()) {
            allowedModels = List.of("gemini-2.5-pro", "gemini-2.5-flash");
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(30);
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(10);
        }
        if (maxRetries == null || maxRetries < 0) {
            maxRetries = 3;
        }
        if (backoffBase == null) {
            backoffBase = Duration.ofSeconds(1);
        }
        if (backoffMax == null) {
            backoffMax = Duration.ofSeconds(30);
        }
        if (retryableStatusCodes == null || retryableStatusCodes.isEmpty()) {
            retryableStatusCodes = Set.of(503, 403, 429);
        }
    }

    /**
     * 以基準 URL 與 API Key 建立其餘使用預設值的配置
     */
    public static GeminiProperties of(String baseUrl, String key) {
        return new GeminiProperties(baseUrl, key, null, null, null, null, null, null, null);
    }

    public boolean hasKey() {
        return key != null && !key.isBlank();
    }

    public boolean isAllowedModel(String model) {
        return model != null && allowedModels.contains(model);
    }
}
