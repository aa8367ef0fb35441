package io.github.samzhu.relay.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.config.GeminiProperties;

/**
 * Gemini API Key 健康指標
 *
 * <p>健康狀態：
 * <ul>
 *   <li>UP - 已配置 API Key，附上允許的模型清單</li>
 *   <li>DOWN - 未配置 API Key，所有防截斷請求都會回應 503</li>
 * </ul>
 *
 * <p>存取方式：{@code GET /actuator/health}
 *
 * <p>回應範例（健康）：
 * <pre>{@code
 * {
 *   "components": {
 *     "geminiApiKey": {
 *       "status": "UP",
 *       "details": { "allowedModels": ["gemini-2.5-pro", "gemini-2.5-flash"] }
 *     }
 *   }
 * }
 * }</pre>
 */
@Component
public class GeminiApiKeyHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(GeminiApiKeyHealthIndicator.class);

    private final GeminiProperties properties;

    public GeminiApiKeyHealthIndicator(GeminiProperties properties) {
        this.properties = properties;
    }

    @Override
    public Health health() {
        if (!properties.hasKey()) {
            log.warn("Gemini API key health check failed: no key configured");
            return Health.down()
                .withDetail("message", "No Gemini API key configured")
                .build();
        }

        return Health.up()
            .withDetail("allowedModels", properties.allowedModels())
            .build();
    }
}
