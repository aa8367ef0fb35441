package io.github.samzhu.relay;

import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import io.github.samzhu.relay.config.ErrorReportingProperties;
import io.github.samzhu.relay.config.GeminiProperties;

/**
 * 應用程式啟動處理器
 *
 * <p>啟動時檢查配置，啟動完成後輸出上游與重試設定摘要。
 */
@Component
public class ApplicationStartup {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartup.class);

    private final Environment env;
    private final GeminiProperties geminiProperties;
    private final ErrorReportingProperties errorReportingProperties;
    private final Optional<BuildProperties> buildProperties;

    public ApplicationStartup(
            Environment env,
            GeminiProperties geminiProperties,
            ErrorReportingProperties errorReportingProperties,
            Optional<BuildProperties> buildProperties) {
        this.env = env;
        this.geminiProperties = geminiProperties;
        this.errorReportingProperties = errorReportingProperties;
        this.buildProperties = buildProperties;
    }

    /**
     * 驗證配置
     *
     * <p>未配置 API Key 時仍可啟動（健康檢查會回報 DOWN），但所有防截斷請求都會回應 503。
     */
    @PostConstruct
    public void validateConfiguration() {
        Collection<String> activeProfiles = Arrays.asList(env.getActiveProfiles());

        if (activeProfiles.contains("dev") && activeProfiles.contains("prod")) {
            log.error("Configuration error: 'dev' and 'prod' profiles must not be active at the same time");
        }
        if (!geminiProperties.hasKey()) {
            log.warn("No Gemini API key configured (gemini.api.key / GEMINI_API_KEY), upstream calls will fail with 503");
        }
        if (activeProfiles.contains("prod") && !errorReportingProperties.hideSensitiveDetails()) {
            log.warn("Running with 'prod' profile but relay.errors.hide-sensitive-details is disabled");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String applicationName = env.getProperty("spring.application.name");
        String serverPort = env.getProperty("server.port", "8080");
        String contextPath = Optional.ofNullable(env.getProperty("server.servlet.context-path"))
            .filter(StringUtils::isNotBlank)
            .orElse("");
        String[] activeProfiles = env.getActiveProfiles();
        String profiles = String.join(",", activeProfiles.length > 0 ? activeProfiles : env.getDefaultProfiles());
        String version = buildProperties.map(BuildProperties::getVersion).orElse("N/A");

        log.info("""

            ----------------------------------------------------------
            \t應用程式 '{}' ({}) 啟動完成！
            \t  端點：   http://localhost:{}{}/api/gemini-anti/v1beta/models/{model}:generateContent
            \t  執行環境：{}
            ----------------------------------------------------------
            \tGemini 上游：
            \t  Base URL：{}
            \t  API Key： {}
            \t  允許模型：{}
            \t  重試：   最多 {} 次，退避 {} ~ {}，狀態碼 {}
            \t  逾時：   連線 {}，請求 {}
            ----------------------------------------------------------""",
            applicationName,
            version,
            serverPort,
            contextPath,
            profiles,
            geminiProperties.baseUrl(),
            geminiProperties.hasKey() ? "configured" : "MISSING",
            geminiProperties.allowedModels(),
            geminiProperties.maxRetries(),
            geminiProperties.backoffBase(),
            geminiProperties.backoffMax(),
            geminiProperties.retryableStatusCodes(),
            geminiProperties.connectTimeout(),
            geminiProperties.requestTimeout()
        );
    }
}
