package io.github.samzhu.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Relay 應用程式入口
 *
 * <p>Gemini API 閘道服務，為 Gemini {@code generateContent} / {@code streamGenerateContent} 客戶端提供：
 * <ul>
 *   <li>防截斷協定：偵測被截斷的回應並自動續寫、合併</li>
 *   <li>串流回應的協定標記即時清理</li>
 *   <li>上游狀態碼與網路錯誤的指數退避重試</li>
 *   <li>Token 用量追蹤（CloudEvents 格式發送到訊息佇列）</li>
 *   <li>OpenTelemetry 可觀測性</li>
 * </ul>
 *
 * @see <a href="https://ai.google.dev/api/generate-content">Gemini generateContent API</a>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RelayApplication {

	public static void main(String[] args) {
		SpringApplication.run(RelayApplication.class, args);
	}

}
