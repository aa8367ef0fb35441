package io.github.samzhu.relay.filter;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.config.GeminiProperties;
import io.github.samzhu.relay.exception.MissingApiKeyException;

/**
 * Gemini API Key 注入攔截器
 *
 * <p>套用在上游 {@code RestClient}，對每個送往 Gemini 的請求：
 * <ul>
 *   <li>移除客戶端可能帶來的 {@code Authorization} 與 {@code x-goog-api-key} header</li>
 *   <li>注入配置的 API Key 到 {@code x-goog-api-key} header</li>
 * </ul>
 *
 * <p>未配置 API Key 時在送出任何位元組之前拋出 {@link MissingApiKeyException}。
 *
 * @see io.github.samzhu.relay.config.GeminiClientConfig
 */
@Component
public class GeminiApiKeyInterceptor implements ClientHttpRequestInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GeminiApiKeyInterceptor.class);

    public static final String API_KEY_HEADER = "x-goog-api-key";

    private final GeminiProperties properties;

    public GeminiApiKeyInterceptor(GeminiProperties properties) {
        this.properties = properties;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        if (!properties.hasKey()) {
            log.error("No Gemini API key available, refusing to call {}", request.getURI().getPath());
            throw new MissingApiKeyException();
        }

        request.getHeaders().remove("Authorization");
        request.getHeaders().set(API_KEY_HEADER, properties.key());
        return execution.execute(request, body);
    }
}
