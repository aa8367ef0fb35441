package io.github.samzhu.relay.config;

import java.net.http.HttpClient;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.filter.GeminiApiKeyInterceptor;
import io.github.samzhu.relay.service.GeminiUpstreamClient;
import io.github.samzhu.relay.service.UpstreamRetryPolicy;

/**
 * Gemini 上游客戶端配置
 *
 * <p>重要：使用 Spring 自動配置的 {@code RestClient.Builder} 來建立 {@code RestClient}，
 * 這樣才能自動啟用 Tracing 功能（Trace Context 傳播、子 Span 建立）。
 *
 * <p>建立兩個 {@code RestClient}：
 * <ul>
 *   <li>{@code geminiRestClient} - 給 {@code generateContent} 使用，{@code request-timeout} 限制整個回應
 *       （header 與 body），逾時會中止請求</li>
 *   <li>{@code geminiStreamRestClient} - 給 {@code streamGenerateContent} 使用，只有連線逾時。
 *       {@link JdkClientHttpRequestFactory} 的 read timeout 會在計時到期時關閉 body，
 *       串流一旦超過時間就會在中途被截斷，因此串流不設定</li>
 * </ul>
 */
@Configuration
public class GeminiClientConfig {

    @Bean
    public RestClient geminiRestClient(RestClient.Builder restClientBuilder, GeminiProperties properties,
                                       GeminiApiKeyInterceptor apiKeyInterceptor) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient(properties));
        requestFactory.setReadTimeout(properties.requestTimeout());

        return restClientBuilder.clone()
            .requestFactory(requestFactory)
            .requestInterceptor(apiKeyInterceptor)
            .build();
    }

    @Bean
    public RestClient geminiStreamRestClient(RestClient.Builder restClientBuilder, GeminiProperties properties,
                                             GeminiApiKeyInterceptor apiKeyInterceptor) {
        return restClientBuilder.clone()
            .requestFactory(new JdkClientHttpRequestFactory(httpClient(properties)))
            .requestInterceptor(apiKeyInterceptor)
            .build();
    }

    @Bean
    public UpstreamRetryPolicy upstreamRetryPolicy(GeminiProperties properties) {
        return UpstreamRetryPolicy.from(properties);
    }

    @Bean
    public GeminiUpstreamClient geminiUpstreamClient(RestClient geminiRestClient, RestClient geminiStreamRestClient,
                                                     GeminiProperties properties, UpstreamRetryPolicy upstreamRetryPolicy,
                                                     ObjectMapper objectMapper) {
        return new GeminiUpstreamClient(geminiRestClient, geminiStreamRestClient, properties,
            upstreamRetryPolicy, objectMapper);
    }

    private HttpClient httpClient(GeminiProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .build();
    }
}
