package io.github.samzhu.relay.service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.config.GeminiProperties;
import io.github.samzhu.relay.exception.UpstreamException;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.model.GenerationResponse;

/**
 * Gemini 上游客戶端
 *
 * <p>一次邏輯呼叫可能包含多次實際請求：
 * <ul>
 *   <li>上游回應可重試的狀態碼（預設 503、403、429）- 依退避時間等待後重試</li>
 *   <li>網路層失敗（連線重置、DNS、拒絕連線、逾時）- 以獨立的計數器重試</li>
 *   <li>不可重試的狀態碼 - 立即拋出 {@link UpstreamException}</li>
 * </ul>
 *
 * <p>兩個計數器的上限都是 {@code maxRetries}，因此 {@code maxRetries = 3} 且上游一直回應 503 時，
 * 總共會送出 4 次請求。
 *
 * <p>API Key 由 {@link io.github.samzhu.relay.filter.GeminiApiKeyInterceptor} 注入 {@code x-goog-api-key} header，
 * 不會出現在 URL。
 *
 * @see UpstreamRetryPolicy
 * @see <a href="https://ai.google.dev/api/generate-content">Gemini generateContent API</a>
 */
public class GeminiUpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiUpstreamClient.class);

    static final int EXCERPT_LENGTH = 500;

    private final RestClient restClient;
    private final RestClient streamRestClient;
    private final String baseUrl;
    private final UpstreamRetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;

    public GeminiUpstreamClient(RestClient restClient, RestClient streamRestClient, GeminiProperties properties,
                                UpstreamRetryPolicy retryPolicy, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.streamRestClient = streamRestClient;
        this.baseUrl = properties.baseUrl();
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
    }

    /**
     * 呼叫 {@code generateContent} 並解析回應
     *
     * @param request 請求（已注入完成協定）
     * @param model 模型名稱
     * @param query 呼叫端 query string，可為 null
     * @return 上游回應
     * @throws UpstreamException 上游失敗或回應無法解析
     */
    public GenerationResponse generate(GenerationRequest request, String model, String query) {
        String body = execute(restClient, GeminiEndpoint.GENERATE_CONTENT, request, model, query, true, this::readBody);
        try {
            return objectMapper.readValue(body, GenerationResponse.class);
        } catch (JsonProcessingException e) {
            throw UpstreamException.forUnreadableBody(StringUtils.abbreviate(body, EXCERPT_LENGTH), e);
        }
    }

    /**
     * 呼叫 {@code streamGenerateContent} 並回傳尚未讀取的串流
     *
     * <p>回傳的串流由呼叫端負責關閉。串流 body 不受 {@code request-timeout} 限制，只有連線逾時。
     *
     * @param request 請求（已注入完成協定）
     * @param model 模型名稱
     * @param query 呼叫端 query string，可為 null
     * @return 已開啟的上游串流
     * @throws UpstreamException 上游失敗
     */
    public UpstreamStream openStream(GenerationRequest request, String model, String query) {
        return execute(streamRestClient, GeminiEndpoint.STREAM_GENERATE_CONTENT, request, model, query, false,
            UpstreamStream::new);
    }

    private <T> T execute(RestClient client, GeminiEndpoint endpoint, GenerationRequest request, String model,
                          String query, boolean closeResponse, ResponseReader<T> reader) {
        URI uri = endpoint.uri(baseUrl, model, query);
        int statusRetries = 0;
        int networkRetries = 0;

        while (true) {
            Attempt<T> attempt;
            try {
                attempt = client.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .exchange((clientRequest, response) -> {
                        int status = response.getStatusCode().value();
                        if (status >= 400) {
                            try (response) {
                                return Attempt.<T>failed(status, readExcerpt(response));
                            }
                        }
                        return Attempt.<T>succeeded(reader.read(response));
                    }, closeResponse);
            } catch (ResourceAccessException e) {
                if (networkRetries < retryPolicy.getMaxRetries()) {
                    log.debug("Network error calling Gemini, retrying: endpoint={}, model={}, attempt={}, delay={}, error={}",
                        endpoint.getMethod(), model, networkRetries + 1, retryPolicy.delayFor(networkRetries), e.getMessage());
                    retryPolicy.pause(networkRetries);
                    networkRetries++;
                    continue;
                }
                log.warn("Network retries exhausted: endpoint={}, model={}, retries={}",
                    endpoint.getMethod(), model, networkRetries);
                throw UpstreamException.forNetwork(e);
            }

            if (attempt.isSuccess()) {
                return attempt.value();
            }

            boolean retryable = retryPolicy.isRetryable(attempt.status());
            if (retryable && statusRetries < retryPolicy.getMaxRetries()) {
                log.debug("Gemini returned retryable status, retrying: endpoint={}, model={}, status={}, attempt={}, delay={}",
                    endpoint.getMethod(), model, attempt.status(), statusRetries + 1, retryPolicy.delayFor(statusRetries));
                retryPolicy.pause(statusRetries);
                statusRetries++;
                continue;
            }

            log.warn("Gemini request failed: endpoint={}, model={}, status={}, statusRetries={}",
                endpoint.getMethod(), model, attempt.status(), statusRetries);
            throw UpstreamException.forStatus(attempt.status(), attempt.excerpt(), retryable);
        }
    }

    private String readBody(ClientHttpResponse response) throws IOException {
        try (InputStream body = response.getBody()) {
            return new String(body.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String readExcerpt(ClientHttpResponse response) throws IOException {
        return StringUtils.abbreviate(readBody(response), EXCERPT_LENGTH);
    }

    @FunctionalInterface
    private interface ResponseReader<T> {
        T read(ClientHttpResponse response) throws IOException;
    }

    private record Attempt<T>(boolean isSuccess, T value, int status, String excerpt) {

        static <T> Attempt<T> succeeded(T value) {
            return new Attempt<>(true, value, 0, null);
        }

        static <T> Attempt<T> failed(int status, String excerpt) {
            return new Attempt<>(false, null, status, excerpt);
        }
    }
}
