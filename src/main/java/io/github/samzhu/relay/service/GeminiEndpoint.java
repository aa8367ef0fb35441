package io.github.samzhu.relay.service;

import java.net.URI;

/**
 * Gemini 生成端點
 *
 * <p>URL 格式：{@code {baseUrl}/v1beta/models/{model}:{method}{?query}}，
 * 呼叫端的 query string 原樣附加（例如串流時的 {@code alt=sse}）。
 */
public enum GeminiEndpoint {

    GENERATE_CONTENT("generateContent"),
    STREAM_GENERATE_CONTENT("streamGenerateContent");

    private static final String MODELS_PATH = "/v1beta/models/";

    private final String method;

    GeminiEndpoint(String method) {
        this.method = method;
    }

    public String getMethod() {
        return method;
    }

    public URI uri(String baseUrl, String model, String query) {
        StringBuilder uri = new StringBuilder(baseUrl)
            .append(MODELS_PATH)
            .append(model)
            .append(':')
            .append(method);
        if (query != null && !query.isBlank()) {
            if (!query.startsWith("?")) {
                uri.append('?');
            }
            uri.append(query);
        }
        return URI.create(uri.toString());
    }
}
