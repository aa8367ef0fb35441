package io.github.samzhu.relay.exception;

/**
 * 未配置 Gemini API Key
 *
 * <p>在請求送出前由 {@link io.github.samzhu.relay.filter.GeminiApiKeyInterceptor} 拋出，
 * 不重試，對外回應 503。
 */
public class MissingApiKeyException extends IllegalStateException {

    public MissingApiKeyException() {
        super("No Gemini API key configured (gemini.api.key / GEMINI_API_KEY)");
    }
}
