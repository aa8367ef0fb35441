package io.github.samzhu.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * 客戶端請求錯誤（路徑格式錯誤、模型不支援）
 *
 * <p>在任何上游呼叫之前拋出，不重試。
 */
public class InvalidRequestException extends GeminiAntiException {

    private final String title;

    public InvalidRequestException(String title, String details) {
        super(details);
        this.title = title;
    }

    public static InvalidRequestException invalidModelPath() {
        return new InvalidRequestException("Invalid model path",
            "Expected format: /api/gemini-anti/v1beta/models/{model}:generateContent");
    }

    public static InvalidRequestException unsupportedModel(String model) {
        return new InvalidRequestException("Model not supported",
            "Model '" + model + "' is not supported for anti-truncation");
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public String getTitle() {
        return title;
    }
}
