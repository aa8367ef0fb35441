package io.github.samzhu.relay.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Gemini 內容片段（part）
 *
 * <p>一個 part 可能是文字、函式呼叫、函式回應或二進位資料。閘道只關心 {@code text}，
 * 其餘欄位以 {@link JsonNode} 原樣透傳，不做結構驗證；未列出的欄位（例如 {@code executableCode}、
 * {@code codeExecutionResult}）收在 {@code otherFields}，序列化時還原到原本的位置層級。
 *
 * @param text 文字內容
 * @param functionCall 函式呼叫（原樣透傳）
 * @param functionResponse 函式回應（原樣透傳）
 * @param inlineData 內嵌資料（原樣透傳）
 * @param fileData 檔案參照（原樣透傳）
 * @param thought 是否為思考內容
 * @param thoughtSignature 思考簽章
 * @param otherFields 其他未建模的欄位
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Part(
    String text,
    JsonNode functionCall,
    JsonNode functionResponse,
    JsonNode inlineData,
    JsonNode fileData,
    Boolean thought,
    String thoughtSignature,
    @JsonAnySetter @JsonAnyGetter Map<String, JsonNode> otherFields
) {
    public Part {
        otherFields = OtherFields.copyOf(otherFields);
    }

    public Part(String text, JsonNode functionCall, JsonNode functionResponse, JsonNode inlineData,
                JsonNode fileData, Boolean thought, String thoughtSignature) {
        this(text, functionCall, functionResponse, inlineData, fileData, thought, thoughtSignature, null);
    }

    public static Part ofText(String text) {
        return new Part(text, null, null, null, null, null, null);
    }

    public boolean hasText() {
        return text != null;
    }

    /**
     * 以新文字取代，保留其他欄位
     */
    public Part withText(String newText) {
        return new Part(newText, functionCall, functionResponse, inlineData, fileData, thought, thoughtSignature,
            otherFields);
    }
}
