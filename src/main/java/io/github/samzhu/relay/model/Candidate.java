package io.github.samzhu.relay.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Gemini 回應候選
 *
 * @param content 候選內容
 * @param finishReason 結束原因（STOP、MAX_TOKENS、SAFETY 等）
 * @param safetyRatings 安全評分（原樣透傳）
 * @param index 候選索引
 * @param otherFields 其他未建模的欄位（citationMetadata、groundingMetadata 等），原樣透傳
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Candidate(
    Content content,
    String finishReason,
    List<JsonNode> safetyRatings,
    Integer index,
    @JsonAnySetter @JsonAnyGetter Map<String, JsonNode> otherFields
) {
    public Candidate {
        otherFields = OtherFields.copyOf(otherFields);
    }

    public Candidate(Content content, String finishReason, List<JsonNode> safetyRatings, Integer index) {
        this(content, finishReason, safetyRatings, index, null);
    }

    public Candidate withContent(Content newContent) {
        return new Candidate(newContent, finishReason, safetyRatings, index, otherFields);
    }
}
