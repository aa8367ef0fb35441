package io.github.samzhu.relay.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Gemini 生成回應
 *
 * <p>閘道一律只操作第一個候選（index 0）；{@code usageMetadata} 與 {@code promptFeedback}
 * 不解析內容，原樣透傳。
 *
 * @param candidates 回應候選
 * @param usageMetadata Token 用量（原樣透傳）
 * @param promptFeedback 提示詞回饋（原樣透傳）
 * @param modelVersion 實際回應的模型版本
 * @param responseId 上游回應 ID
 * @param otherFields 其他未建模的欄位，原樣透傳
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationResponse(
    List<Candidate> candidates,
    JsonNode usageMetadata,
    JsonNode promptFeedback,
    String modelVersion,
    String responseId,
    @JsonAnySetter @JsonAnyGetter Map<String, JsonNode> otherFields
) {
    public GenerationResponse {
        otherFields = OtherFields.copyOf(otherFields);
    }

    public GenerationResponse(List<Candidate> candidates, JsonNode usageMetadata, JsonNode promptFeedback,
                              String modelVersion, String responseId) {
        this(candidates, usageMetadata, promptFeedback, modelVersion, responseId, null);
    }

    /**
     * 取得第一個候選
     */
    @JsonIgnore
    public Optional<Candidate> firstCandidate() {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(candidates.get(0));
    }

    /**
     * 第一個候選的完整文字，沒有候選或內容時為空字串
     */
    @JsonIgnore
    public String firstCandidateText() {
        return firstCandidate()
            .map(Candidate::content)
            .map(Content::joinedText)
            .orElse("");
    }

    public GenerationResponse withCandidates(List<Candidate> newCandidates) {
        return new GenerationResponse(newCandidates, usageMetadata, promptFeedback, modelVersion, responseId,
            otherFields);
    }
}
