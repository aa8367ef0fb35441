package io.github.samzhu.relay.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Gemini {@code generateContent} / {@code streamGenerateContent} 請求
 *
 * <p>僅對閘道需要操作的欄位（{@code contents}、{@code systemInstruction}）做強型別投影，
 * 其餘欄位（tools、generationConfig、safetySettings 等）以 {@link JsonNode} 原樣透傳。
 *
 * <p>不可變：提示詞注入與續寫請求都透過 {@code with*} 方法產生新的請求，
 * 呼叫端傳入的原始請求不會被修改。
 *
 * @param contents 對話回合
 * @param tools 工具宣告（原樣透傳）
 * @param toolConfig 工具配置（原樣透傳）
 * @param generationConfig 生成配置（原樣透傳）
 * @param safetySettings 安全設定（原樣透傳）
 * @param systemInstruction 系統指令
 * @param cachedContent 快取內容名稱
 * @param otherFields 其他未建模的欄位（例如 {@code labels}），原樣透傳
 * @see <a href="https://ai.google.dev/api/generate-content">Gemini generateContent API</a>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationRequest(
    List<Content> contents,
    List<JsonNode> tools,
    JsonNode toolConfig,
    JsonNode generationConfig,
    List<JsonNode> safetySettings,
    Content systemInstruction,
    String cachedContent,
    @JsonAnySetter @JsonAnyGetter Map<String, JsonNode> otherFields
) {
    public GenerationRequest {
        contents = contents == null ? List.of() : List.copyOf(contents);
        otherFields = OtherFields.copyOf(otherFields);
    }

    public GenerationRequest(List<Content> contents, List<JsonNode> tools, JsonNode toolConfig,
                             JsonNode generationConfig, List<JsonNode> safetySettings,
                             Content systemInstruction, String cachedContent) {
        this(contents, tools, toolConfig, generationConfig, safetySettings, systemInstruction, cachedContent, null);
    }

    public static GenerationRequest of(List<Content> contents) {
        return new GenerationRequest(contents, null, null, null, null, null, null);
    }

    public GenerationRequest withSystemInstruction(Content instruction) {
        return new GenerationRequest(contents, tools, toolConfig, generationConfig,
            safetySettings, instruction, cachedContent, otherFields);
    }

    public GenerationRequest appendContent(Content turn) {
        List<Content> newContents = new ArrayList<>(contents);
        newContents.add(turn);
        return new GenerationRequest(newContents, tools, toolConfig, generationConfig,
            safetySettings, systemInstruction, cachedContent, otherFields);
    }
}
