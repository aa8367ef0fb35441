package io.github.samzhu.relay.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Gemini 對話回合（turn）
 *
 * <p>由角色（{@code user} / {@code model}）與依序排列的 {@link Part} 組成，
 * 同時用於請求的 {@code contents}、{@code systemInstruction} 與回應候選的 {@code content}。
 *
 * @param role 角色
 * @param parts 內容片段
 * @param otherFields 其他未建模的欄位
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Content(
    String role,
    List<Part> parts,
    @JsonAnySetter @JsonAnyGetter Map<String, JsonNode> otherFields
) {
    public Content {
        parts = parts == null ? null : List.copyOf(parts);
        otherFields = OtherFields.copyOf(otherFields);
    }

    public Content(String role, List<Part> parts) {
        this(role, parts, null);
    }

    public static Content userText(String text) {
        return new Content("user", List.of(Part.ofText(text)));
    }

    /**
     * 依序串接所有文字片段，非文字片段視為空字串
     */
    @JsonIgnore
    public String joinedText() {
        if (parts == null) {
            return "";
        }
        return parts.stream()
            .map(part -> part.text() != null ? part.text() : "")
            .collect(Collectors.joining());
    }

    @JsonIgnore
    public boolean hasParts() {
        return parts != null && !parts.isEmpty();
    }

    public Content withParts(List<Part> newParts) {
        return new Content(role, newParts, otherFields);
    }

    public Content appendPart(Part part) {
        List<Part> newParts = new ArrayList<>(parts != null ? parts : List.of());
        newParts.add(part);
        return new Content(role, newParts, otherFields);
    }
}
