package io.github.samzhu.relay.protocol;

import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.relay.model.Candidate;
import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationResponse;
import io.github.samzhu.relay.model.Part;

/**
 * 移除回應文字中的協定標記
 *
 * <p>移除 {@link CompletionMarkers#FINISHED_MARKER}、{@link CompletionMarkers#INCOMPLETE_MARKER}
 * 與 {@link CompletionMarkers#REMINDER} 的所有出現位置（非錨定的子字串移除）。
 * <ul>
 *   <li>非串流回應：移除後 trim</li>
 *   <li>串流片段：不 trim，避免吃掉片段之間的空白</li>
 * </ul>
 */
@Component
public class ResponseCleaner {

    /**
     * 清理非串流回應，回傳新的回應物件
     */
    public GenerationResponse clean(GenerationResponse response) {
        if (response.candidates() == null || response.candidates().isEmpty()) {
            return response;
        }
        List<Candidate> cleaned = response.candidates().stream()
            .map(this::cleanCandidate)
            .toList();
        return response.withCandidates(cleaned);
    }

    /**
     * 就地清理已解析的串流片段
     *
     * @param fragment 串流 data 行的 JSON
     */
    public void cleanFragment(JsonNode fragment) {
        for (JsonNode candidate : fragment.path("candidates")) {
            for (JsonNode part : candidate.path("content").path("parts")) {
                JsonNode text = part.get("text");
                if (part instanceof ObjectNode partNode && text != null && text.isTextual()) {
                    partNode.put("text", stripMarkers(text.asText()));
                }
            }
        }
    }

    public String stripMarkers(String text) {
        return text
            .replace(CompletionMarkers.FINISHED_MARKER, "")
            .replace(CompletionMarkers.INCOMPLETE_MARKER, "")
            .replace(CompletionMarkers.REMINDER, "");
    }

    private Candidate cleanCandidate(Candidate candidate) {
        if (candidate == null || candidate.content() == null || candidate.content().parts() == null) {
            return candidate;
        }
        Content content = candidate.content();
        List<Part> parts = content.parts().stream()
            .map(part -> part.hasText() ? part.withText(stripMarkers(part.text()).trim()) : part)
            .toList();
        return candidate.withContent(content.withParts(parts));
    }
}
