package io.github.samzhu.relay.protocol;

import org.springframework.stereotype.Component;

import io.github.samzhu.relay.model.Candidate;
import io.github.samzhu.relay.model.GenerationResponse;

/**
 * 判斷上游回應是否完整
 *
 * <p>只有同時滿足以下條件才是 {@link CompletionStatus#COMPLETE}：
 * <ol>
 *   <li>至少有一個候選</li>
 *   <li>第一個候選的內容至少有一個片段</li>
 *   <li>所有文字片段依序串接後包含 {@link CompletionMarkers#FINISHED_MARKER}</li>
 * </ol>
 *
 * <p>其他任何形狀（缺候選、缺內容、缺片段）一律視為 {@link CompletionStatus#INCOMPLETE}，不拋出例外。
 */
@Component
public class CompletionDetector {

    public CompletionStatus detect(GenerationResponse response) {
        if (response == null) {
            return CompletionStatus.INCOMPLETE;
        }
        boolean complete = response.firstCandidate()
            .map(Candidate::content)
            .filter(content -> content.hasParts())
            .map(content -> content.joinedText().contains(CompletionMarkers.FINISHED_MARKER))
            .orElse(false);
        return complete ? CompletionStatus.COMPLETE : CompletionStatus.INCOMPLETE;
    }
}
