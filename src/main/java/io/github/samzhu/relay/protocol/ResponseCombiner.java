package io.github.samzhu.relay.protocol;

import java.util.List;

import org.springframework.stereotype.Component;

import io.github.samzhu.relay.model.Candidate;
import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationResponse;
import io.github.samzhu.relay.model.Part;

/**
 * 合併被截斷的回應與續寫回應
 *
 * <p>合併規則：
 * <ul>
 *   <li>文字：續寫文字中第一次出現的截斷文字被移除後 trim；找不到時保留完整續寫文字</li>
 *   <li>角色、finishReason、safetyRatings：取自續寫候選</li>
 *   <li>usageMetadata、modelVersion、responseId 與其他未建模欄位：只取自續寫回應，截斷回應的用量被捨棄</li>
 * </ul>
 *
 * <p>這裡假設模型會逐字延續，若模型改寫了前文，最終文字可能重複或缺漏，此處不做偵測。
 */
@Component
public class ResponseCombiner {

    public GenerationResponse combine(GenerationResponse incomplete, GenerationResponse continuation) {
        Candidate continuationCandidate = continuation.firstCandidate()
            .orElseThrow(() -> new IllegalArgumentException("Continuation response has no candidates"));

        String incompleteText = incomplete.firstCandidateText();
        String combinedText = removeFirst(continuation.firstCandidateText(), incompleteText).trim();

        String role = continuationCandidate.content() != null ? continuationCandidate.content().role() : null;
        Candidate merged = new Candidate(
            new Content(role, List.of(Part.ofText(combinedText))),
            continuationCandidate.finishReason(),
            continuationCandidate.safetyRatings(),
            null,
            continuationCandidate.otherFields()
        );

        return new GenerationResponse(
            List.of(merged),
            continuation.usageMetadata(),
            null,
            continuation.modelVersion(),
            continuation.responseId(),
            continuation.otherFields()
        );
    }

    private String removeFirst(String text, String target) {
        if (target.isEmpty()) {
            return text;
        }
        int index = text.indexOf(target);
        if (index < 0) {
            return text;
        }
        return text.substring(0, index) + text.substring(index + target.length());
    }
}
