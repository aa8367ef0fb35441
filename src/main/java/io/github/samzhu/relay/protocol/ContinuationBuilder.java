package io.github.samzhu.relay.protocol;

import org.springframework.stereotype.Component;

import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.model.GenerationResponse;

/**
 * 建立續寫請求
 *
 * <p>在（已注入完成協定的）原始請求之後附加一個 {@code user} 回合，內容為：
 * <pre>
 * &lt;被截斷的回應文字&gt;
 *
 * &lt;{@link CompletionMarkers#CONTINUATION_PROTOCOL}&gt;
 * </pre>
 *
 * <p>每個被截斷的回應只續寫一次，不會反覆迭代直到完成。
 */
@Component
public class ContinuationBuilder {

    public GenerationRequest build(GenerationResponse incomplete, GenerationRequest augmentedRequest) {
        if (incomplete.firstCandidate().map(candidate -> candidate.content()).isEmpty()) {
            throw new IllegalArgumentException("Incomplete response has no candidate content to continue");
        }
        String incompleteText = incomplete.firstCandidateText();
        Content continuationTurn = Content.userText(incompleteText + "\n\n" + CompletionMarkers.CONTINUATION_PROTOCOL);
        return augmentedRequest.appendContent(continuationTurn);
    }
}
