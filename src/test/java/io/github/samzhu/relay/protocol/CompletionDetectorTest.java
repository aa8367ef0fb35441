package io.github.samzhu.relay.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.relay.model.Candidate;
import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationResponse;
import io.github.samzhu.relay.model.Part;

class CompletionDetectorTest {

    private final CompletionDetector detector = new CompletionDetector();

    @Test
    void shouldDetectCompleteWhenMarkerPresent() {
        GenerationResponse response = responseWithParts(Part.ofText("Done." + CompletionMarkers.FINISHED_MARKER));

        assertThat(detector.detect(response)).isEqualTo(CompletionStatus.COMPLETE);
    }

    @Test
    void shouldDetectMarkerSplitAcrossParts() {
        GenerationResponse response = responseWithParts(
            Part.ofText("Done.[RESPONSE_"), Part.ofText("FINISHED]"));

        assertThat(detector.detect(response)).isEqualTo(CompletionStatus.COMPLETE);
    }

    @Test
    void shouldDetectIncompleteWhenMarkerMissing() {
        GenerationResponse response = responseWithParts(Part.ofText("Hello wor"));

        assertThat(detector.detect(response)).isEqualTo(CompletionStatus.INCOMPLETE);
    }

    @Test
    void shouldTreatMalformedShapesAsIncomplete() {
        assertThat(detector.detect(null)).isEqualTo(CompletionStatus.INCOMPLETE);
        assertThat(detector.detect(new GenerationResponse(null, null, null, null, null)))
            .isEqualTo(CompletionStatus.INCOMPLETE);
        assertThat(detector.detect(new GenerationResponse(List.of(), null, null, null, null)))
            .isEqualTo(CompletionStatus.INCOMPLETE);
        assertThat(detector.detect(new GenerationResponse(
            List.of(new Candidate(null, "STOP", null, 0)), null, null, null, null)))
            .isEqualTo(CompletionStatus.INCOMPLETE);
        assertThat(detector.detect(new GenerationResponse(
            List.of(new Candidate(new Content("model", List.of()), "STOP", null, 0)), null, null, null, null)))
            .isEqualTo(CompletionStatus.INCOMPLETE);
    }

    private GenerationResponse responseWithParts(Part... parts) {
        Candidate candidate = new Candidate(new Content("model", List.of(parts)), "STOP", null, 0);
        return new GenerationResponse(List.of(candidate), null, null, null, null);
    }
}
