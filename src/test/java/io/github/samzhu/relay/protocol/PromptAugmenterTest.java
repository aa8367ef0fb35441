package io.github.samzhu.relay.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.model.Part;

class PromptAugmenterTest {

    private final PromptAugmenter augmenter = new PromptAugmenter();

    @Test
    void shouldCreateSystemInstructionWhenMissing() {
        GenerationRequest request = GenerationRequest.of(List.of(Content.userText("Hi")));

        GenerationRequest augmented = augmenter.augment(request);

        assertThat(augmented.systemInstruction()).isNotNull();
        assertThat(augmented.systemInstruction().joinedText()).isEqualTo(CompletionMarkers.COMPLETION_MANDATE);
        assertThat(augmented.contents()).isEqualTo(request.contents());
        assertThat(request.systemInstruction()).isNull();
    }

    @Test
    void shouldAppendMandateAfterCallerInstruction() {
        GenerationRequest request = GenerationRequest.of(List.of(Content.userText("Hi")))
            .withSystemInstruction(Content.userText("You are a pirate."));

        GenerationRequest augmented = augmenter.augment(request);

        assertThat(augmented.systemInstruction().parts()).hasSize(1);
        assertThat(augmented.systemInstruction().joinedText())
            .isEqualTo("You are a pirate.\n\n" + CompletionMarkers.COMPLETION_MANDATE);
        assertThat(request.systemInstruction().joinedText()).isEqualTo("You are a pirate.");
    }

    @Test
    void shouldAddTextPartWhenLastPartHasNoText() {
        Part inline = new Part(null, null, null, JsonNodeFactory.instance.objectNode().put("mimeType", "image/png"),
            null, null, null);
        GenerationRequest request = GenerationRequest.of(List.of(Content.userText("Hi")))
            .withSystemInstruction(new Content("user", List.of(Part.ofText("Be brief."), inline)));

        GenerationRequest augmented = augmenter.augment(request);

        List<Part> parts = augmented.systemInstruction().parts();
        assertThat(parts).hasSize(3);
        assertThat(parts.get(1)).isEqualTo(inline);
        assertThat(parts.get(2).text()).isEqualTo(CompletionMarkers.COMPLETION_MANDATE);
    }

    @Test
    void shouldAddTextPartWhenInstructionHasNoParts() {
        GenerationRequest request = GenerationRequest.of(List.of(Content.userText("Hi")))
            .withSystemInstruction(new Content("user", null));

        GenerationRequest augmented = augmenter.augment(request);

        assertThat(augmented.systemInstruction().joinedText()).isEqualTo(CompletionMarkers.COMPLETION_MANDATE);
    }

    @Test
    void shouldKeepOriginalPrefixWhenAppliedTwice() {
        GenerationRequest request = GenerationRequest.of(List.of(Content.userText("Hi")))
            .withSystemInstruction(Content.userText("Answer in French."));

        GenerationRequest twice = augmenter.augment(augmenter.augment(request));

        String text = twice.systemInstruction().joinedText();
        assertThat(text).startsWith("Answer in French.");
        assertThat(text).endsWith(CompletionMarkers.COMPLETION_MANDATE);
    }
}
