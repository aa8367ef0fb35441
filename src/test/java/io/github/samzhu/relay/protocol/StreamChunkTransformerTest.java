package io.github.samzhu.relay.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.model.UsageEventData;
import io.github.samzhu.relay.util.UsageMetadataExtractor;

class StreamChunkTransformerTest {

    private static final String FRAGMENT =
        "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hi[RESPONSE_FINISHED]\"}],\"role\":\"model\"}}]}";

    private StreamChunkTransformer transformer;
    private UsageMetadataExtractor usageExtractor;

    @BeforeEach
    void setUp() {
        usageExtractor = new UsageMetadataExtractor("gemini-2.5-pro");
        transformer = new StreamChunkTransformer(new ObjectMapper(), new ResponseCleaner(), usageExtractor);
    }

    @Test
    void shouldCleanDataKeepBlankLinesAndPassMalformedThrough() {
        String input = "data: " + FRAGMENT + "\n\ndata: {malformed\n\n";

        String output = transformer.transform(input) + transformer.flush();

        String cleaned = "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hi\"}],\"role\":\"model\"}}]}\n\n";
        assertThat(output).isEqualTo(cleaned + "\n" + "data: {malformed\n" + "\n");
    }

    @Test
    void shouldAcceptDataPrefixWithoutSpace() {
        String output = transformer.transform("data:" + FRAGMENT + "\n");

        assertThat(output).startsWith("data: {").doesNotContain(CompletionMarkers.FINISHED_MARKER);
    }

    @Test
    void shouldReassembleLinesSplitAcrossChunks() {
        String line = "data: " + FRAGMENT + "\n";
        int split = line.indexOf("RESPONSE_");

        String first = transformer.transform(line.substring(0, split));
        String second = transformer.transform(line.substring(split));

        assertThat(first).isEmpty();
        assertThat(second).contains("\"text\":\"Hi\"").endsWith("\n\n");
    }

    @Test
    void shouldFlushTrailingPartialLine() {
        assertThat(transformer.transform("data: " + FRAGMENT)).isEmpty();

        assertThat(transformer.flush()).contains("\"text\":\"Hi\"");
        assertThat(transformer.flush()).isEmpty();
    }

    @Test
    void shouldPassNonDataLinesAndEmptyDataUnchanged() {
        String output = transformer.transform("event: ping\n: keep-alive\ndata:\n");

        assertThat(output).isEqualTo("event: ping\n: keep-alive\ndata:\n");
    }

    @Test
    void shouldNotTrimWhitespaceInsideFragments() {
        String output = transformer.transform(
            "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\" two words \"}]}}]}\n");

        assertThat(output).contains("\"text\":\" two words \"");
    }

    @Test
    void shouldTrackUsageFromFragments() {
        transformer.transform("data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"a\"}]}}],"
            + "\"usageMetadata\":{\"promptTokenCount\":5,\"candidatesTokenCount\":1,\"totalTokenCount\":6}}\n");
        transformer.transform("data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"b\"}]},\"finishReason\":\"STOP\"}],"
            + "\"usageMetadata\":{\"promptTokenCount\":5,\"candidatesTokenCount\":2,\"totalTokenCount\":7},"
            + "\"modelVersion\":\"gemini-2.5-pro-001\"}\n");

        UsageEventData usage = usageExtractor.usageEventBuilder().build();
        assertThat(usage.promptTokens()).isEqualTo(5);
        assertThat(usage.candidatesTokens()).isEqualTo(2);
        assertThat(usage.totalTokens()).isEqualTo(7);
        assertThat(usage.finishReason()).isEqualTo("STOP");
        assertThat(usage.model()).isEqualTo("gemini-2.5-pro-001");
    }
}
