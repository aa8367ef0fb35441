package io.github.samzhu.relay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.model.StreamEventRecord;
import io.github.samzhu.relay.util.SseParser;
import io.github.samzhu.relay.util.UsageMetadataExtractor;

/**
 * 串流片段轉換器
 *
 * <p>每個串流請求建立一個實例，逐塊處理上游 {@code text/event-stream} 文字：
 * <ol>
 *   <li>將新區塊接到暫存緩衝區，切出完整的行（以 {@code \n} 分隔）</li>
 *   <li>不以 {@code data:} 開頭的行原樣輸出（附加 {@code \n}）</li>
 *   <li>{@code data:} 內容為空的行原樣輸出</li>
 *   <li>其餘解析為 JSON，移除所有文字片段中的協定標記（不 trim），輸出 {@code data: <json>\n\n}</li>
 *   <li>解析失敗時原樣輸出該行，串流繼續</li>
 * </ol>
 *
 * <p>區塊邊界落在行中間時，未完成的行會保留到下一個區塊或 {@link #flush()}。
 * 輸出順序與輸入順序一致。
 *
 * <p>非執行緒安全，只能由單一串流使用。
 */
public class StreamChunkTransformer {

    private static final String DATA_PREFIX = "data:";

    private final ObjectMapper objectMapper;
    private final SseParser sseParser;
    private final ResponseCleaner responseCleaner;
    private final UsageMetadataExtractor usageExtractor;
    private final StringBuilder pending = new StringBuilder();

    public StreamChunkTransformer(ObjectMapper objectMapper, ResponseCleaner responseCleaner,
                                  UsageMetadataExtractor usageExtractor) {
        this.objectMapper = objectMapper;
        this.sseParser = new SseParser(objectMapper);
        this.responseCleaner = responseCleaner;
        this.usageExtractor = usageExtractor;
    }

    /**
     * 轉換一個上游區塊
     *
     * @param chunk 上游讀到的文字
     * @return 要寫給客戶端的文字，可能為空字串
     */
    public String transform(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return "";
        }
        pending.append(chunk);

        StringBuilder output = new StringBuilder();
        int newline;
        while ((newline = pending.indexOf("\n")) >= 0) {
            String line = pending.substring(0, newline);
            pending.delete(0, newline + 1);
            output.append(transformLine(line));
        }
        return output.toString();
    }

    /**
     * 串流結束時輸出緩衝區中剩餘的不完整行
     */
    public String flush() {
        if (pending.isEmpty()) {
            return "";
        }
        String line = pending.toString();
        pending.setLength(0);
        return transformLine(line);
    }

    private String transformLine(String rawLine) {
        String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        if (!line.startsWith(DATA_PREFIX)) {
            return rawLine + "\n";
        }

        StreamEventRecord record = sseParser.parseLine(line);
        if (record == null || !record.hasPayload()) {
            return rawLine + "\n";
        }

        JsonNode fragment = sseParser.parseJson(record.payload());
        if (fragment == null) {
            return rawLine + "\n";
        }

        usageExtractor.process(fragment);
        responseCleaner.cleanFragment(fragment);
        try {
            return DATA_PREFIX + " " + objectMapper.writeValueAsString(fragment) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream fragment", e);
        }
    }
}
