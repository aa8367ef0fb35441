package io.github.samzhu.relay.util;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.model.StreamEventRecord;

/**
 * SSE（Server-Sent Events）行解析工具
 *
 * <p>解析 Gemini {@code streamGenerateContent} 串流中的單行資料，支援：
 * <ul>
 *   <li>將 {@code field: value} 行拆成 {@link StreamEventRecord}</li>
 *   <li>{@code data:} 後的空白為選填，{@code data:{...}} 與 {@code data: {...}} 皆可</li>
 *   <li>將 data 內容解析為 JSON 樹</li>
 * </ul>
 *
 * <p>SSE 格式範例：
 * <pre>{@code
 * data: {"candidates":[{"content":{"parts":[{"text":"Hel"}],"role":"model"}}]}
 *
 * data: {"candidates":[{"content":{"parts":[{"text":"lo"}],"role":"model"}}],"usageMetadata":{...}}
 * }</pre>
 *
 * @see StreamEventRecord
 * @see io.github.samzhu.relay.protocol.StreamChunkTransformer
 * @see <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html">SSE Specification</a>
 */
public class SseParser {

    private static final Logger log = LoggerFactory.getLogger(SseParser.class);

    static final int EXCERPT_LENGTH = 100;

    private final ObjectMapper objectMapper;

    public SseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解析 SSE 行
     *
     * @param line SSE 行（不含換行字元）
     * @return 解析結果；空白行、註解行（{@code :} 開頭）或沒有冒號的行返回 null
     */
    public StreamEventRecord parseLine(String line) {
        if (line == null || line.isBlank() || line.startsWith(":")) {
            return null;
        }
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return null;
        }
        String field = line.substring(0, colon);
        String payload = line.substring(colon + 1);
        if (payload.startsWith(" ")) {
            payload = payload.substring(1);
        }
        return new StreamEventRecord(field, payload);
    }

    /**
     * 解析 data 內容為 JSON 樹
     *
     * @param payload data 內容（不含 {@code data:} 前綴）
     * @return JSON 樹，解析失敗返回 null
     */
    public JsonNode parseJson(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }

        try {
            JsonNode node = objectMapper.readTree(payload);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            log.debug("Failed to parse SSE data, passing through: excerpt={}, error={}",
                StringUtils.abbreviate(payload, EXCERPT_LENGTH), e.getMessage());
            return null;
        }
    }
}
