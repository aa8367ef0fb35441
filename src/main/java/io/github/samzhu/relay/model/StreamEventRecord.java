package io.github.samzhu.relay.model;

/**
 * SSE 事件行
 *
 * <p>上游串流的每一行 {@code field: value} 解析為一筆記錄，只存在於單次轉換週期內，不會保存。
 *
 * <p>SSE 格式範例：
 * <pre>{@code
 * data: {"candidates":[{"content":{"parts":[{"text":"Hello"}],"role":"model"}}]}
 *
 * }</pre>
 *
 * @param field 欄位名稱（{@code data}、{@code event}、{@code id} 等）
 * @param payload 冒號之後的內容（已去除一個前導空白）
 * @see io.github.samzhu.relay.util.SseParser
 */
public record StreamEventRecord(
    String field,
    String payload
) {
    public static final String DATA_FIELD = "data";

    public boolean isData() {
        return DATA_FIELD.equals(field);
    }

    public boolean hasPayload() {
        return payload != null && !payload.isBlank();
    }
}
