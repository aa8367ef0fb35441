package io.github.samzhu.relay.protocol;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import io.github.samzhu.relay.model.Content;
import io.github.samzhu.relay.model.GenerationRequest;
import io.github.samzhu.relay.model.Part;

/**
 * 將完成協定注入請求的系統指令
 *
 * <p>注入規則：
 * <ul>
 *   <li>沒有 {@code systemInstruction} - 建立新的系統指令，內容即為 {@link CompletionMarkers#COMPLETION_MANDATE}</li>
 *   <li>已有系統指令 - 在最後一個文字片段後以空行分隔附加協定，保留呼叫端原文</li>
 *   <li>最後一個片段不是文字（或沒有片段）- 新增一個只含協定的文字片段</li>
 * </ul>
 *
 * <p>純函式：永遠回傳新的請求，不修改傳入的請求。
 */
@Component
public class PromptAugmenter {

    static final String SEPARATOR = "\n\n";

    public GenerationRequest augment(GenerationRequest request) {
        Content instruction = request.systemInstruction();
        if (instruction == null) {
            return request.withSystemInstruction(Content.userText(CompletionMarkers.COMPLETION_MANDATE));
        }
        return request.withSystemInstruction(appendMandate(instruction));
    }

    private Content appendMandate(Content instruction) {
        if (!instruction.hasParts()) {
            return instruction.withParts(List.of(Part.ofText(CompletionMarkers.COMPLETION_MANDATE)));
        }

        List<Part> parts = new ArrayList<>(instruction.parts());
        int last = parts.size() - 1;
        Part lastPart = parts.get(last);
        if (lastPart == null || !lastPart.hasText()) {
            return instruction.appendPart(Part.ofText(CompletionMarkers.COMPLETION_MANDATE));
        }

        parts.set(last, lastPart.withText(lastPart.text() + SEPARATOR + CompletionMarkers.COMPLETION_MANDATE));
        return instruction.withParts(parts);
    }
}
