package ru.oparin.omnihub.model.dto.provider;

import lombok.Value;

/**
 * Фрагмент потокового ответа чат-модели: либо приращение текста, либо итоговое использование токенов.
 */
@Value
public class ChatChunk {

    String delta;

    Integer inputTokens;

    Integer outputTokens;

    public static ChatChunk delta(String text) {
        return new ChatChunk(text, null, null);
    }

    public static ChatChunk usage(Integer inputTokens, Integer outputTokens) {
        return new ChatChunk(null, inputTokens, outputTokens);
    }

    public boolean isUsage() {
        return outputTokens != null || inputTokens != null;
    }

    public boolean hasDelta() {
        return delta != null && !delta.isEmpty();
    }
}
