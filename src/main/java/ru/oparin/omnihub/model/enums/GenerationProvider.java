package ru.oparin.omnihub.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Внешние провайдеры генерации.
 */
@Getter
@RequiredArgsConstructor
public enum GenerationProvider {

    FAL_AI("fal", "Fal.ai"),

    REPLICATE("replicate", "Replicate"),

    OPENROUTER("openrouter", "OpenRouter");

    private final String code;
    private final String displayName;

    /**
     * Найти провайдер по коду ("fal") или имени константы ("FAL_AI").
     *
     * @param code код провайдера
     * @return провайдер или null, если не найден
     */
    public static GenerationProvider fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (GenerationProvider provider : values()) {
            if (provider.code.equalsIgnoreCase(code) || provider.name().equalsIgnoreCase(code)) {
                return provider;
            }
        }
        return null;
    }
}
