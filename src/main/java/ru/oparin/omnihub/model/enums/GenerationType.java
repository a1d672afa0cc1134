package ru.oparin.omnihub.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Тип генерации (и тип модели в каталоге).
 */
@Getter
@RequiredArgsConstructor
public enum GenerationType {

    IMAGE("image"),
    VIDEO("video"),
    CHAT("chat");

    @JsonValue
    private final String code;

    /**
     * Найти тип по коду ("image", "video", "chat") без учета регистра.
     *
     * @param code код типа
     * @return тип генерации
     * @throws IllegalArgumentException если код не распознан
     */
    @JsonCreator
    public static GenerationType fromCode(String code) {
        if (code != null) {
            for (GenerationType type : values()) {
                if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Неизвестный тип генерации: " + code);
    }
}
