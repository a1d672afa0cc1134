package ru.oparin.omnihub.model.dto.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Описание выбираемого параметра модели.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Параметр модели")
public class ModelOption {

    @Schema(description = "Тип элемента управления", example = "select")
    private String type;

    @Schema(description = "Название параметра", example = "Размер изображения")
    private String label;

    @JsonProperty("default")
    @Schema(description = "Значение по умолчанию")
    private String defaultValue;

    @Schema(description = "Допустимые значения")
    private List<OptionChoice> choices;

    /**
     * Найти вариант по значению. Сравнение строковое, как значения приходят из запроса.
     */
    public Optional<OptionChoice> findChoice(Object value) {
        if (value == null || choices == null) {
            return Optional.empty();
        }
        String stringValue = String.valueOf(value);
        return choices.stream()
                .filter(choice -> stringValue.equals(choice.getValue()))
                .findFirst();
    }
}
