package ru.oparin.omnihub.exception;

import ru.oparin.omnihub.model.enums.GenerationErrorType;

/**
 * Ошибка конфигурации: неположительная цена кредита, модель без адаптера и т.п.
 */
public class ConfigurationException extends GenerationException {

    public ConfigurationException(String message) {
        super(GenerationErrorType.CONFIGURATION_ERROR, message);
    }
}
