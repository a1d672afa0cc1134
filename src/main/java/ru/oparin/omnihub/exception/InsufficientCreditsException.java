package ru.oparin.omnihub.exception;

import lombok.Getter;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.GenerationErrorType;

import java.math.BigDecimal;

@Getter
public class InsufficientCreditsException extends GenerationException {

    private final CreditSourceType source;
    private final BigDecimal required;

    public InsufficientCreditsException(CreditSourceType source, BigDecimal required) {
        super(GenerationErrorType.INSUFFICIENT_CREDITS,
                String.format("Недостаточно кредитов в источнике %s. Требуется: %s", source, required.toPlainString()));
        this.source = source;
        this.required = required;
    }
}
