package ru.oparin.omnihub.model.enums;

/**
 * Операции журнала кредитов.
 */
public enum LedgerOperation {
    RESERVE,
    SETTLE,
    REFUND
}
