package ru.oparin.omnihub.model.enums;

/**
 * Режим расходования кредитов в workspace.
 * Для дефолтного (личного) workspace режим игнорируется.
 */
public enum CreditMode {
    SHARED,
    INDIVIDUAL
}
