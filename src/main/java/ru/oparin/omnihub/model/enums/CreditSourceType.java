package ru.oparin.omnihub.model.enums;

/**
 * Источник кредитов, с которого оплачивается единица генерации.
 */
public enum CreditSourceType {

    /**
     * Личный баланс пользователя (в том числе в дефолтном workspace).
     */
    PERSONAL,

    /**
     * Общий пул workspace в режиме shared.
     */
    WORKSPACE,

    /**
     * Индивидуальная аллокация участника workspace в режиме individual.
     */
    ALLOCATED
}
