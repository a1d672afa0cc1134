package ru.oparin.omnihub.model.enums;

/**
 * Статус резервирования кредитов.
 * Каждое резервирование закрывается ровно одним переходом в SETTLED или REFUNDED.
 */
public enum ReservationStatus {
    RESERVED,
    SETTLED,
    REFUNDED
}
