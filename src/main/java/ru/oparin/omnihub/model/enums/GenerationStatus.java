package ru.oparin.omnihub.model.enums;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Статусы единицы генерации (одна модель в рамках запроса).
 * <p>
 * Переходы строго монотонны:
 * PENDING → RESERVING → DISPATCHED | QUEUED | RUNNING → COMPLETED | FAILED.
 * QUEUED и RUNNING - подстатусы отправленной асинхронной генерации.
 */
public enum GenerationStatus {

    /**
     * Единица создана, кредиты еще не зарезервированы.
     */
    PENDING,

    /**
     * Идет расчет стоимости и резервирование кредитов.
     */
    RESERVING,

    /**
     * Запрос отправлен синхронному или стриминговому провайдеру.
     */
    DISPATCHED,

    /**
     * Асинхронная задача ожидает в очереди провайдера.
     */
    QUEUED,

    /**
     * Асинхронная задача выполняется провайдером.
     */
    RUNNING,

    /**
     * Генерация завершена, кредиты списаны.
     */
    COMPLETED,

    /**
     * Генерация завершилась ошибкой, кредиты возвращены.
     */
    FAILED;

    private static final Set<GenerationStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED);
    private static final Set<GenerationStatus> DISPATCHED_STATES = EnumSet.of(DISPATCHED, QUEUED, RUNNING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Имена нетерминальных статусов для условных UPDATE-запросов.
     */
    public static List<String> activeNames() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL)).stream()
                .map(Enum::name)
                .toList();
    }

    /**
     * Имена статусов отправленной генерации.
     */
    public static List<String> dispatchedNames() {
        return DISPATCHED_STATES.stream()
                .map(Enum::name)
                .toList();
    }
}
