package ru.oparin.omnihub.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.oparin.omnihub.config.properties.GenerationProperties;
import ru.oparin.omnihub.service.GenerationOrchestrator;

/**
 * Планировщик, доводящий асинхронные генерации, которые остались без наблюдателя
 * (перезапуск приложения, потерянный webhook).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AsyncGenerationWatchdog {

    private final GenerationOrchestrator generationOrchestrator;
    private final GenerationProperties generationProperties;

    @Scheduled(fixedDelayString = "${app.generation.watchdog.interval-ms:60000}",
            initialDelayString = "${app.generation.watchdog.interval-ms:60000}")
    public void recoverStaleUnits() {
        if (!generationProperties.getWatchdog().isEnabled()) {
            return;
        }
        log.debug("Проверка зависших генераций по расписанию");
        try {
            generationOrchestrator.recoverStaleUnits()
                    .subscribe(
                            count -> {
                                if (count > 0) {
                                    log.info("Доведено зависших генераций: {}", count);
                                }
                            },
                            error -> log.error("Ошибка при проверке зависших генераций", error)
                    );
        } catch (Exception e) {
            log.error("Ошибка при запуске проверки зависших генераций", e);
        }
    }
}
