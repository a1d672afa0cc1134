package ru.oparin.omnihub.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.oparin.omnihub.config.properties.GenerationProperties;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Учет работоспособности провайдеров в памяти процесса.
 * <p>
 * После заданного числа ошибок недоступности подряд провайдер считается неработоспособным,
 * и маршрутизатор направляет синхронные запросы резервному. По истечении времени восстановления
 * счетчик сбрасывается и провайдер снова получает запросы. Любой успешный ответ сбрасывает счетчик сразу.
 */
@Slf4j
@Component
public class ProviderHealthTracker {

    private final Map<GenerationProvider, ProviderHealth> health = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration recoveryTime;
    private final Clock clock;

    @Autowired
    public ProviderHealthTracker(GenerationProperties generationProperties) {
        this(generationProperties, Clock.systemUTC());
    }

    ProviderHealthTracker(GenerationProperties generationProperties, Clock clock) {
        this.failureThreshold = generationProperties.getProviderHealth().getFailureThreshold();
        this.recoveryTime = Duration.ofSeconds(generationProperties.getProviderHealth().getRecoverySeconds());
        this.clock = clock;
    }

    /**
     * Зафиксировать ошибку недоступности провайдера.
     */
    public void markFailure(GenerationProvider provider) {
        ProviderHealth updated = health.compute(provider, (key, current) ->
                new ProviderHealth(current == null ? 1 : current.failures() + 1, clock.instant()));
        if (updated.failures() == failureThreshold) {
            log.warn("Провайдер {} помечен неработоспособным после {} ошибок подряд, повторная попытка через {} с",
                    provider, failureThreshold, recoveryTime.toSeconds());
        } else {
            log.debug("Ошибка провайдера {}: {} подряд", provider, updated.failures());
        }
    }

    public void markSuccess(GenerationProvider provider) {
        ProviderHealth previous = health.remove(provider);
        if (previous != null && previous.failures() >= failureThreshold) {
            log.info("Провайдер {} снова отвечает", provider);
        }
    }

    /**
     * @return false, если провайдер превысил порог ошибок и время восстановления еще не прошло
     */
    public boolean isHealthy(GenerationProvider provider) {
        ProviderHealth current = health.get(provider);
        if (current == null || current.failures() < failureThreshold) {
            return true;
        }
        if (Duration.between(current.lastFailure(), clock.instant()).compareTo(recoveryTime) > 0) {
            health.remove(provider, current);
            log.info("Время восстановления провайдера {} истекло, запросы возобновляются", provider);
            return true;
        }
        return false;
    }

    private record ProviderHealth(int failures, Instant lastFailure) {
    }
}
