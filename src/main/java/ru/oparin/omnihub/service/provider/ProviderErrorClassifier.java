package ru.oparin.omnihub.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;
import ru.oparin.omnihub.config.properties.ProviderApiProperties;
import ru.oparin.omnihub.exception.GenerationException;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Нормализация ошибок провайдеров в фиксированную таксономию.
 * <p>
 * Правила:
 * <ul>
 *   <li>ошибки подключения, HTTP 5xx и 429 - PROVIDER_UNAVAILABLE (повторяются с backoff)</li>
 *   <li>таймаут ответа - TIMEOUT (не повторяется)</li>
 *   <li>HTTP 401 и 403 - CONFIGURATION_ERROR (неверный ключ API)</li>
 *   <li>прочие HTTP 4xx - PROVIDER_REJECTED (невалидный запрос, нарушение политики контента)</li>
 *   <li>неизвестные ошибки - PROVIDER_UNAVAILABLE</li>
 * </ul>
 */
@Slf4j
@Component
public class ProviderErrorClassifier {

    /**
     * Привести произвольную ошибку к {@link ProviderException}.
     *
     * @param provider провайдер, при обращении к которому произошла ошибка
     * @param error    исходная ошибка
     * @return нормализованная ошибка
     */
    public ProviderException classify(GenerationProvider provider, Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        if (error instanceof GenerationException generationException) {
            return new ProviderException(generationException.getErrorType(), provider,
                    generationException.getMessage(), null, error);
        }
        if (isTimeoutError(error)) {
            return new ProviderException(GenerationErrorType.TIMEOUT, provider,
                    String.format(ProviderConstants.ErrorMessages.TIMEOUT_MESSAGE, provider.getDisplayName()), null, error);
        }
        if (error instanceof WebClientRequestException) {
            return new ProviderException(GenerationErrorType.PROVIDER_UNAVAILABLE, provider,
                    String.format(ProviderConstants.ErrorMessages.CONNECTION_ERROR, provider.getDisplayName(), error.getMessage()),
                    null, error);
        }
        if (error instanceof WebClientResponseException webError) {
            return classifyHttpError(provider, webError);
        }
        return new ProviderException(GenerationErrorType.PROVIDER_UNAVAILABLE, provider,
                String.format(ProviderConstants.ErrorMessages.UNKNOWN_ERROR_TEMPLATE, provider.getDisplayName(), error.getMessage()),
                null, error);
    }

    /**
     * Классифицировать HTTP статус ответа провайдера (используется и для статусов из webhook).
     */
    public GenerationErrorType classifyHttpStatus(int statusCode) {
        HttpStatus status = HttpStatus.resolve(statusCode);
        if (status == null || status.is5xxServerError() || status == HttpStatus.TOO_MANY_REQUESTS) {
            return GenerationErrorType.PROVIDER_UNAVAILABLE;
        }
        if (status == HttpStatus.REQUEST_TIMEOUT) {
            return GenerationErrorType.TIMEOUT;
        }
        if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
            return GenerationErrorType.CONFIGURATION_ERROR;
        }
        return GenerationErrorType.PROVIDER_REJECTED;
    }

    /**
     * Политика повторов для временной недоступности провайдера.
     * Повторяются только ошибки категории PROVIDER_UNAVAILABLE, после исчерпания попыток
     * пробрасывается последняя ошибка.
     *
     * @param provider провайдер
     * @param api      настройки API провайдера (количество попыток и задержка)
     * @return спецификация, которую адаптер может сузить собственным фильтром
     */
    public RetryBackoffSpec retrySpec(GenerationProvider provider, ProviderApiProperties api) {
        return Retry.backoff(api.getRetryAttempts(), Duration.ofMillis(api.getRetryDelayMs()))
                .filter(error -> error instanceof ProviderException providerException
                        && providerException.getErrorType().isRetryable())
                .doBeforeRetry(signal -> log.warn("Повтор запроса к провайдеру {} (попытка {}): {}",
                        provider, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private ProviderException classifyHttpError(GenerationProvider provider, WebClientResponseException webError) {
        String responseBody = webError.getResponseBodyAsString();
        GenerationErrorType errorType = classifyHttpStatus(webError.getStatusCode().value());
        String message = String.format(ProviderConstants.ErrorMessages.PROVIDER_ERROR_TEMPLATE,
                provider.getDisplayName(), webError.getStatusCode(), responseBody);
        return new ProviderException(errorType, provider, message, webError.getStatusCode().value(), webError);
    }

    private boolean isTimeoutError(Throwable error) {
        return error instanceof TimeoutException
                || (error.getCause() != null && error.getCause() instanceof TimeoutException)
                || (error instanceof WebClientRequestException && error.getCause() != null
                && error.getCause().getClass().getSimpleName().contains("Timeout"));
    }
}
