package ru.oparin.omnihub.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.config.properties.FalAiProperties;
import ru.oparin.omnihub.config.properties.ProviderApiProperties;
import ru.oparin.omnihub.config.properties.WebhookProperties;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.mapper.ProviderPayloadMapper;
import ru.oparin.omnihub.model.dto.fal.FalQueueResponseDTO;
import ru.oparin.omnihub.model.dto.fal.FalQueueStatusDTO;
import ru.oparin.omnihub.model.dto.fal.FalResultDTO;
import ru.oparin.omnihub.model.dto.fal.FalWebhookDTO;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.JobHandle;
import ru.oparin.omnihub.model.dto.provider.JobStatus;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.dto.provider.WebhookEvent;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Асинхронная генерация через очередь Fal.ai (https://queue.fal.run).
 * <p>
 * Задача ставится в очередь с адресом webhook в параметре fal_webhook (если публичный адрес настроен).
 * Статус и результат запрашиваются по идентификатору приложения (первые два сегмента пути модели).
 */
@Slf4j
@Component
public class FalAiQueueAdapter implements AsynchronousGenerationAdapter {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient queueWebClient;
    private final ProviderApiProperties api;
    private final WebhookProperties webhookProperties;
    private final ProviderErrorClassifier errorClassifier;
    private final ProviderPayloadMapper payloadMapper;
    private final ObjectMapper objectMapper;

    public FalAiQueueAdapter(WebClient.Builder webClientBuilder,
                             FalAiProperties falAiProperties,
                             WebhookProperties webhookProperties,
                             ProviderErrorClassifier errorClassifier,
                             ProviderPayloadMapper payloadMapper,
                             ObjectMapper objectMapper) {
        this.api = falAiProperties.getApi();
        this.webhookProperties = webhookProperties;
        this.errorClassifier = errorClassifier;
        this.payloadMapper = payloadMapper;
        this.objectMapper = objectMapper;

        this.queueWebClient = webClientBuilder
                .baseUrl(falAiProperties.getQueueUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, ProviderConstants.FalAi.AUTH_PREFIX + api.getKey())
                .build();
    }

    @Override
    public Mono<JobHandle> submit(ProviderRequest request) {
        log.info("Отправка запроса в очередь Fal.ai: модель '{}', единица {}", request.getEndpoint(), request.getGenerationId());

        return Mono.defer(() -> queueWebClient.post()
                        .uri(uriBuilder -> {
                            uriBuilder.path("/" + request.getEndpoint());
                            if (webhookProperties.isEnabled()) {
                                uriBuilder.queryParam(ProviderConstants.FalAi.WEBHOOK_PARAM,
                                        webhookProperties.callbackUrl(getProvider().getCode()));
                            }
                            return uriBuilder.build();
                        })
                        .bodyValue(payloadMapper.toFalVideoPayload(request))
                        .retrieve()
                        .bodyToMono(FalQueueResponseDTO.class)
                        .timeout(REQUEST_TIMEOUT))
                .flatMap(response -> {
                    if (response.getRequestId() == null) {
                        return Mono.error(new ProviderException(GenerationErrorType.PROVIDER_UNAVAILABLE, getProvider(),
                                String.format(ProviderConstants.ErrorMessages.NO_JOB_ID, getProvider().getDisplayName())));
                    }
                    log.info("Запрос поставлен в очередь Fal.ai: requestId={}, позиция {}",
                            response.getRequestId(), response.getQueuePosition());
                    return Mono.just(new JobHandle(getProvider(), response.getRequestId(),
                            request.getEndpoint(), response.getQueuePosition()));
                })
                .onErrorMap(error -> errorClassifier.classify(getProvider(), error))
                .retryWhen(errorClassifier.retrySpec(getProvider(), api));
    }

    @Override
    public Mono<JobStatus> status(JobHandle handle) {
        String requestPath = requestPath(handle);

        return queueWebClient.get()
                .uri(requestPath + ProviderConstants.FalAi.STATUS_SUFFIX)
                .retrieve()
                .bodyToMono(FalQueueStatusDTO.class)
                .timeout(REQUEST_TIMEOUT)
                .onErrorMap(error -> errorClassifier.classify(getProvider(), error))
                .flatMap(status -> {
                    log.debug("Статус запроса {} в очереди Fal.ai: {}, позиция {}",
                            handle.getJobId(), status.getStatus(), status.getQueuePosition());
                    if (status.getError() != null) {
                        return Mono.just(JobStatus.failed(jobFailed(handle, status.getError())));
                    }
                    if (FalQueueStatusDTO.COMPLETED.equals(status.getStatus())) {
                        return fetchResult(handle, requestPath);
                    }
                    if (FalQueueStatusDTO.IN_PROGRESS.equals(status.getStatus())) {
                        return Mono.just(JobStatus.running());
                    }
                    return Mono.just(JobStatus.queued(status.getQueuePosition()));
                });
    }

    /**
     * Получить результат завершенного запроса. Отказ провайдера (4xx) означает неуспешную задачу,
     * временная недоступность пробрасывается, чтобы результат был запрошен при следующем опросе.
     */
    private Mono<JobStatus> fetchResult(JobHandle handle, String requestPath) {
        return queueWebClient.get()
                .uri(requestPath)
                .retrieve()
                .bodyToMono(FalResultDTO.class)
                .timeout(REQUEST_TIMEOUT)
                .map(result -> toJobStatus(handle, result))
                .onErrorResume(error -> {
                    ProviderException providerError = errorClassifier.classify(getProvider(), error);
                    if (providerError.getErrorType().isRetryable()) {
                        return Mono.error(providerError);
                    }
                    log.warn("Запрос {} завершился в Fal.ai с ошибкой: {}", handle.getJobId(), providerError.getMessage());
                    return Mono.just(JobStatus.failed(providerError));
                });
    }

    @Override
    public Optional<WebhookEvent> parseWebhook(JsonNode payload) {
        FalWebhookDTO webhook;
        try {
            webhook = objectMapper.treeToValue(payload, FalWebhookDTO.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Не удалось разобрать webhook Fal.ai: {}", e.getMessage());
            return Optional.empty();
        }
        if (webhook == null || webhook.getRequestId() == null) {
            return Optional.empty();
        }

        String jobId = webhook.getRequestId();
        if (FalWebhookDTO.ERROR.equals(webhook.getStatus())) {
            String reason = webhook.getError() != null ? webhook.getError() : "ERROR";
            return Optional.of(new WebhookEvent(jobId, JobStatus.failed(
                    new ProviderException(GenerationErrorType.PROVIDER_REJECTED, getProvider(),
                            String.format(ProviderConstants.ErrorMessages.JOB_FAILED_TEMPLATE,
                                    jobId, getProvider().getDisplayName(), reason)))));
        }
        if (FalWebhookDTO.OK.equals(webhook.getStatus())) {
            if (webhook.getPayload() == null || webhook.getPayload().collectUrls().isEmpty()) {
                return Optional.of(new WebhookEvent(jobId, null));
            }
            return Optional.of(new WebhookEvent(jobId, toJobStatus(new JobHandle(getProvider(), jobId, null), webhook.getPayload())));
        }
        return Optional.empty();
    }

    private JobStatus toJobStatus(JobHandle handle, FalResultDTO result) {
        List<String> urls = result.collectUrls();
        if (urls.isEmpty()) {
            return JobStatus.failed(new ProviderException(GenerationErrorType.PROVIDER_UNAVAILABLE, getProvider(),
                    String.format(ProviderConstants.ErrorMessages.EMPTY_RESULT, getProvider().getDisplayName())));
        }
        log.info("Результат запроса {} получен из Fal.ai: {} файлов", handle.getJobId(), urls.size());
        return JobStatus.succeeded(GenerationResult.builder()
                .provider(getProvider())
                .urls(urls)
                .seed(result.getSeed())
                .build());
    }

    private ProviderException jobFailed(JobHandle handle, String reason) {
        return new ProviderException(GenerationErrorType.PROVIDER_REJECTED, getProvider(),
                String.format(ProviderConstants.ErrorMessages.JOB_FAILED_TEMPLATE,
                        handle.getJobId(), getProvider().getDisplayName(), reason));
    }

    /**
     * Путь запроса в очереди: /{owner}/{app}/requests/{requestId}.
     * Для моделей с вложенным путем (fal-ai/kling-video/v2/pro) статус доступен только по owner/app.
     */
    static String requestPath(JobHandle handle) {
        String[] segments = handle.getEndpoint().split("/");
        String appId = String.join("/", Arrays.copyOf(segments,
                Math.min(segments.length, ProviderConstants.FalAi.APP_ID_SEGMENTS)));
        return "/" + appId + ProviderConstants.FalAi.REQUESTS_PATH + handle.getJobId();
    }

    @Override
    public GenerationProvider getProvider() {
        return GenerationProvider.FAL_AI;
    }

    @Override
    public boolean isAvailable() {
        return api.hasKey();
    }
}
