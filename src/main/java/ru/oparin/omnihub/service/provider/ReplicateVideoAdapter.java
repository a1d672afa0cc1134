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
import ru.oparin.omnihub.config.properties.ProviderApiProperties;
import ru.oparin.omnihub.config.properties.ReplicateProperties;
import ru.oparin.omnihub.config.properties.WebhookProperties;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.mapper.ProviderPayloadMapper;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.JobHandle;
import ru.oparin.omnihub.model.dto.provider.JobStatus;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.dto.provider.WebhookEvent;
import ru.oparin.omnihub.model.dto.replicate.ReplicatePredictionDTO;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Асинхронная генерация через Replicate predictions API.
 * Завершение приходит webhook с событием completed или обнаруживается опросом.
 */
@Slf4j
@Component
public class ReplicateVideoAdapter implements AsynchronousGenerationAdapter {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private final ProviderApiProperties api;
    private final WebhookProperties webhookProperties;
    private final ProviderErrorClassifier errorClassifier;
    private final ProviderPayloadMapper payloadMapper;
    private final ObjectMapper objectMapper;

    public ReplicateVideoAdapter(WebClient.Builder webClientBuilder,
                                 ReplicateProperties replicateProperties,
                                 WebhookProperties webhookProperties,
                                 ProviderErrorClassifier errorClassifier,
                                 ProviderPayloadMapper payloadMapper,
                                 ObjectMapper objectMapper) {
        this.api = replicateProperties.getApi();
        this.webhookProperties = webhookProperties;
        this.errorClassifier = errorClassifier;
        this.payloadMapper = payloadMapper;
        this.objectMapper = objectMapper;

        this.webClient = webClientBuilder
                .baseUrl(api.getUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + api.getKey())
                .build();
    }

    @Override
    public Mono<JobHandle> submit(ProviderRequest request) {
        String webhookUrl = webhookProperties.isEnabled()
                ? webhookProperties.callbackUrl(getProvider().getCode())
                : null;
        log.info("Создание prediction в Replicate: модель '{}', единица {}", request.getEndpoint(), request.getGenerationId());

        return Mono.defer(() -> webClient.post()
                        .uri(ProviderConstants.Replicate.MODELS_PATH + request.getEndpoint()
                                + ProviderConstants.Replicate.PREDICTIONS_PATH)
                        .bodyValue(payloadMapper.toReplicatePayload(request, webhookUrl))
                        .retrieve()
                        .bodyToMono(ReplicatePredictionDTO.class)
                        .timeout(REQUEST_TIMEOUT))
                .flatMap(prediction -> {
                    if (prediction.getId() == null) {
                        return Mono.error(new ProviderException(GenerationErrorType.PROVIDER_UNAVAILABLE, getProvider(),
                                String.format(ProviderConstants.ErrorMessages.NO_JOB_ID, getProvider().getDisplayName())));
                    }
                    log.info("Prediction {} создан в Replicate, статус {}", prediction.getId(), prediction.getStatus());
                    return Mono.just(new JobHandle(getProvider(), prediction.getId(), request.getEndpoint()));
                })
                .onErrorMap(error -> errorClassifier.classify(getProvider(), error))
                .retryWhen(errorClassifier.retrySpec(getProvider(), api));
    }

    @Override
    public Mono<JobStatus> status(JobHandle handle) {
        return webClient.get()
                .uri(ProviderConstants.Replicate.PREDICTIONS_PATH + "/" + handle.getJobId())
                .retrieve()
                .bodyToMono(ReplicatePredictionDTO.class)
                .timeout(REQUEST_TIMEOUT)
                .onErrorMap(error -> errorClassifier.classify(getProvider(), error))
                .map(this::toJobStatus);
    }

    @Override
    public Optional<WebhookEvent> parseWebhook(JsonNode payload) {
        ReplicatePredictionDTO prediction;
        try {
            prediction = objectMapper.treeToValue(payload, ReplicatePredictionDTO.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Не удалось разобрать webhook Replicate: {}", e.getMessage());
            return Optional.empty();
        }
        if (prediction == null || prediction.getId() == null || prediction.getStatus() == null) {
            return Optional.empty();
        }
        return Optional.of(new WebhookEvent(prediction.getId(), toJobStatus(prediction)));
    }

    private JobStatus toJobStatus(ReplicatePredictionDTO prediction) {
        String status = prediction.getStatus();
        if (ReplicatePredictionDTO.SUCCEEDED.equals(status)) {
            List<String> urls = prediction.outputUrls();
            if (urls.isEmpty()) {
                return JobStatus.failed(new ProviderException(GenerationErrorType.PROVIDER_UNAVAILABLE, getProvider(),
                        String.format(ProviderConstants.ErrorMessages.EMPTY_RESULT, getProvider().getDisplayName())));
            }
            return JobStatus.succeeded(GenerationResult.builder()
                    .provider(getProvider())
                    .urls(urls)
                    .build());
        }
        if (ReplicatePredictionDTO.FAILED.equals(status)) {
            return JobStatus.failed(new ProviderException(GenerationErrorType.PROVIDER_REJECTED, getProvider(),
                    String.format(ProviderConstants.ErrorMessages.JOB_FAILED_TEMPLATE,
                            prediction.getId(), getProvider().getDisplayName(), prediction.getError())));
        }
        if (ReplicatePredictionDTO.CANCELED.equals(status)) {
            return JobStatus.failed(new ProviderException(GenerationErrorType.CANCELLED, getProvider(),
                    String.format(ProviderConstants.ErrorMessages.JOB_FAILED_TEMPLATE,
                            prediction.getId(), getProvider().getDisplayName(), "canceled")));
        }
        if (ReplicatePredictionDTO.PROCESSING.equals(status)) {
            return JobStatus.running();
        }
        return JobStatus.queued(null);
    }

    @Override
    public GenerationProvider getProvider() {
        return GenerationProvider.REPLICATE;
    }

    @Override
    public boolean isAvailable() {
        return api.hasKey();
    }
}
