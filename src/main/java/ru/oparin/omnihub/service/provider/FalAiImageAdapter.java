package ru.oparin.omnihub.service.provider;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import ru.oparin.omnihub.config.properties.FalAiProperties;
import ru.oparin.omnihub.config.properties.ProviderApiProperties;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.mapper.ProviderPayloadMapper;
import ru.oparin.omnihub.model.dto.fal.FalResultDTO;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.time.Duration;
import java.util.List;

/**
 * Синхронная генерация изображений через https://fal.run.
 */
@Slf4j
@Component
public class FalAiImageAdapter implements SynchronousGenerationAdapter {

    private static final int CONNECT_TIMEOUT_MS = 30_000;

    private final WebClient webClient;
    private final ProviderApiProperties api;
    private final ProviderErrorClassifier errorClassifier;
    private final ProviderPayloadMapper payloadMapper;

    public FalAiImageAdapter(WebClient.Builder webClientBuilder,
                             FalAiProperties falAiProperties,
                             ProviderErrorClassifier errorClassifier,
                             ProviderPayloadMapper payloadMapper) {
        this.api = falAiProperties.getApi();
        this.errorClassifier = errorClassifier;
        this.payloadMapper = payloadMapper;

        if (!api.hasKey()) {
            log.warn("Fal.ai API ключ не настроен, синхронная генерация через Fal.ai недоступна");
        }

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS);

        this.webClient = webClientBuilder
                .baseUrl(api.getUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, ProviderConstants.FalAi.AUTH_PREFIX + api.getKey())
                .build();
    }

    @Override
    public Mono<GenerationResult> submit(ProviderRequest request) {
        log.info("Запрос к Fal.ai: модель '{}', единица {}, изображений {}",
                request.getEndpoint(), request.getGenerationId(), request.getQuantity());

        return Mono.defer(() -> webClient.post()
                        .uri("/" + request.getEndpoint())
                        .bodyValue(payloadMapper.toFalImagePayload(request))
                        .retrieve()
                        .bodyToMono(FalResultDTO.class)
                        .timeout(Duration.ofSeconds(api.getTimeoutSeconds())))
                .flatMap(this::toResult)
                .onErrorMap(error -> errorClassifier.classify(getProvider(), error))
                .retryWhen(errorClassifier.retrySpec(getProvider(), api))
                .doOnSuccess(result -> log.info("Fal.ai вернул {} изображений для единицы {}",
                        result.producedCount(), request.getGenerationId()));
    }

    private Mono<GenerationResult> toResult(FalResultDTO response) {
        List<String> urls = response.collectUrls();
        if (urls.isEmpty()) {
            return Mono.error(new ProviderException(GenerationErrorType.PROVIDER_UNAVAILABLE, getProvider(),
                    String.format(ProviderConstants.ErrorMessages.EMPTY_RESULT, getProvider().getDisplayName())));
        }
        return Mono.just(GenerationResult.builder()
                .provider(getProvider())
                .urls(urls)
                .seed(response.getSeed())
                .build());
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
