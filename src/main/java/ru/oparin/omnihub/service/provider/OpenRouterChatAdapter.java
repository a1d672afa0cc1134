package ru.oparin.omnihub.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import ru.oparin.omnihub.config.properties.OpenRouterProperties;
import ru.oparin.omnihub.config.properties.ProviderApiProperties;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.mapper.ProviderPayloadMapper;
import ru.oparin.omnihub.model.dto.openrouter.OpenRouterStreamChunkDTO;
import ru.oparin.omnihub.model.dto.provider.ChatChunk;
import ru.oparin.omnihub.model.dto.provider.ChatProviderRequest;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Потоковые чат-модели через OpenRouter (OpenAI-совместимый SSE API).
 * <p>
 * Запрос отправляется с stream_options.include_usage, поэтому последний фрагмент потока
 * содержит фактическое количество входных и выходных токенов.
 * Повтор при недоступности выполняется только до получения первого фрагмента.
 */
@Slf4j
@Component
public class OpenRouterChatAdapter implements StreamingChatAdapter {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final ProviderApiProperties api;
    private final ProviderErrorClassifier errorClassifier;
    private final ProviderPayloadMapper payloadMapper;
    private final ObjectMapper objectMapper;

    public OpenRouterChatAdapter(WebClient.Builder webClientBuilder,
                                 OpenRouterProperties openRouterProperties,
                                 ProviderErrorClassifier errorClassifier,
                                 ProviderPayloadMapper payloadMapper,
                                 ObjectMapper objectMapper) {
        this.api = openRouterProperties.getApi();
        this.errorClassifier = errorClassifier;
        this.payloadMapper = payloadMapper;
        this.objectMapper = objectMapper;

        WebClient.Builder builder = webClientBuilder
                .baseUrl(api.getUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + api.getKey())
                .defaultHeader("X-Title", openRouterProperties.getTitle());
        if (openRouterProperties.getReferer() != null) {
            builder.defaultHeader(HttpHeaders.REFERER, openRouterProperties.getReferer());
        }
        this.webClient = builder.build();
    }

    @Override
    public Flux<ChatChunk> open(ChatProviderRequest request) {
        log.info("Открытие потока OpenRouter: модель '{}', единица {}, сообщений {}",
                request.getEndpoint(), request.getGenerationId(), request.getMessages().size());
        AtomicBoolean started = new AtomicBoolean(false);

        return Flux.defer(() -> webClient.post()
                        .uri(ProviderConstants.OpenRouter.CHAT_COMPLETIONS_PATH)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .bodyValue(payloadMapper.toChatPayload(request))
                        .retrieve()
                        .bodyToFlux(SSE_TYPE))
                .timeout(ProviderConstants.OpenRouter.FIRST_TOKEN_TIMEOUT)
                .mapNotNull(ServerSentEvent::data)
                .takeWhile(data -> !ProviderConstants.OpenRouter.DONE_MARKER.equals(data.trim()))
                .concatMapIterable(this::parseChunk)
                .doOnNext(chunk -> started.set(true))
                .onErrorMap(error -> errorClassifier.classify(getProvider(), error))
                .retryWhen(errorClassifier.retrySpec(getProvider(), api)
                        .filter(error -> !started.get()
                                && error instanceof ProviderException providerException
                                && providerException.getErrorType().isRetryable()))
                .doOnCancel(() -> log.info("Поток OpenRouter для единицы {} закрыт по отмене", request.getGenerationId()));
    }

    /**
     * Разобрать данные одного SSE-события в фрагменты: приращение текста и (в последнем событии) usage.
     */
    List<ChatChunk> parseChunk(String data) {
        OpenRouterStreamChunkDTO chunk;
        try {
            chunk = objectMapper.readValue(data, OpenRouterStreamChunkDTO.class);
        } catch (JsonProcessingException e) {
            log.debug("Пропуск нераспознанного SSE-события OpenRouter: {}", data);
            return List.of();
        }

        if (chunk.getError() != null) {
            Integer code = chunk.getError().getCode();
            GenerationErrorType errorType = code != null
                    ? errorClassifier.classifyHttpStatus(code)
                    : GenerationErrorType.PROVIDER_UNAVAILABLE;
            throw new ProviderException(errorType, getProvider(),
                    String.format(ProviderConstants.ErrorMessages.PROVIDER_ERROR_TEMPLATE,
                            getProvider().getDisplayName(), code, chunk.getError().getMessage()));
        }

        List<ChatChunk> chunks = new ArrayList<>(2);
        String delta = chunk.firstDelta();
        if (delta != null && !delta.isEmpty()) {
            chunks.add(ChatChunk.delta(delta));
        }
        if (chunk.getUsage() != null) {
            chunks.add(ChatChunk.usage(chunk.getUsage().getPromptTokens(), chunk.getUsage().getCompletionTokens()));
        }
        return chunks;
    }

    @Override
    public GenerationProvider getProvider() {
        return GenerationProvider.OPENROUTER;
    }

    @Override
    public boolean isAvailable() {
        return api.hasKey();
    }
}
