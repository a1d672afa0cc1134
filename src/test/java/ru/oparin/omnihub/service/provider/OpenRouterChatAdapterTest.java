package ru.oparin.omnihub.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.omnihub.config.properties.OpenRouterProperties;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.mapper.ProviderPayloadMapper;
import ru.oparin.omnihub.model.dto.chat.ChatMessageDTO;
import ru.oparin.omnihub.model.dto.provider.ChatChunk;
import ru.oparin.omnihub.model.dto.provider.ChatProviderRequest;
import ru.oparin.omnihub.model.enums.GenerationErrorType;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenRouterChatAdapter")
class OpenRouterChatAdapterTest {

    private static final String SSE_BODY = """
            data: {"choices":[{"delta":{"content":"При"}}]}

            : OPENROUTER PROCESSING

            data: {"choices":[{"delta":{"content":"вет"}}]}

            data: {"choices":[{"delta":{},"finish_reason":"stop"}],"usage":{"prompt_tokens":12,"completion_tokens":2}}

            data: [DONE]

            """;

    private final AtomicInteger calls = new AtomicInteger();
    private String responseBody = SSE_BODY;
    private HttpStatus firstStatus = HttpStatus.OK;
    private OpenRouterChatAdapter adapter;

    @BeforeEach
    void setUp() {
        OpenRouterProperties properties = new OpenRouterProperties();
        properties.getApi().setUrl("https://openrouter.ai/api/v1");
        properties.getApi().setKey("test-key");
        properties.getApi().setRetryAttempts(1);
        properties.getApi().setRetryDelayMs(1);

        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> {
                    if (calls.incrementAndGet() == 1 && firstStatus.isError()) {
                        return Mono.just(ClientResponse.create(firstStatus)
                                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                .body("{\"error\":\"busy\"}")
                                .build());
                    }
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                            .body(responseBody)
                            .build());
                });

        adapter = new OpenRouterChatAdapter(builder, properties, new ProviderErrorClassifier(),
                new ProviderPayloadMapper(), new ObjectMapper());
    }

    @Test
    @DisplayName("Поток отдает приращения текста и итоговое использование токенов")
    void openStreamsDeltasAndUsage() {
        StepVerifier.create(adapter.open(request()))
                .assertNext(chunk -> assertThat(chunk.getDelta()).isEqualTo("При"))
                .assertNext(chunk -> assertThat(chunk.getDelta()).isEqualTo("вет"))
                .assertNext(chunk -> {
                    assertThat(chunk.isUsage()).isTrue();
                    assertThat(chunk.getInputTokens()).isEqualTo(12);
                    assertThat(chunk.getOutputTokens()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Ошибка внутри потока классифицируется по коду")
    void errorChunkIsClassified() {
        responseBody = """
                data: {"error":{"code":429,"message":"rate limited"}}

                """;

        StepVerifier.create(adapter.open(request()))
                .expectErrorSatisfies(error -> assertThat(((ProviderException) error).getErrorType())
                        .isEqualTo(GenerationErrorType.PROVIDER_UNAVAILABLE))
                .verify();
    }

    @Test
    @DisplayName("Недоступность до первого фрагмента повторяется")
    void unavailableBeforeFirstChunkIsRetried() {
        firstStatus = HttpStatus.SERVICE_UNAVAILABLE;

        StepVerifier.create(adapter.open(request()))
                .expectNextCount(3)
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Ошибка после первого фрагмента не повторяется, чтобы не задвоить текст")
    void errorAfterFirstChunkIsNotRetried() {
        responseBody = """
                data: {"choices":[{"delta":{"content":"При"}}]}

                data: {"error":{"code":502,"message":"upstream reset"}}

                """;

        StepVerifier.create(adapter.open(request()))
                .assertNext(chunk -> assertThat(chunk.getDelta()).isEqualTo("При"))
                .expectErrorSatisfies(error -> assertThat(((ProviderException) error).getErrorType())
                        .isEqualTo(GenerationErrorType.PROVIDER_UNAVAILABLE))
                .verify();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Разбор отдельных фрагментов")
    void parseChunk() {
        assertThat(adapter.parseChunk("{\"choices\":[{\"delta\":{\"content\":\"a\"}}]}"))
                .extracting(ChatChunk::getDelta)
                .containsExactly("a");
        assertThat(adapter.parseChunk("{\"choices\":[{\"delta\":{\"content\":\"\"}}]}")).isEmpty();
        assertThat(adapter.parseChunk("not json")).isEmpty();
        assertThatThrownBy(() -> adapter.parseChunk("{\"error\":{\"code\":400,\"message\":\"bad\"}}"))
                .isInstanceOf(ProviderException.class)
                .extracting(error -> ((ProviderException) error).getErrorType())
                .isEqualTo(GenerationErrorType.PROVIDER_REJECTED);
    }

    private static ChatProviderRequest request() {
        return ChatProviderRequest.builder()
                .generationId(5L)
                .endpoint("openai/gpt-4o-mini")
                .messages(List.of(new ChatMessageDTO("user", "Привет")))
                .options(Map.of())
                .maxTokens(256)
                .build();
    }
}
