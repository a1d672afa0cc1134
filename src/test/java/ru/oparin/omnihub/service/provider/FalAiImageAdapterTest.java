package ru.oparin.omnihub.service.provider;

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
import ru.oparin.omnihub.config.properties.FalAiProperties;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.mapper.ProviderPayloadMapper;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FalAiImageAdapter")
class FalAiImageAdapterTest {

    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();

    private FalAiImageAdapter adapter;

    @BeforeEach
    void setUp() {
        FalAiProperties properties = new FalAiProperties();
        properties.getApi().setUrl("https://fal.run");
        properties.getApi().setKey("test-key");
        properties.getApi().setRetryAttempts(1);
        properties.getApi().setRetryDelayMs(1);
        properties.getApi().setTimeoutSeconds(5);

        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Key test-key");
                    return Mono.just(responses.poll());
                });

        adapter = new FalAiImageAdapter(builder, properties, new ProviderErrorClassifier(), new ProviderPayloadMapper());
    }

    @Test
    @DisplayName("Успешный ответ превращается в список URL")
    void submitReturnsUrls() {
        responses.add(json(HttpStatus.OK,
                "{\"images\":[{\"url\":\"https://cdn/1.png\"},{\"url\":\"https://cdn/2.png\"}],\"seed\":42}"));

        StepVerifier.create(adapter.submit(request(2)))
                .assertNext(result -> {
                    assertThat(result.getProvider()).isEqualTo(GenerationProvider.FAL_AI);
                    assertThat(result.getUrls()).containsExactly("https://cdn/1.png", "https://cdn/2.png");
                    assertThat(result.getSeed()).isEqualTo(42L);
                    assertThat(result.producedCount()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Временная недоступность повторяется")
    void retriesOnUnavailable() {
        responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"detail\":\"overloaded\"}"));
        responses.add(json(HttpStatus.OK, "{\"image\":{\"url\":\"https://cdn/only.png\"}}"));

        StepVerifier.create(adapter.submit(request(1)))
                .assertNext(result -> assertThat(result.getUrls()).containsExactly("https://cdn/only.png"))
                .verifyComplete();
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("Отказ провайдера не повторяется")
    void rejectedIsNotRetried() {
        responses.add(json(HttpStatus.UNPROCESSABLE_ENTITY, "{\"detail\":\"content policy\"}"));

        StepVerifier.create(adapter.submit(request(1)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ProviderException.class);
                    assertThat(((ProviderException) error).getErrorType()).isEqualTo(GenerationErrorType.PROVIDER_REJECTED);
                })
                .verify();
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Пустой результат считается недоступностью провайдера")
    void emptyResultIsUnavailable() {
        responses.add(json(HttpStatus.OK, "{\"images\":[]}"));
        responses.add(json(HttpStatus.OK, "{\"images\":[]}"));

        StepVerifier.create(adapter.submit(request(1)))
                .expectErrorSatisfies(error -> assertThat(((ProviderException) error).getErrorType())
                        .isEqualTo(GenerationErrorType.PROVIDER_UNAVAILABLE))
                .verify();
        assertThat(calls).hasValue(2);
    }

    private static ProviderRequest request(int quantity) {
        return ProviderRequest.builder()
                .generationId(1L)
                .modelId("flux-schnell")
                .type(GenerationType.IMAGE)
                .endpoint("fal-ai/flux/schnell")
                .prompt("кот в космосе")
                .quantity(quantity)
                .build();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
