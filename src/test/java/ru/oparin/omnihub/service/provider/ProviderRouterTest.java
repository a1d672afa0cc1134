package ru.oparin.omnihub.service.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.omnihub.config.properties.GenerationProperties;
import ru.oparin.omnihub.exception.ConfigurationException;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.model.dto.catalog.ResolvedModel;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.enums.AdapterKind;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ProviderRouter")
class ProviderRouterTest {

    private final ProviderRequest request = ProviderRequest.builder()
            .generationId(1L)
            .endpoint("flux")
            .prompt("горы")
            .build();

    private final ProviderHealthTracker healthTracker = new ProviderHealthTracker(new GenerationProperties());

    @Test
    @DisplayName("При недоступности основного провайдера используется резервный")
    void fallbackOnUnavailable() {
        SynchronousGenerationAdapter primary = syncAdapter(GenerationProvider.FAL_AI);
        SynchronousGenerationAdapter fallback = syncAdapter(GenerationProvider.REPLICATE);
        when(primary.submit(any())).thenReturn(Mono.error(new ProviderException(
                GenerationErrorType.PROVIDER_UNAVAILABLE, GenerationProvider.FAL_AI, "503")));
        when(fallback.submit(any())).thenReturn(Mono.just(GenerationResult.builder()
                .provider(GenerationProvider.REPLICATE)
                .urls(List.of("https://cdn/r.png"))
                .build()));

        ProviderRouter router = new ProviderRouter(List.of(primary, fallback), healthTracker);
        ResolvedModel model = router.resolve(imageModel(GenerationProvider.FAL_AI, GenerationProvider.REPLICATE), Map.of());

        StepVerifier.create(router.submitSynchronous(model, request))
                .assertNext(result -> assertThat(result.getProvider()).isEqualTo(GenerationProvider.REPLICATE))
                .verifyComplete();
    }

    @Test
    @DisplayName("После трех ошибок недоступности основной провайдер пропускается")
    void unhealthyPrimaryIsSkipped() {
        SynchronousGenerationAdapter primary = syncAdapter(GenerationProvider.FAL_AI);
        SynchronousGenerationAdapter fallback = syncAdapter(GenerationProvider.REPLICATE);
        when(primary.submit(any())).thenReturn(Mono.error(new ProviderException(
                GenerationErrorType.PROVIDER_UNAVAILABLE, GenerationProvider.FAL_AI, "503")));
        when(fallback.submit(any())).thenReturn(Mono.just(GenerationResult.builder()
                .provider(GenerationProvider.REPLICATE)
                .urls(List.of("https://cdn/r.png"))
                .build()));

        ProviderRouter router = new ProviderRouter(List.of(primary, fallback), healthTracker);
        ResolvedModel model = router.resolve(imageModel(GenerationProvider.FAL_AI, GenerationProvider.REPLICATE), Map.of());

        for (int attempt = 0; attempt < 4; attempt++) {
            StepVerifier.create(router.submitSynchronous(model, request))
                    .assertNext(result -> assertThat(result.getProvider()).isEqualTo(GenerationProvider.REPLICATE))
                    .verifyComplete();
        }

        verify(primary, times(3)).submit(any());
        verify(fallback, times(4)).submit(any());
        assertThat(healthTracker.isHealthy(GenerationProvider.FAL_AI)).isFalse();
        assertThat(healthTracker.isHealthy(GenerationProvider.REPLICATE)).isTrue();
    }

    @Test
    @DisplayName("Без резервного провайдера запрос уходит основному, даже если он помечен неработоспособным")
    void unhealthyPrimaryWithoutFallbackIsStillTried() {
        SynchronousGenerationAdapter primary = syncAdapter(GenerationProvider.FAL_AI);
        when(primary.submit(any())).thenReturn(Mono.error(new ProviderException(
                GenerationErrorType.PROVIDER_UNAVAILABLE, GenerationProvider.FAL_AI, "503")));
        for (int i = 0; i < 3; i++) {
            healthTracker.markFailure(GenerationProvider.FAL_AI);
        }

        ProviderRouter router = new ProviderRouter(List.of(primary), healthTracker);
        ResolvedModel model = router.resolve(imageModel(GenerationProvider.FAL_AI, null), Map.of());

        StepVerifier.create(router.submitSynchronous(model, request))
                .expectError(ProviderException.class)
                .verify();
        verify(primary).submit(any());
    }

    @Test
    @DisplayName("Отказ провайдера не переключает на резервный")
    void noFallbackOnRejected() {
        SynchronousGenerationAdapter primary = syncAdapter(GenerationProvider.FAL_AI);
        SynchronousGenerationAdapter fallback = syncAdapter(GenerationProvider.REPLICATE);
        when(primary.submit(any())).thenReturn(Mono.error(new ProviderException(
                GenerationErrorType.PROVIDER_REJECTED, GenerationProvider.FAL_AI, "nsfw")));

        ProviderRouter router = new ProviderRouter(List.of(primary, fallback), healthTracker);
        ResolvedModel model = router.resolve(imageModel(GenerationProvider.FAL_AI, GenerationProvider.REPLICATE), Map.of());

        StepVerifier.create(router.submitSynchronous(model, request))
                .expectErrorSatisfies(error -> assertThat(((ProviderException) error).getErrorType())
                        .isEqualTo(GenerationErrorType.PROVIDER_REJECTED))
                .verify();
        verify(fallback, never()).submit(any());
    }

    @Test
    @DisplayName("Изображение без синхронного адаптера связывается с асинхронным")
    void imageFallsBackToAsynchronousKind() {
        AsynchronousGenerationAdapter async = mock(AsynchronousGenerationAdapter.class);
        when(async.getKind()).thenReturn(AdapterKind.ASYNCHRONOUS);
        when(async.getProvider()).thenReturn(GenerationProvider.REPLICATE);

        ProviderRouter router = new ProviderRouter(List.of(async), healthTracker);
        ResolvedModel model = router.resolve(imageModel(GenerationProvider.REPLICATE, null), Map.of());

        assertThat(model.getKind()).isEqualTo(AdapterKind.ASYNCHRONOUS);
        assertThat(router.findAsynchronous(GenerationProvider.REPLICATE)).contains(async);
        assertThat(router.findAsynchronous(GenerationProvider.FAL_AI)).isEmpty();
    }

    @Test
    @DisplayName("Модель без подходящего адаптера - ошибка конфигурации")
    void missingAdapterIsConfigurationError() {
        ProviderRouter router = new ProviderRouter(List.of(syncAdapter(GenerationProvider.FAL_AI)), healthTracker);
        AiModel chat = AiModel.builder()
                .id("gpt")
                .type(GenerationType.CHAT)
                .provider(GenerationProvider.OPENROUTER)
                .build();

        assertThatThrownBy(() -> router.resolve(chat, Map.of()))
                .isInstanceOf(ConfigurationException.class);
    }

    private static SynchronousGenerationAdapter syncAdapter(GenerationProvider provider) {
        SynchronousGenerationAdapter adapter = mock(SynchronousGenerationAdapter.class);
        when(adapter.getKind()).thenReturn(AdapterKind.SYNCHRONOUS);
        when(adapter.getProvider()).thenReturn(provider);
        when(adapter.isAvailable()).thenReturn(true);
        return adapter;
    }

    private static AiModel imageModel(GenerationProvider provider, GenerationProvider fallbackProvider) {
        return AiModel.builder()
                .id("flux-schnell")
                .type(GenerationType.IMAGE)
                .provider(provider)
                .fallbackProvider(fallbackProvider)
                .endpoint("fal-ai/flux/schnell")
                .build();
    }
}
