package ru.oparin.omnihub.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import ru.oparin.omnihub.config.properties.ReplicateProperties;
import ru.oparin.omnihub.config.properties.WebhookProperties;
import ru.oparin.omnihub.mapper.ProviderPayloadMapper;
import ru.oparin.omnihub.model.dto.provider.WebhookEvent;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.JobState;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReplicateVideoAdapter")
class ReplicateVideoAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ReplicateVideoAdapter adapter;

    @BeforeEach
    void setUp() {
        ReplicateProperties properties = new ReplicateProperties();
        properties.getApi().setUrl("https://api.replicate.com/v1");
        adapter = new ReplicateVideoAdapter(WebClient.builder(), properties, new WebhookProperties(),
                new ProviderErrorClassifier(), new ProviderPayloadMapper(), objectMapper);
    }

    @Test
    @DisplayName("Без ключа API провайдер недоступен")
    void unavailableWithoutKey() {
        assertThat(adapter.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("Успешный prediction со строковым результатом")
    void succeededWithSingleUrl() throws Exception {
        Optional<WebhookEvent> event = adapter.parseWebhook(objectMapper.readTree(
                "{\"id\":\"p-1\",\"status\":\"succeeded\",\"output\":\"https://cdn/v.mp4\"}"));

        assertThat(event).isPresent();
        assertThat(event.get().getJobId()).isEqualTo("p-1");
        assertThat(event.get().getStatus().getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(event.get().getStatus().getResult().getUrls()).containsExactly("https://cdn/v.mp4");
    }

    @Test
    @DisplayName("Успешный prediction без результата считается неудачным")
    void succeededWithoutOutput() throws Exception {
        Optional<WebhookEvent> event = adapter.parseWebhook(objectMapper.readTree(
                "{\"id\":\"p-1\",\"status\":\"succeeded\",\"output\":[]}"));

        assertThat(event.get().getStatus().getState()).isEqualTo(JobState.FAILED);
        assertThat(event.get().getStatus().getError().getErrorType()).isEqualTo(GenerationErrorType.PROVIDER_UNAVAILABLE);
    }

    @Test
    @DisplayName("Ошибка и отмена prediction")
    void failedAndCanceled() throws Exception {
        WebhookEvent failed = adapter.parseWebhook(objectMapper.readTree(
                "{\"id\":\"p-1\",\"status\":\"failed\",\"error\":\"NSFW content detected\"}")).orElseThrow();
        WebhookEvent canceled = adapter.parseWebhook(objectMapper.readTree(
                "{\"id\":\"p-2\",\"status\":\"canceled\"}")).orElseThrow();

        assertThat(failed.getStatus().getError().getErrorType()).isEqualTo(GenerationErrorType.PROVIDER_REJECTED);
        assertThat(canceled.getStatus().getError().getErrorType()).isEqualTo(GenerationErrorType.CANCELLED);
    }

    @Test
    @DisplayName("Промежуточные статусы и неполные webhook")
    void intermediateAndIncomplete() throws Exception {
        assertThat(adapter.parseWebhook(objectMapper.readTree("{\"id\":\"p-1\",\"status\":\"processing\"}"))
                .orElseThrow().getStatus().getState()).isEqualTo(JobState.RUNNING);
        assertThat(adapter.parseWebhook(objectMapper.readTree("{\"id\":\"p-1\",\"status\":\"starting\"}"))
                .orElseThrow().getStatus().getState()).isEqualTo(JobState.QUEUED);
        assertThat(adapter.parseWebhook(objectMapper.readTree("{\"status\":\"succeeded\"}"))).isEmpty();
    }
}
