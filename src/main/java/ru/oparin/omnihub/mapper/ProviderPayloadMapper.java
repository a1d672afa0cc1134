package ru.oparin.omnihub.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.omnihub.model.dto.chat.ChatMessageDTO;
import ru.oparin.omnihub.model.dto.provider.ChatProviderRequest;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.service.provider.ProviderConstants;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Построение тел запросов к провайдерам из общего {@link ProviderRequest}.
 * Выбранные параметры модели передаются провайдеру как есть, под своими ключами.
 */
@Component
public class ProviderPayloadMapper {

    private static final String BLOB_PREFIX = "blob:";

    /**
     * Тело запроса Fal.ai для генерации изображений.
     */
    public Map<String, Object> toFalImagePayload(ProviderRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", request.getPrompt());
        payload.put("num_images", request.getQuantity());
        payload.put("enable_safety_checker", true);
        putOptions(payload, request.getOptions());

        if (request.hasInputImages()) {
            List<String> images = removingBlob(request.getInputImageUrls());
            if (images.size() == 1) {
                payload.put("image_url", images.get(0));
            } else {
                payload.put("image_urls", images);
            }
        }
        return payload;
    }

    /**
     * Тело запроса Fal.ai для генерации видео. Видео принимает одно входное изображение.
     */
    public Map<String, Object> toFalVideoPayload(ProviderRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", request.getPrompt());
        putOptions(payload, request.getOptions());

        if (request.hasInputImages()) {
            payload.put("image_url", removingBlob(request.getInputImageUrls()).get(0));
        }
        return payload;
    }

    /**
     * Тело запроса создания prediction в Replicate.
     *
     * @param webhookUrl адрес webhook или null, если задача отслеживается только опросом
     */
    public Map<String, Object> toReplicatePayload(ProviderRequest request, String webhookUrl) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("prompt", request.getPrompt());
        putOptions(input, request.getOptions());
        if (request.hasInputImages()) {
            input.put("image", removingBlob(request.getInputImageUrls()).get(0));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input", input);
        if (webhookUrl != null) {
            payload.put("webhook", webhookUrl);
            payload.put("webhook_events_filter", List.of(ProviderConstants.Replicate.WEBHOOK_EVENT_COMPLETED));
        }
        return payload;
    }

    /**
     * Тело потокового запроса OpenAI-совместимого API с выдачей usage в последнем фрагменте.
     */
    public Map<String, Object> toChatPayload(ChatProviderRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        putOptions(payload, request.getOptions());
        payload.put("model", request.getEndpoint());
        payload.put("messages", request.getMessages().stream()
                .map(this::toChatMessage)
                .toList());
        payload.put("stream", true);
        payload.put("stream_options", Map.of("include_usage", true));
        if (request.getMaxTokens() != null) {
            payload.put("max_tokens", request.getMaxTokens());
        }
        return payload;
    }

    private Map<String, Object> toChatMessage(ChatMessageDTO message) {
        return Map.of("role", message.getRole(), "content", message.getContent());
    }

    private void putOptions(Map<String, Object> payload, Map<String, Object> options) {
        if (options == null) {
            return;
        }
        options.forEach((key, value) -> {
            if (value != null) {
                payload.put(key, value);
            }
        });
    }

    /**
     * Убрать префикс blob: из URL, пришедших с фронтенда.
     */
    private List<String> removingBlob(List<String> inputImageUrls) {
        return inputImageUrls.stream()
                .map(url -> url.startsWith(BLOB_PREFIX) ? url.substring(BLOB_PREFIX.length()) : url)
                .toList();
    }
}
