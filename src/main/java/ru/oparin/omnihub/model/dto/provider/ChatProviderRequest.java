package ru.oparin.omnihub.model.dto.provider;

import lombok.Builder;
import lombok.Value;
import ru.oparin.omnihub.model.dto.chat.ChatMessageDTO;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ChatProviderRequest {

    Long generationId;

    String endpoint;

    List<ChatMessageDTO> messages;

    Map<String, Object> options;

    Integer maxTokens;
}
