package ru.oparin.omnihub.model.dto.fal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ответ Fal.ai при отправке запроса в очередь.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FalQueueResponseDTO {

    /**
     * Идентификатор запроса в очереди Fal.ai.
     */
    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("queue_position")
    private Integer queuePosition;

    @JsonProperty("status_url")
    private String statusUrl;

    @JsonProperty("response_url")
    private String responseUrl;
}
