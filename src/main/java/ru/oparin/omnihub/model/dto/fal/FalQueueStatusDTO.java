package ru.oparin.omnihub.model.dto.fal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Статус запроса в очереди Fal.ai.
 * Возможные значения status: IN_QUEUE, IN_PROGRESS, COMPLETED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FalQueueStatusDTO {

    public static final String IN_QUEUE = "IN_QUEUE";
    public static final String IN_PROGRESS = "IN_PROGRESS";
    public static final String COMPLETED = "COMPLETED";

    private String status;

    /**
     * Позиция в очереди (только для IN_QUEUE).
     */
    @JsonProperty("queue_position")
    private Integer queuePosition;

    @JsonProperty("response_url")
    private String responseUrl;

    /**
     * Текст ошибки, если задача завершилась неудачно.
     */
    private String error;
}
