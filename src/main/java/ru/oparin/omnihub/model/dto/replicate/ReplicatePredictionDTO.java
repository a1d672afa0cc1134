package ru.oparin.omnihub.model.dto.replicate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Предсказание (prediction) Replicate. Используется и в ответах API, и в webhook.
 * status: starting, processing, succeeded, failed, canceled.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplicatePredictionDTO {

    public static final String STARTING = "starting";
    public static final String PROCESSING = "processing";
    public static final String SUCCEEDED = "succeeded";
    public static final String FAILED = "failed";
    public static final String CANCELED = "canceled";

    private String id;

    private String status;

    /**
     * Результат: строка с URL или массив URL в зависимости от модели.
     */
    private JsonNode output;

    private String error;

    public List<String> outputUrls() {
        List<String> urls = new ArrayList<>();
        if (output == null || output.isNull()) {
            return urls;
        }
        if (output.isTextual()) {
            urls.add(output.asText());
        } else if (output.isArray()) {
            output.forEach(node -> {
                if (node.isTextual()) {
                    urls.add(node.asText());
                }
            });
        }
        return urls;
    }
}
