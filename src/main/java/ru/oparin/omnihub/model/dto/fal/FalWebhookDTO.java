package ru.oparin.omnihub.model.dto.fal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Webhook Fal.ai о завершении запроса в очереди.
 * status равен OK или ERROR, payload содержит результат модели.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FalWebhookDTO {

    public static final String OK = "OK";
    public static final String ERROR = "ERROR";

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("gateway_request_id")
    private String gatewayRequestId;

    private String status;

    private FalResultDTO payload;

    private String error;
}
