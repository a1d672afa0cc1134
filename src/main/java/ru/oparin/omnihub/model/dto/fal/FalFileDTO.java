package ru.oparin.omnihub.model.dto.fal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Файл результата Fal.ai (изображение или видео).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FalFileDTO {

    private String url;

    @JsonProperty("content_type")
    private String contentType;

    private Integer width;

    private Integer height;
}
