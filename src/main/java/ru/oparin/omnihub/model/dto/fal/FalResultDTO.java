package ru.oparin.omnihub.model.dto.fal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ответ Fal.ai с результатом генерации.
 * Модели изображений возвращают images или image, модели видео - video.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FalResultDTO {

    private List<FalFileDTO> images;

    private FalFileDTO image;

    private FalFileDTO video;

    private Long seed;

    /**
     * Собрать URL всех файлов результата.
     */
    public List<String> collectUrls() {
        List<String> urls = new ArrayList<>();
        if (images != null) {
            images.stream()
                    .map(FalFileDTO::getUrl)
                    .filter(url -> url != null && !url.isBlank())
                    .forEach(urls::add);
        }
        if (urls.isEmpty() && image != null && image.getUrl() != null) {
            urls.add(image.getUrl());
        }
        if (video != null && video.getUrl() != null) {
            urls.add(video.getUrl());
        }
        return urls;
    }
}
