package ru.oparin.omnihub.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки Replicate API (префикс replicate).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "replicate")
public class ReplicateProperties {

    private ProviderApiProperties api = new ProviderApiProperties();
}
