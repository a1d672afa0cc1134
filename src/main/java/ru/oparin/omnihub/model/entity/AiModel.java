package ru.oparin.omnihub.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.math.BigDecimal;

/**
 * Модель из каталога.
 * Каталог ведется административной частью, здесь записи только читаются.
 */
@Table(value = "models", schema = "omnihub")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiModel {

    /**
     * Идентификатор модели, например flux-schnell.
     */
    @Id
    private String id;

    private String name;

    private GenerationType type;

    private GenerationProvider provider;

    /**
     * Резервный провайдер для синхронных моделей (может быть null).
     */
    @Column("fallback_provider")
    private GenerationProvider fallbackProvider;

    /**
     * Путь модели у провайдера, например fal-ai/flux/schnell.
     */
    private String endpoint;

    /**
     * Фактическая стоимость у провайдера в USD за единицу результата.
     */
    @Column("base_cost")
    @Builder.Default
    private BigDecimal baseCost = BigDecimal.ZERO;

    /**
     * Стоимость 1K входных токенов в USD (чат-модели).
     */
    @Column("input_cost")
    @Builder.Default
    private BigDecimal inputCost = BigDecimal.ZERO;

    /**
     * Стоимость 1K выходных токенов в USD (чат-модели).
     */
    @Column("output_cost")
    @Builder.Default
    private BigDecimal outputCost = BigDecimal.ZERO;

    /**
     * Максимальное время ожидания асинхронной задачи в секундах (null - значение по умолчанию).
     */
    @Column("max_wait_seconds")
    private Integer maxWaitSeconds;

    @Builder.Default
    private Boolean enabled = true;

    /**
     * JSON-схема выбираемых параметров модели.
     */
    @Column("options")
    private String optionsJson;

    @Column("display_order")
    @Builder.Default
    private Integer displayOrder = 100;
}
