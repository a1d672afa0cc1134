package ru.oparin.omnihub.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Единица генерации: выполнение одной модели в рамках (возможно мульти-модельного) запроса.
 * Единицы одного запроса объединены общим {@link #correlationId}.
 */
@Table(value = "generations", schema = "omnihub")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Generation {

    @Id
    private Long id;

    @Column("correlation_id")
    private String correlationId;

    @Column("user_id")
    private Long userId;

    @Column("workspace_id")
    private Long workspaceId;

    @Column("model_id")
    private String modelId;

    private GenerationType type;

    private String prompt;

    /**
     * Входные данные генерации в JSON (URL исходных изображений, сообщения чата).
     */
    @Column("input")
    private String inputJson;

    /**
     * Выбранные параметры модели в JSON.
     */
    @Column("options")
    private String optionsJson;

    @Builder.Default
    private Integer quantity = 1;

    @Builder.Default
    private GenerationStatus status = GenerationStatus.PENDING;

    @Column("queue_position")
    private Integer queuePosition;

    private GenerationProvider provider;

    /**
     * Идентификатор задачи у провайдера (для асинхронных генераций).
     */
    @Column("provider_job_id")
    private String providerJobId;

    /**
     * Результат в JSON: URL, текст или транскрипт чата.
     */
    @Column("result")
    private String resultJson;

    @Column("error_type")
    private GenerationErrorType errorType;

    @Column("error_message")
    private String errorMessage;

    /**
     * Оценка стоимости, зарезервированная перед отправкой.
     */
    @Column("estimated_credits")
    private BigDecimal estimatedCredits;

    /**
     * Фактически списанные кредиты.
     */
    private BigDecimal credits;

    @Column("credit_source")
    private CreditSourceType creditSource;

    @Column("reservation_id")
    private Long reservationId;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("completed_at")
    private LocalDateTime completedAt;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column("updated_at")
    private LocalDateTime updatedAt;
}
