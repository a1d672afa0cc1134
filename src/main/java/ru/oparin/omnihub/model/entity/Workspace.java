package ru.oparin.omnihub.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.omnihub.model.enums.CreditMode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Рабочее пространство.
 * <p>
 * У каждого пользователя ровно один дефолтный (личный) workspace, создаваемый вместе с ним.
 * Дефолтный workspace всегда оплачивается с личного баланса и игнорирует {@link #creditMode}.
 */
@Table(value = "workspaces", schema = "omnihub")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Workspace {

    @Id
    private Long id;

    @Column("owner_id")
    private Long ownerId;

    private String name;

    @Column("is_default")
    @Builder.Default
    private Boolean isDefault = false;

    @Column("credit_mode")
    @Builder.Default
    private CreditMode creditMode = CreditMode.SHARED;

    /**
     * Общий пул кредитов (используется в режиме SHARED).
     */
    @Builder.Default
    private BigDecimal credits = BigDecimal.ZERO;

    @CreatedDate
    private LocalDateTime createdAt;

    public boolean isDefaultWorkspace() {
        return Boolean.TRUE.equals(isDefault);
    }
}
