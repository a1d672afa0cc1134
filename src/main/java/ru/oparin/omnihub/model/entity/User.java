package ru.oparin.omnihub.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Пользователь и его личный баланс кредитов.
 * Баланс изменяется только через журнал кредитов.
 */
@Table(value = "users", schema = "omnihub")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    private Long id;

    private String email;

    private String name;

    /**
     * Личный баланс кредитов. Не может быть отрицательным.
     */
    @Builder.Default
    private BigDecimal credits = BigDecimal.ZERO;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;
}
