package ru.oparin.omnihub.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.omnihub.model.enums.WorkspaceRole;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Участник workspace.
 * В режиме INDIVIDUAL хранит аллокацию кредитов участника внутри workspace.
 */
@Table(value = "workspace_members", schema = "omnihub")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceMember {

    @Id
    private Long id;

    @Column("workspace_id")
    private Long workspaceId;

    @Column("user_id")
    private Long userId;

    @Builder.Default
    private WorkspaceRole role = WorkspaceRole.MEMBER;

    @Column("allocated_credits")
    @Builder.Default
    private BigDecimal allocatedCredits = BigDecimal.ZERO;

    @CreatedDate
    @Column("joined_at")
    private LocalDateTime joinedAt;
}
