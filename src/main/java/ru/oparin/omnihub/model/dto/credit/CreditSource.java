package ru.oparin.omnihub.model.dto.credit;

import lombok.Value;
import ru.oparin.omnihub.model.enums.CreditSourceType;

/**
 * Конкретный источник кредитов: личный баланс, общий пул workspace или аллокация участника.
 * Каждая единица генерации оплачивается ровно из одного источника.
 */
@Value
public class CreditSource {

    CreditSourceType type;

    /**
     * Пользователь (для PERSONAL и ALLOCATED).
     */
    Long userId;

    /**
     * Workspace (для WORKSPACE и ALLOCATED, для PERSONAL - дефолтный workspace или null).
     */
    Long workspaceId;

    public static CreditSource personal(Long userId, Long defaultWorkspaceId) {
        return new CreditSource(CreditSourceType.PERSONAL, userId, defaultWorkspaceId);
    }

    public static CreditSource workspace(Long workspaceId, Long userId) {
        return new CreditSource(CreditSourceType.WORKSPACE, userId, workspaceId);
    }

    public static CreditSource allocated(Long workspaceId, Long userId) {
        return new CreditSource(CreditSourceType.ALLOCATED, userId, workspaceId);
    }

    @Override
    public String toString() {
        return switch (type) {
            case PERSONAL -> "PERSONAL[user=" + userId + "]";
            case WORKSPACE -> "WORKSPACE[workspace=" + workspaceId + "]";
            case ALLOCATED -> "ALLOCATED[workspace=" + workspaceId + ", user=" + userId + "]";
        };
    }
}
