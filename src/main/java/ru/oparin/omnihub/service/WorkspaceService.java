package ru.oparin.omnihub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.exception.AuthException;
import ru.oparin.omnihub.exception.NotFoundException;
import ru.oparin.omnihub.model.entity.Workspace;
import ru.oparin.omnihub.repository.WorkspaceMemberRepository;
import ru.oparin.omnihub.repository.WorkspaceRepository;

/**
 * Чтение рабочих пространств для определения источника кредитов.
 * Управление участниками и распределение пула выполняет отдельная часть системы.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkspaceService {

    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository workspaceMemberRepository;

    /**
     * Найти workspace, доступный пользователю.
     *
     * @param userId      пользователь
     * @param workspaceId запрошенный workspace или null для дефолтного
     * @return workspace; пустой результат, если дефолтного workspace у пользователя нет
     */
    public Mono<Workspace> findAccessibleWorkspace(Long userId, Long workspaceId) {
        if (workspaceId == null) {
            return workspaceRepository.findDefaultByOwnerId(userId);
        }
        return workspaceRepository.findById(workspaceId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Workspace не найден: " + workspaceId)))
                .flatMap(workspace -> {
                    if (userId.equals(workspace.getOwnerId())) {
                        return Mono.just(workspace);
                    }
                    return workspaceMemberRepository.findByWorkspaceIdAndUserId(workspaceId, userId)
                            .map(member -> workspace)
                            .switchIfEmpty(Mono.defer(() -> {
                                log.warn("Пользователь {} не является участником workspace {}", userId, workspaceId);
                                return Mono.error(AuthException.forbidden("Нет доступа к workspace"));
                            }));
                });
    }
}
