package ru.oparin.omnihub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.entity.User;
import ru.oparin.omnihub.model.entity.Workspace;
import ru.oparin.omnihub.model.entity.WorkspaceMember;
import ru.oparin.omnihub.model.enums.CreditMode;
import ru.oparin.omnihub.model.enums.WorkspaceRole;
import ru.oparin.omnihub.repository.UserRepository;
import ru.oparin.omnihub.repository.WorkspaceMemberRepository;
import ru.oparin.omnihub.repository.WorkspaceRepository;

/**
 * Заведение учетной записи после регистрации во внешнем сервисе аутентификации.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private static final String DEFAULT_WORKSPACE_NAME = "Личное пространство";

    private final UserRepository userRepository;
    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository workspaceMemberRepository;
    private final PricingSettingsService pricingSettingsService;

    /**
     * Создать пользователя со стартовыми кредитами и его дефолтный workspace.
     * Повторный вызов для того же email возвращает существующего пользователя без начисления.
     *
     * @param email email пользователя
     * @param name  отображаемое имя
     * @return созданный или существующий пользователь
     */
    @Transactional
    public Mono<User> provisionUser(String email, String name) {
        return userRepository.findByEmail(email)
                .doOnNext(existing -> log.info("Пользователь {} уже заведен, id={}", email, existing.getId()))
                .switchIfEmpty(Mono.defer(() -> createUser(email, name)));
    }

    private Mono<User> createUser(String email, String name) {
        return pricingSettingsService.getSettings()
                .flatMap(settings -> userRepository.save(User.builder()
                        .email(email)
                        .name(name)
                        .credits(settings.getFreeCredits())
                        .build()))
                .flatMap(user -> workspaceRepository.save(Workspace.builder()
                                .ownerId(user.getId())
                                .name(DEFAULT_WORKSPACE_NAME)
                                .isDefault(true)
                                .creditMode(CreditMode.SHARED)
                                .build())
                        .flatMap(workspace -> workspaceMemberRepository.save(WorkspaceMember.builder()
                                .workspaceId(workspace.getId())
                                .userId(user.getId())
                                .role(WorkspaceRole.OWNER)
                                .build()))
                        .doOnNext(member -> log.info("Заведен пользователь {} (id={}) со стартовыми кредитами {}",
                                email, user.getId(), user.getCredits()))
                        .thenReturn(user));
    }
}
