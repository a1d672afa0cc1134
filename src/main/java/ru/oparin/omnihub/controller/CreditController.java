package ru.oparin.omnihub.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.mapper.GenerationMapper;
import ru.oparin.omnihub.model.dto.credit.BalanceRs;
import ru.oparin.omnihub.model.dto.credit.LedgerEntryDTO;
import ru.oparin.omnihub.service.CreditLedgerService;
import ru.oparin.omnihub.service.GenerationOrchestrator;
import ru.oparin.omnihub.util.SecurityUtil;

import java.util.List;

@RestController
@RequestMapping("/credits")
@RequiredArgsConstructor
@Tag(name = "Credits", description = "Баланс и журнал кредитов")
@SecurityRequirement(name = "bearerAuth")
public class CreditController {

    private final CreditLedgerService creditLedgerService;
    private final GenerationOrchestrator generationOrchestrator;
    private final GenerationMapper generationMapper;

    @Operation(summary = "Баланс кредитов",
            description = "Баланс источника, с которого оплачиваются генерации в указанном workspace (без параметра - личный)")
    @GetMapping("/balance")
    public Mono<ResponseEntity<BalanceRs>> getBalance(@RequestParam(required = false) Long workspaceId) {
        return SecurityUtil.getCurrentUserId()
                .flatMap(userId -> creditLedgerService.resolveSource(userId, workspaceId))
                .flatMap(source -> creditLedgerService.getBalance(source)
                        .map(balance -> BalanceRs.builder()
                                .source(source.getType())
                                .workspaceId(source.getWorkspaceId())
                                .balance(balance)
                                .build()))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Движения кредитов по генерации")
    @GetMapping("/ledger/{generationId}")
    public Mono<ResponseEntity<List<LedgerEntryDTO>>> getLedger(@PathVariable Long generationId) {
        return SecurityUtil.getCurrentUserId()
                .flatMap(userId -> generationOrchestrator.getUnit(generationId, userId))
                .flatMap(unit -> creditLedgerService.getEntries(generationId)
                        .map(generationMapper::toLedgerEntryDTO)
                        .collectList())
                .map(ResponseEntity::ok);
    }
}
