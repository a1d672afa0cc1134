package ru.oparin.omnihub.mapper;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.oparin.omnihub.model.dto.credit.LedgerEntryDTO;
import ru.oparin.omnihub.model.dto.generation.GenerationUnitDTO;
import ru.oparin.omnihub.model.entity.Generation;
import ru.oparin.omnihub.model.entity.LedgerEntry;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.service.GenerationUnitService;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class GenerationMapper {

    private final JsonColumnMapper jsonColumnMapper;

    /**
     * Преобразовать единицу генерации в DTO.
     * Результат и стоимость отдаются только для завершенной единицы, ошибка - только для неуспешной.
     */
    public GenerationUnitDTO toUnitDTO(Generation unit) {
        GenerationUnitDTO.GenerationUnitDTOBuilder builder = GenerationUnitDTO.builder()
                .id(unit.getId())
                .correlationId(unit.getCorrelationId())
                .modelId(unit.getModelId())
                .type(unit.getType())
                .status(unit.getStatus())
                .queuePosition(unit.getQueuePosition())
                .creditSource(unit.getCreditSource())
                .startedAt(unit.getStartedAt())
                .completedAt(unit.getCompletedAt());

        if (unit.getStatus() == GenerationStatus.COMPLETED) {
            Map<String, Object> result = jsonColumnMapper.readMap(unit.getResultJson());
            builder.resultUrls(toStringList(result.get(GenerationUnitService.RESULT_URLS)))
                    .text(result.get(GenerationUnitService.RESULT_TEXT) != null
                            ? String.valueOf(result.get(GenerationUnitService.RESULT_TEXT))
                            : null)
                    .credits(unit.getCredits());
        }
        if (unit.getStatus() == GenerationStatus.FAILED) {
            builder.errorType(unit.getErrorType())
                    .errorMessage(unit.getErrorMessage());
        }
        return builder.build();
    }

    public LedgerEntryDTO toLedgerEntryDTO(LedgerEntry entry) {
        return LedgerEntryDTO.builder()
                .id(entry.getId())
                .generationId(entry.getGenerationId())
                .operation(entry.getOperation())
                .source(entry.getSourceType())
                .amount(entry.getAmount())
                .balanceAfter(entry.getBalanceAfter())
                .createdAt(entry.getCreatedAt())
                .build();
    }

    private static List<String> toStringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
