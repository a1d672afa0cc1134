package ru.oparin.omnihub.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.enums.GenerationType;

@Repository
public interface AiModelRepository extends ReactiveCrudRepository<AiModel, String> {

    Flux<AiModel> findByEnabledTrueOrderByDisplayOrderAsc();

    Flux<AiModel> findByTypeAndEnabledTrueOrderByDisplayOrderAsc(GenerationType type);
}
