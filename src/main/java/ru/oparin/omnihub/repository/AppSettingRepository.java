package ru.oparin.omnihub.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import ru.oparin.omnihub.model.entity.AppSetting;

@Repository
public interface AppSettingRepository extends ReactiveCrudRepository<AppSetting, String> {
}
