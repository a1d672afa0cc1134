package ru.oparin.omnihub.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Глобальная настройка (ключ-значение), которую ведет административная часть.
 * Здесь используется только для чтения настроек ценообразования.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(value = "app_settings", schema = "omnihub")
public class AppSetting {

    @Id
    @Column("setting_key")
    private String key;

    @Column("setting_value")
    private String value;
}
