package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.FilterMode;

import java.util.List;

/**
 * Sorunun diğer sorulara bağımlılığı.
 *
 * @param logic      Koşulların birleştirme mantığı (OR/AND)
 * @param conditions Koşullar
 */
public record DependsOn(FilterMode logic, List<DependencyCondition> conditions) {

    public DependsOn {
        logic = logic != null ? logic : FilterMode.OR;
        conditions = ModelDefaults.list(conditions);
    }
}
