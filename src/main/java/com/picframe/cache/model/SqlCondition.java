package com.picframe.cache.model;

import java.util.List;

/**
 * A translated WHERE condition: SQL text built only from allowlisted columns and operators,
 * with every caller-supplied value carried as a bind parameter.
 */
public record SqlCondition(String sql, List<Object> parameters) {

    public static final SqlCondition ALWAYS = new SqlCondition("TRUE", List.of());

    public SqlCondition {
        parameters = List.copyOf(parameters);
    }

    public Object[] parameterArray() {
        return parameters.toArray();
    }
}
