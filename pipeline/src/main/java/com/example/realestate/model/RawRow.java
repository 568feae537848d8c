package com.example.realestate.model;

import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Uma linha bruta de entrada, na nomenclatura nativa da fonte.
 * As chaves são consultadas sem diferenciar maiúsculas de minúsculas; a chave exata tem prioridade.
 */
public final class RawRow {

    private final Map<String, Object> values;
    private final Map<String, Object> caseInsensitiveValues;

    private RawRow(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        Map<String, Object> folded = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        source.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value);
                folded.putIfAbsent(key, value);
            }
        });
        this.values = Collections.unmodifiableMap(copy);
        this.caseInsensitiveValues = Collections.unmodifiableMap(folded);
    }

    public static RawRow of(Map<String, ?> source) {
        return new RawRow(source == null ? Map.of() : source);
    }

    /**
     * Retorna o valor bruto associado à chave, ou {@code null} se ausente.
     */
    public Object get(String key) {
        if (values.containsKey(key)) {
            return values.get(key);
        }
        return caseInsensitiveValues.get(key);
    }

    /**
     * Retorna o valor como texto, ou {@code null} se ausente.
     * Números são renderizados sem notação científica e datas JDBC em formato ISO.
     */
    public String getText(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? BigDecimal.valueOf(number).toPlainString() : String.valueOf(number);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime().toString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
