package com.example.realestate.config;

import com.example.realestate.model.CanonicalField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lista ordenada de nomes de coluna aceitos para cada campo canônico.
 * A ordem define a precedência: o primeiro valor presente e não vazio vence.
 * Instâncias são imutáveis durante uma execução.
 */
public final class FieldAliases {

    private static final FieldAliases DEFAULTS = new FieldAliases(defaultMapping());
    private static final FieldAliases DOCUMENT_DEFAULTS = new FieldAliases(canonicalOnlyMapping());

    private final Map<CanonicalField, List<String>> aliases;

    private FieldAliases(Map<CanonicalField, List<String>> aliases) {
        EnumMap<CanonicalField, List<String>> copy = new EnumMap<>(CanonicalField.class);
        aliases.forEach((field, names) -> copy.put(field, List.copyOf(names)));
        this.aliases = Collections.unmodifiableMap(copy);
    }

    /**
     * Conjunto completo e multilíngue usado por fontes CSV e relacionais.
     * Inclui os cabeçalhos do 實價登錄 (registro de preços reais), nomes em camelCase e colunas snake_case.
     */
    public static FieldAliases defaults() {
        return DEFAULTS;
    }

    /**
     * Conjunto mínimo para documentos que já chegam quase canônicos: apenas o próprio nome do campo.
     */
    public static FieldAliases documentDefaults() {
        return DOCUMENT_DEFAULTS;
    }

    /**
     * Retorna uma cópia com as listas informadas substituindo as atuais, campo a campo.
     *
     * @param overrides Mapa de nome canônico (ex.: "price") para a nova lista de aliases.
     * @return Um novo FieldAliases; o atual não é alterado.
     * @throws IllegalArgumentException Se algum nome não corresponder a um campo canônico.
     */
    public FieldAliases withOverrides(Map<String, List<String>> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        EnumMap<CanonicalField, List<String>> merged = new EnumMap<>(aliases);
        overrides.forEach((key, names) -> {
            CanonicalField field = CanonicalField.fromKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("Campo canônico desconhecido no mapeamento de aliases: " + key));
            merged.put(field, Objects.requireNonNull(names, "Lista de aliases nula para o campo " + key));
        });
        return new FieldAliases(merged);
    }

    public List<String> of(CanonicalField field) {
        return aliases.getOrDefault(field, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FieldAliases && aliases.equals(((FieldAliases) o).aliases);
    }

    @Override
    public int hashCode() {
        return aliases.hashCode();
    }

    @Override
    public String toString() {
        return "FieldAliases" + aliases;
    }

    private static Map<CanonicalField, List<String>> defaultMapping() {
        EnumMap<CanonicalField, List<String>> mapping = new EnumMap<>(CanonicalField.class);
        mapping.put(CanonicalField.YEAR_MONTH, List.of("交易年月", "交易年月日", "yearMonth", "year_month", "date", "transaction_date"));
        mapping.put(CanonicalField.PRICE, List.of("單價元平方公尺", "單價", "price", "unitPrice", "unit_price"));
        mapping.put(CanonicalField.LATITUDE, List.of("緯度", "latitude", "lat"));
        mapping.put(CanonicalField.LONGITUDE, List.of("經度", "longitude", "lng", "lon"));
        mapping.put(CanonicalField.AREA, List.of("建物移轉總面積坪", "土地移轉總面積坪", "area"));
        mapping.put(CanonicalField.ADDRESS, List.of("交易標的", "土地位置建物門牌", "address"));
        mapping.put(CanonicalField.BUILDING_TYPE, List.of("建物型態", "建物現況格局-建物型態", "buildingType", "building_type"));
        mapping.put(CanonicalField.TOTAL_PRICE, List.of("總價元", "交易價格", "totalPrice", "total_price"));
        return mapping;
    }

    private static Map<CanonicalField, List<String>> canonicalOnlyMapping() {
        EnumMap<CanonicalField, List<String>> mapping = new EnumMap<>(CanonicalField.class);
        for (CanonicalField field : CanonicalField.values()) {
            mapping.put(field, List.of(field.key()));
        }
        return mapping;
    }
}
