package com.example.realestate.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Campos canônicos de uma transação imobiliária, independentes da nomenclatura de cada fonte.
 */
public enum CanonicalField {
    LONGITUDE("longitude"),
    LATITUDE("latitude"),
    YEAR_MONTH("yearMonth"),
    PRICE("price"),
    AREA("area"),
    ADDRESS("address"),
    BUILDING_TYPE("buildingType"),
    TOTAL_PRICE("totalPrice");

    private final String key;

    CanonicalField(String key) {
        this.key = key;
    }

    /**
     * @return O nome do campo no documento canônico (camelCase).
     */
    public String key() {
        return key;
    }

    public static Optional<CanonicalField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(field -> field.key.equalsIgnoreCase(key))
                .findFirst();
    }
}
