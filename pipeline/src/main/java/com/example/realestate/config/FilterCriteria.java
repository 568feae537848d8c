package com.example.realestate.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Restrições aplicadas a cada transação: faixa inclusiva de preço unitário e,
 * opcionalmente, uma lista de tipos de construção permitidos (vazia = sem restrição).
 * Nenhuma verificação é feita sobre minPrice > maxPrice; nesse caso nenhuma linha passa.
 */
@Value
@Builder(toBuilder = true)
public class FilterCriteria {

    public static final double DEFAULT_MIN_PRICE = 100_000;
    public static final double DEFAULT_MAX_PRICE = 2_000_000;

    @Builder.Default
    double minPrice = DEFAULT_MIN_PRICE;
    @Builder.Default
    double maxPrice = DEFAULT_MAX_PRICE;
    @Singular
    Set<String> buildingTypes;

    public static FilterCriteria defaults() {
        return FilterCriteria.builder().build();
    }

    public boolean admitsPrice(double price) {
        return price >= minPrice && price <= maxPrice;
    }

    public boolean admitsBuildingType(String buildingType) {
        return buildingTypes.isEmpty() || buildingTypes.contains(buildingType);
    }
}
