package com.example.realestate.normalizer;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.RawRow;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Deriva o preço unitário aplicando as estratégias em ordem; a primeira que produzir valor vence.
 * Nenhuma conversão de unidade é feita.
 */
public class PriceDerivation {

    private final List<PriceStrategy> strategies;

    public PriceDerivation() {
        this(List.of(new DirectUnitPriceStrategy(), new TotalOverAreaStrategy()));
    }

    public PriceDerivation(List<PriceStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public OptionalDouble derive(RawRow row, FieldAliases aliases) {
        for (PriceStrategy strategy : strategies) {
            OptionalDouble price = strategy.derive(row, aliases);
            if (price.isPresent()) {
                return price;
            }
        }
        return OptionalDouble.empty();
    }
}
