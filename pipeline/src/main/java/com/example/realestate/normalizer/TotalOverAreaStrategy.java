package com.example.realestate.normalizer;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.CanonicalField;
import com.example.realestate.model.RawRow;

import java.util.OptionalDouble;

/**
 * Calcula o preço unitário como preço total dividido pela área.
 * Área ausente, zero ou negativa não produz preço.
 */
public class TotalOverAreaStrategy implements PriceStrategy {

    @Override
    public OptionalDouble derive(RawRow row, FieldAliases aliases) {
        OptionalDouble totalPrice = NumberParser.parseFinite(FieldResolver.resolve(row, aliases.of(CanonicalField.TOTAL_PRICE)));
        OptionalDouble area = NumberParser.parseFinite(FieldResolver.resolve(row, aliases.of(CanonicalField.AREA)));
        if (totalPrice.isEmpty() || area.isEmpty() || area.getAsDouble() <= 0) {
            return OptionalDouble.empty();
        }
        double unitPrice = totalPrice.getAsDouble() / area.getAsDouble();
        return Double.isFinite(unitPrice) ? OptionalDouble.of(unitPrice) : OptionalDouble.empty();
    }
}
