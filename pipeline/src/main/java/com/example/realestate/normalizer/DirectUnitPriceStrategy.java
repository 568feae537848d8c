package com.example.realestate.normalizer;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.CanonicalField;
import com.example.realestate.model.RawRow;

import java.util.OptionalDouble;

/**
 * Usa a coluna de preço unitário quando ela traz um número finito diferente de zero.
 */
public class DirectUnitPriceStrategy implements PriceStrategy {

    @Override
    public OptionalDouble derive(RawRow row, FieldAliases aliases) {
        OptionalDouble price = NumberParser.parseFinite(FieldResolver.resolve(row, aliases.of(CanonicalField.PRICE)));
        if (price.isPresent() && price.getAsDouble() != 0) {
            return price;
        }
        return OptionalDouble.empty();
    }
}
