package com.example.realestate.normalizer;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.RawRow;

import java.util.OptionalDouble;

/**
 * Uma forma de obter o preço unitário de uma linha. Vazio significa que a estratégia não se aplica.
 */
public interface PriceStrategy {

    OptionalDouble derive(RawRow row, FieldAliases aliases);
}
