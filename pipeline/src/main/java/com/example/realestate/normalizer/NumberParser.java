package com.example.realestate.normalizer;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Conversão tolerante de texto para número, usada por todas as etapas do pipeline.
 */
public final class NumberParser {

    private NumberParser() {
    }

    /**
     * Converte o texto em número decimal finito. Separadores de milhar (",") são ignorados.
     * NaN, infinito ou texto não numérico resultam em vazio.
     */
    public static OptionalDouble parseFinite(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String normalized = text.trim().replace(",", "");
        if (normalized.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(normalized);
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public static OptionalDouble parseFinite(Optional<String> text) {
        return text.map(NumberParser::parseFinite).orElse(OptionalDouble.empty());
    }

    /**
     * Lê um campo numérico opcional; ausente ou inválido vale zero.
     */
    public static double orZero(Optional<String> text) {
        return parseFinite(text).orElse(0);
    }
}
