package com.example.realestate.validation;

import com.example.realestate.config.FilterCriteria;
import com.example.realestate.model.Coordinates;
import com.example.realestate.model.RejectionReason;
import com.example.realestate.model.TransactionCandidate;
import com.example.realestate.normalizer.NumberParser;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Aplica as regras de aceitação a uma transação candidata.
 * <p>
 * Cada regra rejeita a linha de forma independente:
 * - ano-mês não reconhecido;
 * - preço não derivável ou fora da faixa inclusiva [minPrice, maxPrice];
 * - coordenada ausente, não numérica ou igual a zero (zero é tratado como ausente);
 * - tipo de construção fora da lista permitida, quando ela não está vazia.
 */
public class TransactionValidator {

    public ValidationResult validate(TransactionCandidate candidate, FilterCriteria criteria) {
        if (candidate.getYearMonth().isEmpty()) {
            return ValidationResult.reject(RejectionReason.INVALID_YEAR_MONTH, "Ano-mês ausente ou em formato não reconhecido");
        }

        OptionalDouble price = candidate.getPrice();
        if (price.isEmpty()) {
            return ValidationResult.reject(RejectionReason.PRICE_UNAVAILABLE, "Preço unitário ausente e não derivável de preço total/área");
        }
        if (!criteria.admitsPrice(price.getAsDouble())) {
            return ValidationResult.reject(RejectionReason.PRICE_OUT_OF_RANGE,
                    String.format("Preço %.2f fora da faixa [%.2f, %.2f]", price.getAsDouble(), criteria.getMinPrice(), criteria.getMaxPrice()));
        }

        OptionalDouble longitude = nonZeroCoordinate(candidate.getLongitude());
        OptionalDouble latitude = nonZeroCoordinate(candidate.getLatitude());
        if (longitude.isEmpty() || latitude.isEmpty()) {
            return ValidationResult.reject(RejectionReason.MISSING_COORDINATES,
                    "Coordenadas ausentes ou inválidas: longitude=" + candidate.getLongitude().orElse("") + ", latitude=" + candidate.getLatitude().orElse(""));
        }

        String buildingType = candidate.getBuildingType().orElse(null);
        if (!criteria.admitsBuildingType(buildingType)) {
            return ValidationResult.reject(RejectionReason.BUILDING_TYPE_EXCLUDED, "Tipo de construção não permitido: " + buildingType);
        }

        return ValidationResult.accept(Coordinates.of(longitude.getAsDouble(), latitude.getAsDouble()));
    }

    private static OptionalDouble nonZeroCoordinate(Optional<String> raw) {
        OptionalDouble value = NumberParser.parseFinite(raw);
        if (value.isPresent() && value.getAsDouble() == 0) {
            return OptionalDouble.empty();
        }
        return value;
    }
}
