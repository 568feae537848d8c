package com.example.realestate.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Campos resolvidos e derivados de uma linha, ainda não validados.
 * Campos ausentes são representados por {@code Optional} vazio, nunca por zero ou texto vazio.
 */
@Value
@With
@Builder
public class TransactionCandidate {

    @Builder.Default
    Optional<String> yearMonth = Optional.empty();
    @Builder.Default
    OptionalDouble price = OptionalDouble.empty();
    @Builder.Default
    Optional<String> longitude = Optional.empty();
    @Builder.Default
    Optional<String> latitude = Optional.empty();
    @Builder.Default
    Optional<String> area = Optional.empty();
    @Builder.Default
    Optional<String> address = Optional.empty();
    @Builder.Default
    Optional<String> buildingType = Optional.empty();
    @Builder.Default
    Optional<String> totalPrice = Optional.empty();

    /**
     * @return true quando nenhuma das duas coordenadas foi encontrada na linha.
     */
    public boolean hasNoCoordinates() {
        return longitude.isEmpty() && latitude.isEmpty();
    }
}
