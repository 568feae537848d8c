package com.example.realestate.model;

/**
 * Motivo pelo qual uma linha foi descartada. Nenhum motivo interrompe o processamento.
 */
public enum RejectionReason {
    MALFORMED_DOCUMENT,
    INVALID_YEAR_MONTH,
    PRICE_UNAVAILABLE,
    PRICE_OUT_OF_RANGE,
    MISSING_COORDINATES,
    GEOCODING_FAILED,
    BUILDING_TYPE_EXCLUDED,
    UNEXPECTED_ERROR
}
