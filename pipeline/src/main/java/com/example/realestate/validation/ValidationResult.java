package com.example.realestate.validation;

import com.example.realestate.model.Coordinates;
import com.example.realestate.model.RejectionReason;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Desfecho da validação de uma linha: aceita (com as coordenadas já convertidas) ou rejeitada com motivo.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    Coordinates coordinates;
    RejectionReason reason;
    String detail;

    public static ValidationResult accept(Coordinates coordinates) {
        return new ValidationResult(coordinates, null, null);
    }

    public static ValidationResult reject(RejectionReason reason, String detail) {
        return new ValidationResult(null, reason, detail);
    }

    public boolean isAccepted() {
        return reason == null;
    }
}
