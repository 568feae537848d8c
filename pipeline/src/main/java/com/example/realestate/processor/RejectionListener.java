package com.example.realestate.processor;

import com.example.realestate.model.RawRow;
import com.example.realestate.model.RejectionReason;

/**
 * Observador de linhas descartadas (arquivamento, métricas). Não participa da decisão de aceitação.
 */
@FunctionalInterface
public interface RejectionListener {

    RejectionListener NONE = (sourceName, row, reason, detail) -> {
    };

    void onRejected(String sourceName, RawRow row, RejectionReason reason, String detail);
}
