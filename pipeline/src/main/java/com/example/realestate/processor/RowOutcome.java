package com.example.realestate.processor;

import com.example.realestate.model.RejectionReason;
import com.example.realestate.model.TransactionRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Resultado do processamento de uma única linha.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class RowOutcome {

    TransactionRecord record;
    RejectionReason reason;
    String detail;

    static RowOutcome accepted(TransactionRecord record) {
        return new RowOutcome(record, null, null);
    }

    static RowOutcome rejected(RejectionReason reason, String detail) {
        return new RowOutcome(null, reason, detail);
    }

    boolean isAccepted() {
        return record != null;
    }
}
