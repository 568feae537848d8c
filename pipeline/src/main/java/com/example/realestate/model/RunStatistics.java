package com.example.realestate.model;

import lombok.Value;

import java.util.Map;

/**
 * Contagem de linhas aceitas e descartadas em uma execução do pipeline.
 */
@Value
public class RunStatistics {
    int accepted;
    int skipped;
    Map<RejectionReason, Integer> skippedByReason;

    public int getTotal() {
        return accepted + skipped;
    }
}
