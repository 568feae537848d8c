package com.example.realestate.model;

import lombok.Value;

import java.util.List;

/**
 * Resultado de uma execução: registros aceitos, na ordem de entrada, e as estatísticas da execução.
 */
@Value
public class PipelineResult {
    List<TransactionRecord> records;
    RunStatistics statistics;
}
