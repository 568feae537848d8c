package com.example.realestate.config;

import com.example.realestate.geocoding.Geocoder;
import com.example.realestate.processor.RejectionListener;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Configuração de uma execução do pipeline.
 * {@code fieldMapping} é uma sobreposição parcial, mesclada sobre os aliases padrão do adaptador.
 */
@Value
@Builder(toBuilder = true)
public class PipelineOptions {

    @Builder.Default
    Map<String, List<String>> fieldMapping = Map.of();
    @Builder.Default
    FilterCriteria filter = FilterCriteria.defaults();
    @Builder.Default
    Geocoder geocoder = Geocoder.unavailable();
    @Builder.Default
    RejectionListener rejectionListener = RejectionListener.NONE;

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().build();
    }

    public FieldAliases aliasesOver(FieldAliases defaults) {
        return defaults.withOverrides(fieldMapping);
    }
}
