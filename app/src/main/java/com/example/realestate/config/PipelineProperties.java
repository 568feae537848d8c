package com.example.realestate.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    @NotNull(message = "O preço unitário mínimo deve ser informado.")
    @PositiveOrZero(message = "O preço unitário mínimo não pode ser negativo.")
    private Double minPrice = FilterCriteria.DEFAULT_MIN_PRICE;

    @NotNull(message = "O preço unitário máximo deve ser informado.")
    @PositiveOrZero(message = "O preço unitário máximo não pode ser negativo.")
    private Double maxPrice = FilterCriteria.DEFAULT_MAX_PRICE;

    /**
     * Tipos de construção aceitos. Lista vazia aceita todos.
     */
    private List<String> buildingTypes = new ArrayList<>();

    /**
     * Sobreposição parcial dos aliases padrão, por campo canônico (ex.: price, yearMonth).
     */
    private Map<String, List<String>> fieldMapping = new LinkedHashMap<>();

    private char csvDelimiter = ',';

    public FilterCriteria toFilterCriteria() {
        return FilterCriteria.builder()
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .buildingTypes(buildingTypes)
                .build();
    }
}
