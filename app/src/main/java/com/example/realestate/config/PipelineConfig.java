package com.example.realestate.config;

import com.example.realestate.adapter.CsvSourceAdapter;
import com.example.realestate.adapter.DocumentSourceAdapter;
import com.example.realestate.adapter.RelationalSourceAdapter;
import com.example.realestate.processor.TransactionPipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    private final PipelineProperties pipelineProperties;

    public PipelineConfig(PipelineProperties pipelineProperties) {
        this.pipelineProperties = pipelineProperties;
    }

    @Bean
    public TransactionPipeline transactionPipeline() {
        return new TransactionPipeline();
    }

    @Bean
    public CsvSourceAdapter csvSourceAdapter() {
        return new CsvSourceAdapter(pipelineProperties.getCsvDelimiter());
    }

    @Bean
    public DocumentSourceAdapter documentSourceAdapter(ObjectMapper objectMapper) {
        return new DocumentSourceAdapter(objectMapper);
    }

    @Bean
    public RelationalSourceAdapter relationalSourceAdapter() {
        return new RelationalSourceAdapter();
    }

    @PostConstruct
    public void validateProperties() {
        // Faixa invertida não é erro, mas nenhuma linha será aceita
        if (pipelineProperties.getMinPrice() > pipelineProperties.getMaxPrice()) {
            log.warn("ATENÇÃO: app.pipeline.min-price ({}) é maior que app.pipeline.max-price ({}). Nenhuma transação será aceita.",
                    pipelineProperties.getMinPrice(), pipelineProperties.getMaxPrice());
        }
        // Falha cedo para nomes de campo desconhecidos
        FieldAliases.defaults().withOverrides(pipelineProperties.getFieldMapping());
    }
}
