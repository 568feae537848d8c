package com.example.realestate.processor;

import com.example.realestate.adapter.SourceAdapter;
import com.example.realestate.config.FieldAliases;
import com.example.realestate.config.FilterCriteria;
import com.example.realestate.config.PipelineOptions;
import com.example.realestate.geocoding.GeocodingException;
import com.example.realestate.model.CanonicalField;
import com.example.realestate.model.Coordinates;
import com.example.realestate.model.PipelineResult;
import com.example.realestate.model.RawRow;
import com.example.realestate.model.RejectionReason;
import com.example.realestate.model.RunStatistics;
import com.example.realestate.model.TransactionCandidate;
import com.example.realestate.model.TransactionRecord;
import com.example.realestate.normalizer.FieldResolver;
import com.example.realestate.normalizer.NumberParser;
import com.example.realestate.normalizer.PriceDerivation;
import com.example.realestate.normalizer.YearMonthNormalizer;
import com.example.realestate.validation.TransactionValidator;
import com.example.realestate.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orquestra o processamento linha a linha: verificação estrutural, resolução de campos,
 * conversão de data, derivação de preço, validação e construção do registro canônico.
 * <p>
 * Cada chamada de {@code run} mantém seu próprio estado; a instância pode ser compartilhada.
 * Nenhum problema de qualidade de dados interrompe a execução: a linha é descartada e contada.
 */
public class TransactionPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransactionPipeline.class);

    private final PriceDerivation priceDerivation;
    private final TransactionValidator validator;

    public TransactionPipeline() {
        this(new PriceDerivation(), new TransactionValidator());
    }

    public TransactionPipeline(PriceDerivation priceDerivation, TransactionValidator validator) {
        this.priceDerivation = priceDerivation;
        this.validator = validator;
    }

    /**
     * Lê as linhas da entrada pelo adaptador e as processa.
     *
     * @throws com.example.realestate.adapter.SourceLoadException Se a entrada não puder ser lida.
     */
    public <I> PipelineResult run(SourceAdapter<I> adapter, I input, PipelineOptions options) {
        return run(adapter.readRows(input), adapter, options);
    }

    /**
     * Processa linhas já materializadas, na ordem recebida.
     *
     * @param rows As linhas brutas.
     * @param adapter O adaptador da fonte, que define aliases padrão e verificação estrutural.
     * @param options Sobreposição de aliases, filtros, geocoder e observador de rejeições.
     * @return Os registros aceitos, na ordem de entrada, e as contagens da execução.
     */
    public PipelineResult run(List<RawRow> rows, SourceAdapter<?> adapter, PipelineOptions options) {
        FieldAliases aliases = options.aliasesOver(adapter.defaultAliases());
        log.info("Iniciando o processamento de {} linhas da fonte '{}'. Filtros: {}", rows.size(), adapter.name(), options.getFilter());

        List<TransactionRecord> records = new ArrayList<>();
        Map<RejectionReason, Integer> skippedByReason = new EnumMap<>(RejectionReason.class);
        int skipped = 0;

        for (RawRow row : rows) {
            RowOutcome outcome;
            try {
                outcome = processRow(row, adapter, aliases, options);
            } catch (RuntimeException e) {
                log.error("Erro inesperado ao processar linha da fonte '{}': {}. Registro: {}", adapter.name(), e.getMessage(), row, e);
                outcome = RowOutcome.rejected(RejectionReason.UNEXPECTED_ERROR, "Erro inesperado: " + e.getClass().getSimpleName());
            }

            if (outcome.isAccepted()) {
                records.add(outcome.getRecord());
            } else {
                skipped++;
                skippedByReason.merge(outcome.getReason(), 1, Integer::sum);
                log.debug("Linha descartada ({}): {}. Registro: {}", outcome.getReason(), outcome.getDetail(), row);
                notifyRejection(options, adapter.name(), row, outcome);
            }
        }

        RunStatistics statistics = new RunStatistics(records.size(), skipped, Collections.unmodifiableMap(new EnumMap<>(skippedByReason)));
        log.info("Processamento da fonte '{}' concluído. Aceitas: {}, Descartadas: {}, Motivos: {}",
                adapter.name(), statistics.getAccepted(), statistics.getSkipped(), statistics.getSkippedByReason());
        return new PipelineResult(Collections.unmodifiableList(records), statistics);
    }

    private RowOutcome processRow(RawRow row, SourceAdapter<?> adapter, FieldAliases aliases, PipelineOptions options) {
        Optional<String> structuralProblem = adapter.checkStructure(row);
        if (structuralProblem.isPresent()) {
            return RowOutcome.rejected(RejectionReason.MALFORMED_DOCUMENT, structuralProblem.get());
        }

        TransactionCandidate candidate = TransactionCandidate.builder()
                .yearMonth(YearMonthNormalizer.normalize(resolve(row, aliases, CanonicalField.YEAR_MONTH)))
                .price(priceDerivation.derive(row, aliases))
                .longitude(resolve(row, aliases, CanonicalField.LONGITUDE))
                .latitude(resolve(row, aliases, CanonicalField.LATITUDE))
                .area(resolve(row, aliases, CanonicalField.AREA))
                .address(adapter.resolveAddress(row, aliases))
                .buildingType(resolve(row, aliases, CanonicalField.BUILDING_TYPE))
                .totalPrice(resolve(row, aliases, CanonicalField.TOTAL_PRICE))
                .build();

        FilterCriteria filter = options.getFilter();
        ValidationResult result = validator.validate(candidate, filter);

        if (needsGeocoding(adapter, result, candidate)) {
            String buildingType = candidate.getBuildingType().orElse(null);
            if (!filter.admitsBuildingType(buildingType)) {
                return RowOutcome.rejected(RejectionReason.BUILDING_TYPE_EXCLUDED, "Tipo de construção não permitido: " + buildingType);
            }
            try {
                Coordinates coordinates = options.getGeocoder().geocode(candidate.getAddress().get());
                candidate = candidate
                        .withLongitude(Optional.of(String.valueOf(coordinates.getLongitude())))
                        .withLatitude(Optional.of(String.valueOf(coordinates.getLatitude())));
                result = validator.validate(candidate, filter);
            } catch (GeocodingException e) {
                return RowOutcome.rejected(RejectionReason.GEOCODING_FAILED, e.getMessage());
            }
        }

        if (!result.isAccepted()) {
            return RowOutcome.rejected(result.getReason(), result.getDetail());
        }
        return RowOutcome.accepted(toRecord(candidate, result.getCoordinates()));
    }

    private static boolean needsGeocoding(SourceAdapter<?> adapter, ValidationResult result, TransactionCandidate candidate) {
        return adapter.supportsGeocoding()
                && !result.isAccepted()
                && result.getReason() == RejectionReason.MISSING_COORDINATES
                && candidate.hasNoCoordinates()
                && candidate.getAddress().isPresent();
    }

    private static TransactionRecord toRecord(TransactionCandidate candidate, Coordinates coordinates) {
        return TransactionRecord.builder()
                .position(List.of(coordinates.getLongitude(), coordinates.getLatitude()))
                .price(candidate.getPrice().getAsDouble())
                .yearMonth(candidate.getYearMonth().get())
                .area(Math.max(0, NumberParser.orZero(candidate.getArea())))
                .address(candidate.getAddress().orElse(""))
                .buildingType(candidate.getBuildingType().orElse(""))
                .totalPrice(Math.max(0, NumberParser.orZero(candidate.getTotalPrice())))
                .build();
    }

    private static Optional<String> resolve(RawRow row, FieldAliases aliases, CanonicalField field) {
        return FieldResolver.resolve(row, aliases.of(field));
    }

    private static void notifyRejection(PipelineOptions options, String sourceName, RawRow row, RowOutcome outcome) {
        try {
            options.getRejectionListener().onRejected(sourceName, row, outcome.getReason(), outcome.getDetail());
        } catch (RuntimeException e) {
            log.warn("Falha ao notificar rejeição da linha da fonte '{}': {}", sourceName, e.getMessage(), e);
        }
    }
}
