package com.example.realestate.processor;

import com.example.realestate.adapter.CsvSourceAdapter;
import com.example.realestate.adapter.DocumentSourceAdapter;
import com.example.realestate.adapter.RelationalSourceAdapter;
import com.example.realestate.adapter.SourceLoadException;
import com.example.realestate.config.FilterCriteria;
import com.example.realestate.config.PipelineOptions;
import com.example.realestate.geocoding.GeocodingException;
import com.example.realestate.model.Coordinates;
import com.example.realestate.model.PipelineResult;
import com.example.realestate.model.RawRow;
import com.example.realestate.model.RejectionReason;
import com.example.realestate.model.TransactionRecord;
import com.example.realestate.normalizer.PriceDerivation;
import com.example.realestate.validation.TransactionValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class TransactionPipelineTest {

    private final TransactionPipeline pipeline = new TransactionPipeline();
    private final RelationalSourceAdapter relational = new RelationalSourceAdapter();

    private static Map<String, Object> row(double longitude, double latitude, double price, String yearMonth) {
        Map<String, Object> values = new HashMap<>();
        values.put("longitude", longitude);
        values.put("latitude", latitude);
        values.put("price", price);
        values.put("yearMonth", yearMonth);
        return values;
    }

    @Test
    void run_endToEnd_zeroCoordinatesAreRejected() {
        PipelineResult result = pipeline.run(relational, List.of(
                row(121.5435, 25.0267, 850000, "2023-01"),
                row(0, 0, 720000, "2023-01")), PipelineOptions.defaults());

        assertThat(result.getStatistics().getAccepted()).isEqualTo(1);
        assertThat(result.getStatistics().getSkipped()).isEqualTo(1);
        assertThat(result.getStatistics().getSkippedByReason()).containsEntry(RejectionReason.MISSING_COORDINATES, 1);

        TransactionRecord record = result.getRecords().get(0);
        assertThat(record.getPosition()).containsExactly(121.5435, 25.0267);
        assertThat(record.getPrice()).isEqualTo(850000.0);
        assertThat(record.getYearMonth()).isEqualTo("2023-01");
        assertThat(record.getArea()).isZero();
        assertThat(record.getAddress()).isEmpty();
        assertThat(record.getBuildingType()).isEmpty();
        assertThat(record.getTotalPrice()).isZero();
    }

    @Test
    void run_priceBoundsAreInclusive() {
        PipelineOptions options = PipelineOptions.builder()
                .filter(FilterCriteria.builder().minPrice(200_000).maxPrice(1_500_000).build())
                .build();

        PipelineResult result = pipeline.run(relational, List.of(
                row(121.5, 25.0, 200_000, "2023-01"),
                row(121.5, 25.0, 1_500_000, "2023-01"),
                row(121.5, 25.0, 199_999, "2023-01"),
                row(121.5, 25.0, 1_500_001, "2023-01")), options);

        assertThat(result.getRecords()).extracting(TransactionRecord::getPrice).containsExactly(200_000.0, 1_500_000.0);
        assertThat(result.getStatistics().getSkippedByReason()).containsEntry(RejectionReason.PRICE_OUT_OF_RANGE, 2);
    }

    @Test
    void run_csvRegistryExport_derivesPriceAndConvertsDates() {
        String csv = "鄉鎮市區,交易標的,交易年月日,總價元,建物移轉總面積坪,單價元平方公尺,建物型態,經度,緯度\n"
                + "大安區,房地(土地+建物),1120115,24225000,28.5,,住宅大樓(11層含以上有電梯),121.5435,25.0267\n"
                + "信義區,房地(土地+建物),1120203,24225000,0,,住宅大樓(11層含以上有電梯),121.5654,25.0330\n"
                + "中正區,房地(土地+建物),abc,24225000,28.5,,住宅大樓(11層含以上有電梯),121.5177,25.0329\n";

        PipelineResult result = pipeline.run(new CsvSourceAdapter(), new StringReader(csv), PipelineOptions.defaults());

        assertThat(result.getStatistics().getAccepted()).isEqualTo(1);
        assertThat(result.getStatistics().getSkippedByReason())
                .containsEntry(RejectionReason.PRICE_UNAVAILABLE, 1)
                .containsEntry(RejectionReason.INVALID_YEAR_MONTH, 1);

        TransactionRecord record = result.getRecords().get(0);
        assertThat(record.getYearMonth()).isEqualTo("2023-01");
        assertThat(record.getPrice()).isCloseTo(850000.0, within(1e-6));
        assertThat(record.getArea()).isEqualTo(28.5);
        assertThat(record.getTotalPrice()).isEqualTo(24225000.0);
        assertThat(record.getAddress()).isEqualTo("大安區房地(土地+建物)");
        assertThat(record.getBuildingType()).isEqualTo("住宅大樓(11層含以上有電梯)");
    }

    @Test
    void run_aliasOverrideChangesPrecedence() {
        Map<String, Object> values = row(121.5, 25.0, 1, "2023-01");
        values.put("單價", "850000");
        PipelineOptions options = PipelineOptions.builder()
                .fieldMapping(Map.of("price", List.of("單價", "price")))
                .build();

        PipelineResult result = pipeline.run(relational, List.of(values), options);

        assertThat(result.getRecords()).singleElement().extracting(TransactionRecord::getPrice).isEqualTo(850000.0);
    }

    @Test
    void run_documentSource_appliesStructuralGate() {
        String json = "["
                + "{\"position\":[121.5435,25.0267],\"price\":850000,\"yearMonth\":\"2023-01\",\"area\":28.5,\"address\":\"台北市大安區\"},"
                + "{\"position\":[121.5435],\"price\":850000,\"yearMonth\":\"2023-01\"},"
                + "{\"position\":[121.5435,25.0267],\"price\":0,\"yearMonth\":\"2023-01\"},"
                + "{\"position\":[121.5435,25.0267],\"yearMonth\":\"2023-01\"}"
                + "]";
        DocumentSourceAdapter adapter = new DocumentSourceAdapter(new ObjectMapper());

        PipelineResult result = pipeline.run(adapter, new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), PipelineOptions.defaults());

        assertThat(result.getStatistics().getAccepted()).isEqualTo(1);
        assertThat(result.getStatistics().getSkippedByReason())
                .containsEntry(RejectionReason.MALFORMED_DOCUMENT, 2)
                .containsEntry(RejectionReason.PRICE_UNAVAILABLE, 1);
        assertThat(result.getRecords().get(0).getAddress()).isEqualTo("台北市大安區");
        assertThat(result.getRecords().get(0).getArea()).isEqualTo(28.5);
    }

    @Test
    void run_sourceFailure_propagates() {
        DocumentSourceAdapter adapter = new DocumentSourceAdapter(new ObjectMapper());

        assertThatThrownBy(() -> pipeline.run(adapter, new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)), PipelineOptions.defaults()))
                .isInstanceOf(SourceLoadException.class);
    }

    @Test
    void run_geocodesOnlyRowsWithoutAnyCoordinate() {
        List<String> geocoded = new ArrayList<>();
        PipelineOptions options = PipelineOptions.builder()
                .geocoder(address -> {
                    geocoded.add(address);
                    return Coordinates.of(121.5654, 25.0330);
                })
                .build();
        String csv = "單價,交易年月,交易標的,經度,緯度\n"
                + "850000,2023-01,台北市信義區,,\n"
                + "850000,2023-01,台北市中山區,0,0\n";

        PipelineResult result = pipeline.run(new CsvSourceAdapter(), new StringReader(csv), options);

        assertThat(geocoded).containsExactly("台北市信義區");
        assertThat(result.getRecords()).singleElement()
                .extracting(TransactionRecord::getPosition)
                .isEqualTo(List.of(121.5654, 25.0330));
        assertThat(result.getStatistics().getSkippedByReason()).containsEntry(RejectionReason.MISSING_COORDINATES, 1);
    }

    @Test
    void run_geocodingFailure_rejectsOnlyThatRow() {
        PipelineOptions options = PipelineOptions.builder()
                .geocoder(address -> {
                    throw new GeocodingException("Endereço não encontrado: " + address);
                })
                .build();
        String csv = "單價,交易年月,交易標的,經度,緯度\n"
                + "850000,2023-01,lugar nenhum,,\n"
                + "850000,2023-01,,121.5,25.0\n";

        PipelineResult result = pipeline.run(new CsvSourceAdapter(), new StringReader(csv), options);

        assertThat(result.getStatistics().getAccepted()).isEqualTo(1);
        assertThat(result.getStatistics().getSkippedByReason()).containsEntry(RejectionReason.GEOCODING_FAILED, 1);
    }

    @Test
    void run_excludedBuildingType_isRejectedBeforeGeocoding() {
        List<String> geocoded = new ArrayList<>();
        PipelineOptions options = PipelineOptions.builder()
                .filter(FilterCriteria.builder().buildingType("華廈(10層含以下有電梯)").build())
                .geocoder(address -> {
                    geocoded.add(address);
                    return Coordinates.of(121.5654, 25.0330);
                })
                .build();
        String csv = "單價,交易年月,交易標的,建物型態,經度,緯度\n"
                + "850000,2023-01,台北市信義區,住宅大樓(11層含以上有電梯),,\n"
                + "850000,2023-01,台北市中山區,華廈(10層含以下有電梯),,\n";

        PipelineResult result = pipeline.run(new CsvSourceAdapter(), new StringReader(csv), options);

        assertThat(geocoded).containsExactly("台北市中山區");
        assertThat(result.getStatistics().getAccepted()).isEqualTo(1);
        assertThat(result.getStatistics().getSkippedByReason()).containsEntry(RejectionReason.BUILDING_TYPE_EXCLUDED, 1);
    }

    @Test
    void run_relationalRowsWithoutCoordinates_areNotGeocoded() {
        List<String> geocoded = new ArrayList<>();
        PipelineOptions options = PipelineOptions.builder()
                .geocoder(address -> {
                    geocoded.add(address);
                    return Coordinates.of(121.5654, 25.0330);
                })
                .build();
        Map<String, Object> withoutCoordinates = new HashMap<>(Map.of("unit_price", 850000, "year_month", "2023-01", "address", "台北市信義區"));

        PipelineResult result = pipeline.run(relational, List.of(withoutCoordinates), options);

        assertThat(geocoded).isEmpty();
        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getStatistics().getSkippedByReason()).containsOnly(entry(RejectionReason.MISSING_COORDINATES, 1));
    }

    @Test
    void run_unexpectedRowErrorIsCountedAndProcessingContinues() {
        PriceDerivation exploding = new PriceDerivation(List.of((row, aliases) -> {
            if ("boom".equals(row.getText("marker"))) {
                throw new IllegalStateException("falha simulada");
            }
            return OptionalDouble.of(850000);
        }));
        TransactionPipeline fragile = new TransactionPipeline(exploding, new TransactionValidator());
        Map<String, Object> bad = row(121.5, 25.0, 850000, "2023-01");
        bad.put("marker", "boom");

        PipelineResult result = fragile.run(relational, List.of(bad, row(121.5, 25.0, 850000, "2023-02")), PipelineOptions.defaults());

        assertThat(result.getRecords()).extracting(TransactionRecord::getYearMonth).containsExactly("2023-02");
        assertThat(result.getStatistics().getSkippedByReason()).containsEntry(RejectionReason.UNEXPECTED_ERROR, 1);
    }

    @Test
    void run_notifiesRejectionListener_andSurvivesListenerFailures() {
        List<RejectionReason> notified = new ArrayList<>();
        PipelineOptions options = PipelineOptions.builder()
                .rejectionListener((source, raw, reason, detail) -> {
                    notified.add(reason);
                    throw new IllegalStateException("arquivo indisponível");
                })
                .build();

        PipelineResult result = pipeline.run(relational, List.of(
                row(121.5, 25.0, 850000, "abc"),
                row(121.5, 25.0, 850000, "2023-01")), options);

        assertThat(notified).containsExactly(RejectionReason.INVALID_YEAR_MONTH);
        assertThat(result.getStatistics().getAccepted()).isEqualTo(1);
    }

    @Test
    void run_isIdempotent() {
        List<RawRow> rows = relational.readRows(List.of(
                row(121.5435, 25.0267, 850000, "112年01月"),
                row(121.5654, 25.0330, 50, "2023-01"),
                row(121.5177, 25.0329, 720000, "11202")));

        PipelineResult first = pipeline.run(rows, relational, PipelineOptions.defaults());
        PipelineResult second = pipeline.run(rows, relational, PipelineOptions.defaults());

        assertThat(second).isEqualTo(first);
        assertThat(first.getRecords()).extracting(TransactionRecord::getYearMonth).containsExactly("2023-01", "2023-02");
    }

    @Test
    void run_emptyInput_returnsEmptyResult() {
        PipelineResult result = pipeline.run(List.of(), relational, PipelineOptions.defaults());

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getStatistics().getTotal()).isZero();
    }
}
