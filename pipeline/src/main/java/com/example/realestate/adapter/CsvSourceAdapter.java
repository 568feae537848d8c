package com.example.realestate.adapter;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.CanonicalField;
import com.example.realestate.model.RawRow;
import com.example.realestate.normalizer.FieldResolver;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lê texto delimitado com cabeçalho (ex.: exportação CSV do 實價登錄) e expõe cada registro como linha bruta.
 */
public class CsvSourceAdapter implements SourceAdapter<Reader> {

    private static final Logger log = LoggerFactory.getLogger(CsvSourceAdapter.class);

    private static final char BOM = '\uFEFF';
    private static final String CITY_COLUMN = "縣市";
    private static final String DISTRICT_COLUMN = "鄉鎮市區";

    private final CSVFormat format;

    public CsvSourceAdapter() {
        this(',');
    }

    public CsvSourceAdapter(char delimiter) {
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
    }

    @Override
    public String name() {
        return "csv";
    }

    /**
     * Faz o parsing completo do texto delimitado. O BOM, se houver, é removido do primeiro cabeçalho
     * e colunas sem nome (ex.: delimitador no fim do cabeçalho) são ignoradas.
     *
     * @param reader O conteúdo delimitado; não é fechado por este método.
     * @return As linhas na ordem do arquivo.
     * @throws SourceLoadException Se o conteúdo não puder ser lido ou estiver malformado.
     */
    @Override
    public List<RawRow> readRows(Reader reader) {
        try {
            CSVParser csvParser = CSVParser.parse(reader, format);
            List<RawRow> rows = new ArrayList<>();
            for (CSVRecord csvRecord : csvParser) {
                rows.add(RawRow.of(cleanHeaders(csvRecord.toMap())));
            }
            log.info("Lidas {} linhas de texto delimitado. Cabeçalhos: {}", rows.size(), csvParser.getHeaderNames());
            return rows;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            log.error("Erro ao ler conteúdo delimitado: {}", e.getMessage(), e);
            throw new SourceLoadException("Falha ao ler conteúdo CSV: " + e.getMessage(), e);
        }
    }

    @Override
    public FieldAliases defaultAliases() {
        return FieldAliases.defaults();
    }

    @Override
    public boolean supportsGeocoding() {
        return true;
    }

    /**
     * Endereço precedido de cidade e distrito, quando essas colunas existem e ainda não fazem parte do valor.
     */
    @Override
    public Optional<String> resolveAddress(RawRow row, FieldAliases aliases) {
        Optional<String> address = FieldResolver.resolve(row, aliases.of(CanonicalField.ADDRESS));
        String prefix = Stream.of(FieldResolver.resolve(row, List.of(CITY_COLUMN)), FieldResolver.resolve(row, List.of(DISTRICT_COLUMN)))
                .flatMap(Optional::stream)
                .collect(Collectors.joining());
        if (prefix.isEmpty()) {
            return address;
        }
        if (address.isEmpty()) {
            return Optional.of(prefix);
        }
        return Optional.of(address.get().startsWith(prefix) ? address.get() : prefix + address.get());
    }

    private static Map<String, String> cleanHeaders(Map<String, String> values) {
        Map<String, String> cleaned = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key == null) {
                return;
            }
            String header = !key.isEmpty() && key.charAt(0) == BOM ? key.substring(1) : key;
            if (!header.isBlank()) {
                cleaned.put(header, value);
            }
        });
        return cleaned;
    }
}
