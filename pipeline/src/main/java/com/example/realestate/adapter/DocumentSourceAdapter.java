package com.example.realestate.adapter;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.CanonicalField;
import com.example.realestate.model.RawRow;
import com.example.realestate.normalizer.FieldResolver;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lê um array JSON de documentos já no formato canônico
 * ({@code position: [lng, lat]}, {@code price}, {@code yearMonth}, ...).
 * O par {@code position} é exposto como os campos {@code longitude} e {@code latitude}.
 */
public class DocumentSourceAdapter implements SourceAdapter<InputStream> {

    private static final Logger log = LoggerFactory.getLogger(DocumentSourceAdapter.class);

    static final String POSITION = "position";

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DocumentSourceAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json";
    }

    /**
     * @throws SourceLoadException Se o conteúdo não for JSON válido ou não for um array.
     */
    @Override
    public List<RawRow> readRows(InputStream inputStream) {
        JsonNode root;
        try {
            root = objectMapper.readTree(inputStream);
        } catch (IOException e) {
            log.error("Erro ao parsear documento JSON: {}", e.getMessage(), e);
            throw new SourceLoadException("Falha ao ler documento JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new SourceLoadException("Formato de dados inválido: o documento deve ser um array");
        }

        List<Object> elements = new ArrayList<>();
        root.forEach(node -> elements.add(node.isObject() ? objectMapper.convertValue(node, DOCUMENT_TYPE) : null));
        log.info("Lidos {} documentos do array JSON.", elements.size());
        return toRows(elements);
    }

    /**
     * Converte documentos já materializados. Elementos que não são objetos viram linhas vazias,
     * descartadas pela verificação estrutural.
     */
    public List<RawRow> toRows(List<?> documents) {
        List<RawRow> rows = new ArrayList<>(documents.size());
        for (Object document : documents) {
            rows.add(toRow(document));
        }
        return rows;
    }

    @Override
    public FieldAliases defaultAliases() {
        return FieldAliases.documentDefaults();
    }

    @Override
    public boolean supportsGeocoding() {
        return true;
    }

    @Override
    public Optional<String> checkStructure(RawRow row) {
        if (!isCoordinatePair(row.get(POSITION))) {
            return Optional.of("Campo 'position' ausente ou não é um par [longitude, latitude]");
        }
        if (FieldResolver.resolve(row, List.of(CanonicalField.PRICE.key())).isEmpty()
                || FieldResolver.resolve(row, List.of(CanonicalField.YEAR_MONTH.key())).isEmpty()) {
            return Optional.of("Campos obrigatórios 'price' e 'yearMonth' ausentes");
        }
        return Optional.empty();
    }

    private static RawRow toRow(Object document) {
        if (!(document instanceof Map)) {
            return RawRow.of(Map.of());
        }
        Map<?, ?> map = (Map<?, ?>) document;
        Map<String, Object> values = new LinkedHashMap<>();
        map.forEach((key, value) -> values.put(String.valueOf(key), value));
        Object position = values.get(POSITION);
        if (isCoordinatePair(position)) {
            List<?> pair = (List<?>) position;
            values.put(CanonicalField.LONGITUDE.key(), pair.get(0));
            values.put(CanonicalField.LATITUDE.key(), pair.get(1));
        }
        return RawRow.of(values);
    }

    private static boolean isCoordinatePair(Object position) {
        return position instanceof List && ((List<?>) position).size() == 2;
    }
}
