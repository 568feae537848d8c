package com.example.realestate.adapter;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.RawRow;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Expõe linhas de resultado de consulta relacional (colunas snake_case já padronizadas) como linhas brutas.
 * Valores de data JDBC são lidos como texto ISO e aceitos pelo formato gregoriano.
 */
public class RelationalSourceAdapter implements SourceAdapter<List<Map<String, Object>>> {

    @Override
    public String name() {
        return "db";
    }

    @Override
    public List<RawRow> readRows(List<Map<String, Object>> resultRows) {
        if (resultRows == null) {
            throw new SourceLoadException("A consulta não retornou um conjunto de resultados");
        }
        return resultRows.stream()
                .map(RawRow::of)
                .collect(Collectors.toList());
    }

    @Override
    public FieldAliases defaultAliases() {
        return FieldAliases.defaults();
    }
}
