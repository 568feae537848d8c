package com.example.realestate.adapter;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.CanonicalField;
import com.example.realestate.model.RawRow;
import com.example.realestate.normalizer.FieldResolver;

import java.util.List;
import java.util.Optional;

/**
 * Apresenta as linhas nativas de uma fonte pela interface chave-valor comum consumida pelo pipeline.
 *
 * @param <I> A representação materializada da fonte (texto delimitado, documento, resultado de consulta).
 */
public interface SourceAdapter<I> {

    /**
     * Nome curto da fonte, usado em logs e no arquivamento de linhas rejeitadas.
     */
    String name();

    /**
     * @throws SourceLoadException Se a entrada não puder ser lida como sequência de linhas.
     */
    List<RawRow> readRows(I input);

    FieldAliases defaultAliases();

    /**
     * Verificação estrutural feita antes de qualquer resolução de campos.
     *
     * @return Descrição do problema, ou vazio se a linha pode seguir para validação.
     */
    default Optional<String> checkStructure(RawRow row) {
        return Optional.empty();
    }

    /**
     * Indica se linhas desta fonte sem nenhuma coordenada podem ser geocodificadas pelo endereço.
     * Resultados de consulta relacional já trazem coordenadas padronizadas e não são geocodificados.
     */
    default boolean supportsGeocoding() {
        return false;
    }

    default Optional<String> resolveAddress(RawRow row, FieldAliases aliases) {
        return FieldResolver.resolve(row, aliases.of(CanonicalField.ADDRESS));
    }
}
