package com.example.realestate.normalizer;

import com.example.realestate.model.RawRow;

import java.util.List;
import java.util.Optional;

/**
 * Busca o valor de um campo canônico percorrendo a lista de aliases em ordem.
 */
public final class FieldResolver {

    private FieldResolver() {
    }

    /**
     * Retorna o primeiro valor presente, não nulo e não vazio entre os aliases informados.
     * Um valor "0" é retornado normalmente; somente a ausência resulta em {@code Optional.empty()}.
     *
     * @param row A linha bruta.
     * @param aliases Nomes de coluna aceitos, em ordem de precedência.
     * @return O valor encontrado, sem espaços nas extremidades.
     */
    public static Optional<String> resolve(RawRow row, List<String> aliases) {
        for (String alias : aliases) {
            String value = row.getText(alias);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }
}
