package com.example.realestate.normalizer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converte expressões de ano-mês em {@code YYYY-MM}.
 * <p>
 * Formatos reconhecidos, testados nesta ordem:
 * <ol>
 *     <li>{@code 112年01月} - ano do calendário Minguo (民國) mais 1911;</li>
 *     <li>{@code 2023-01} ou {@code 2023-01-15} - gregoriano, os 7 primeiros caracteres;</li>
 *     <li>{@code 11201} (e {@code 1120115}) - ano Minguo com 3 dígitos seguido do mês.</li>
 * </ol>
 * Os formatos são tentados por forma, sem validação cruzada do mês.
 */
public final class YearMonthNormalizer {

    public static final int MINGUO_OFFSET = 1911;

    private static final Pattern ERA_LONG = Pattern.compile("(\\d{1,4})年(\\d{1,2})月");
    private static final Pattern GREGORIAN = Pattern.compile("^\\d{4}-\\d{2}");
    private static final Pattern ERA_COMPACT = Pattern.compile("^(\\d{3})(\\d{2})");

    private YearMonthNormalizer() {
    }

    /**
     * @param raw O valor bruto da coluna de data.
     * @return O ano-mês canônico, ou vazio se nenhum formato for reconhecido.
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();

        Matcher eraLong = ERA_LONG.matcher(value);
        if (eraLong.find()) {
            int year = Integer.parseInt(eraLong.group(1)) + MINGUO_OFFSET;
            return year > 9999 ? Optional.empty() : Optional.of(format(year, eraLong.group(2)));
        }

        if (GREGORIAN.matcher(value).find()) {
            return Optional.of(value.substring(0, 7));
        }

        Matcher eraCompact = ERA_COMPACT.matcher(value);
        if (eraCompact.find()) {
            int year = Integer.parseInt(eraCompact.group(1)) + MINGUO_OFFSET;
            return Optional.of(format(year, eraCompact.group(2)));
        }

        return Optional.empty();
    }

    public static Optional<String> normalize(Optional<String> raw) {
        return raw.flatMap(YearMonthNormalizer::normalize);
    }

    private static String format(int year, String month) {
        return String.format("%04d-%s", year, month.length() == 1 ? "0" + month : month);
    }
}
