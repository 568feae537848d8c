package com.example.realestate.loader;

import java.util.Locale;
import java.util.Optional;

public enum SourceFormat {
    CSV,
    JSON;

    public static Optional<SourceFormat> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Deduz o formato pelo content-type e, na falta dele, pela extensão do nome.
     */
    public static Optional<SourceFormat> detect(String contentType, String name) {
        if (contentType != null) {
            String type = contentType.toLowerCase(Locale.ROOT);
            if (type.contains("application/json")) {
                return Optional.of(JSON);
            }
            if (type.contains("text/csv")) {
                return Optional.of(CSV);
            }
        }
        if (name != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".json")) {
                return Optional.of(JSON);
            }
            if (lower.endsWith(".csv")) {
                return Optional.of(CSV);
            }
        }
        return Optional.empty();
    }
}
