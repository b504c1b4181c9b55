package uk.gegc.lingocards.features.vocabulary.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum CefrLevel {
    A1,
    A2,
    B1,
    B2,
    C1,
    C2;

    public static Optional<CefrLevel> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(CefrLevel.valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
