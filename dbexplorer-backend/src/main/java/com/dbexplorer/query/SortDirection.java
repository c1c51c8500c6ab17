package com.dbexplorer.query;

import java.util.Locale;
import java.util.Optional;

public enum SortDirection {
    ASC,
    DESC;

    public static Optional<SortDirection> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "asc":
                return Optional.of(ASC);
            case "desc":
                return Optional.of(DESC);
            default:
                return Optional.empty();
        }
    }
}
