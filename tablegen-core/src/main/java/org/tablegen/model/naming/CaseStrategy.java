package org.tablegen.model.naming;

import java.util.List;
import java.util.Locale;

/**
 * Identifier case convention of a catalog. Oracle stores unquoted names upper-cased,
 * PostgreSQL and MySQL are matched lower-cased; table filters are folded with the
 * backend's strategy before they are bound.
 */
public enum CaseStrategy {
    LOWER { public String normalize(String s){ return s == null ? "" : s.trim().toLowerCase(Locale.ROOT); } },
    UPPER { public String normalize(String s){ return s == null ? "" : s.trim().toUpperCase(Locale.ROOT); } };

    public abstract String normalize(String raw);

    /** Normalizes every name, dropping blanks and duplicates while keeping the first-seen order. */
    public List<String> normalizeAll(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .map(this::normalize)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
