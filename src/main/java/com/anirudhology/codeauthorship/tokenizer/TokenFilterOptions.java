package com.anirudhology.codeauthorship.tokenizer;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Toggles of the token vocabulary filter. Every toggle is independent.
 *
 * @param includeTypes    keep only tokens of these types (ignored when excludeTypes is non-empty)
 * @param excludeTypes    drop tokens of these types
 * @param reservedOnly    keep only reserved words of the language
 * @param nonReservedOnly keep only tokens that are not reserved words
 * @param minAuthorUsage  keep only tokens used by at least this many distinct authors, null to disable
 */
public record TokenFilterOptions(Set<String> includeTypes,
                                 Set<String> excludeTypes,
                                 boolean reservedOnly,
                                 boolean nonReservedOnly,
                                 Integer minAuthorUsage) {

    public TokenFilterOptions {
        includeTypes = includeTypes == null ? Set.of() : Set.copyOf(includeTypes);
        excludeTypes = excludeTypes == null ? Set.of() : Set.copyOf(excludeTypes);
        if (minAuthorUsage != null && minAuthorUsage <= 0) {
            throw new IllegalArgumentException("minAuthorUsage must be positive, got: " + minAuthorUsage);
        }
    }

    /**
     * @return options that keep every token
     */
    public static TokenFilterOptions none() {
        return new TokenFilterOptions(Set.of(), Set.of(), false, false, null);
    }

    /**
     * Parses a comma separated list of token types, dropping empty entries
     *
     * @param csv list such as "NAME,OP"; null or blank yields an empty set
     * @return ordered set of the listed types
     */
    public static Set<String> parseTypes(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(type -> !type.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean usesAuthorUsage() {
        return this.minAuthorUsage != null;
    }
}
