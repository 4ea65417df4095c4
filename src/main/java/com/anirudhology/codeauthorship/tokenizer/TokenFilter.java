package com.anirudhology.codeauthorship.tokenizer;

import com.anirudhology.codeauthorship.types.TokenRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Narrows the token list of an example according to {@link TokenFilterOptions}.
 * <p>
 * Filters run in a fixed order, each one on the output of the previous one:
 * 1. type exclusion, or type inclusion when no exclusion is configured
 * 2. reserved words only
 * 3. non-reserved words only
 * 4. minimum number of distinct authors using the token
 * <p>
 * The source list is never modified; every call works on its own copy.
 */
public class TokenFilter {

    private final TokenFilterOptions options;

    // Keywords and builtins of the language being filtered
    private final Set<String> reservedWords;

    // Null unless the options ask for author usage gating
    private final AuthorUsage authorUsage;

    public TokenFilter(TokenFilterOptions options, Set<String> reservedWords, AuthorUsage authorUsage) {
        if (options.usesAuthorUsage() && authorUsage == null) {
            throw new IllegalArgumentException("minAuthorUsage is set but no author usage table was supplied");
        }
        this.options = options;
        this.reservedWords = reservedWords;
        this.authorUsage = authorUsage;
    }

    /**
     * @param tokens token list of one example
     * @return a new list holding the retained tokens in their original order
     */
    public List<TokenRecord> apply(List<TokenRecord> tokens) {
        List<TokenRecord> retained = new ArrayList<>(tokens);

        if (!this.options.excludeTypes().isEmpty()) {
            retained.removeIf(token -> hasType(token, this.options.excludeTypes()));
        } else if (!this.options.includeTypes().isEmpty()) {
            retained.removeIf(token -> !hasType(token, this.options.includeTypes()));
        }

        if (this.options.reservedOnly()) {
            retained.removeIf(token -> !isReserved(token));
        }
        if (this.options.nonReservedOnly()) {
            retained.removeIf(this::isReserved);
        }

        if (this.options.usesAuthorUsage()) {
            final int threshold = this.options.minAuthorUsage();
            retained.removeIf(token -> this.authorUsage.authorCount(token.val()) < threshold);
        }
        return retained;
    }

    private boolean isReserved(TokenRecord token) {
        return token.val() != null && this.reservedWords.contains(token.val());
    }

    // Immutable sets reject null lookups, and an untyped token matches no type
    private static boolean hasType(TokenRecord token, Set<String> types) {
        return token.type() != null && types.contains(token.type());
    }
}
