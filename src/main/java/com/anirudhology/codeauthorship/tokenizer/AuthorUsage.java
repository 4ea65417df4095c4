package com.anirudhology.codeauthorship.tokenizer;

import com.anirudhology.codeauthorship.types.Example;
import com.anirudhology.codeauthorship.types.TokenRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup from a token value to the distinct authors who used it.
 * <p>
 * It is computed once over a full record batch, before any filtering takes
 * place, and then shared read-only by every filter working on that batch.
 */
public final class AuthorUsage {

    private final Map<String, Set<String>> authorsByToken;

    private AuthorUsage(Map<String, Set<String>> authorsByToken) {
        this.authorsByToken = authorsByToken;
    }

    /**
     * Scans every token of every example once
     *
     * @param examples record batch to scan
     * @return usage table of that batch
     */
    public static AuthorUsage compute(List<Example> examples) {
        final Map<String, Set<String>> authorsByToken = new HashMap<>();
        for (Example example : examples) {
            for (TokenRecord token : example.tokens()) {
                authorsByToken.computeIfAbsent(token.val(), k -> new HashSet<>()).add(example.username());
            }
        }
        // Freeze the sets so the table can be shared safely
        authorsByToken.replaceAll((token, authors) -> Collections.unmodifiableSet(authors));
        return new AuthorUsage(Collections.unmodifiableMap(authorsByToken));
    }

    /**
     * @param tokenValue token value to look up
     * @return number of distinct authors who used the value, 0 if it was never seen
     */
    public int authorCount(String tokenValue) {
        final Set<String> authors = this.authorsByToken.get(tokenValue);
        return authors == null ? 0 : authors.size();
    }
}
