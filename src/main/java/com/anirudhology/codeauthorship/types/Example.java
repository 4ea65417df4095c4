package com.anirudhology.codeauthorship.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One source file's worth of tokens together with the identity of its author.
 *
 * @param username  author identity, the classification target
 * @param exampleId identifier of the file, unique within its input file
 * @param tokens    ordered token sequence of the file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Example(String username, String exampleId, List<TokenRecord> tokens) {

    @JsonCreator
    public Example(@JsonProperty("username") String username,
                   @JsonProperty("example_id") String exampleId,
                   @JsonProperty("tokens") List<TokenRecord> tokens) {
        this.username = username;
        this.exampleId = exampleId;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public boolean hasTokens() {
        return !this.tokens.isEmpty();
    }
}
