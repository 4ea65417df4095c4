package com.anirudhology.codeauthorship.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Represents a single lexical token produced by a language front-end
 *
 * @param val  textual value of the token
 * @param type syntactic category of the token, may be null when the front-end does not emit it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenRecord(String val, String type) {
}
