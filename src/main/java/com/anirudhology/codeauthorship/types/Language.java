package com.anirudhology.codeauthorship.types;

/**
 * Closed set of languages a dataset can be built for. The declaration
 * order is also the order in which per-language inputs are processed.
 */
public enum Language {

    PYTHON("python"),
    C("c"),
    CPP("cpp");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    /**
     * @return short tag used in logs and distribution reports
     */
    public String tag() {
        return this.tag;
    }

    public static Language fromTag(String tag) {
        for (Language language : values()) {
            if (language.tag.equalsIgnoreCase(tag)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown language tag: '" + tag + "'");
    }

    @Override
    public String toString() {
        return this.tag;
    }
}
