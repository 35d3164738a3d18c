package org.tablegen.exception;

import java.util.Set;

public class UnknownTagGeneratorException extends TablegenException {
    private final String tagger;

    public UnknownTagGeneratorException(String tagger, Set<String> known) {
        super("Unknown tag generator '" + tagger + "', expected one of " + known);
        this.tagger = tagger;
    }

    public String getTagger() {
        return tagger;
    }
}
