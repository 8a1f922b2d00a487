package com.survivaladvisor.common.exception;

import java.util.Collection;

/**
 * Raised when a caller passes a slot, category, mode or handler name that is not part of
 * the fixed game vocabulary. This is a caller bug, never a data-quality issue, so it is
 * never defaulted away.
 */
public class UnknownVocabularyException extends AdvisorException {

    private final String vocabulary;
    private final String value;

    public UnknownVocabularyException(String vocabulary, String value, Collection<String> allowed) {
        super(vocabulary, "Unknown " + vocabulary + " '" + value + "'. Allowed: " + allowed);
        this.vocabulary = vocabulary;
        this.value = value;
    }

    public String getVocabulary() {
        return vocabulary;
    }

    public String getValue() {
        return value;
    }
}
