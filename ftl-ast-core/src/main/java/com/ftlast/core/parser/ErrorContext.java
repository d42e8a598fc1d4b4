package com.ftlast.core.parser;

/**
 * Location of a node in its template source, for error reporting.
 *
 * @param location {@code parseName:line:column}
 * @param context truncated raw rendering of the node
 */
public record ErrorContext(String location, String context) {

    @Override
    public String toString() {
        return location + ": " + context;
    }
}
