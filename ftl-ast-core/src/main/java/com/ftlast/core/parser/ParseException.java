package com.ftlast.core.parser;

/**
 * Failure to scan or parse a template.
 *
 * <p>Carries the location of the failure and a short snippet of the offending
 * input. The message has the form {@code template: NAME:LINE:COLUMN: DETAIL}.
 */
public class ParseException extends Exception {

    private final String templateName;
    private final int line;
    private final int column;
    private final String detail;
    private final String context;

    /**
     * Creates a parse exception.
     *
     * @param templateName name of the top-level template being parsed
     * @param line 1-based line of the failure
     * @param column 0-based column of the failure
     * @param detail description of what went wrong
     * @param context short rendering of the offending token or node
     */
    public ParseException(String templateName, int line, int column, String detail, String context) {
        super(String.format("template: %s:%d:%d: %s", templateName, line, column, detail));
        this.templateName = templateName;
        this.line = line;
        this.column = column;
        this.detail = detail;
        this.context = context;
    }

    public String getTemplateName() {
        return templateName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Returns the message without the location prefix.
     *
     * @return failure description
     */
    public String getDetail() {
        return detail;
    }

    public String getContext() {
        return context;
    }
}
