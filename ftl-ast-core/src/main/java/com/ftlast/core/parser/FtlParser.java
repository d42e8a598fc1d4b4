package com.ftlast.core.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for parsing a template source into named trees.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Map<String, Tree> trees = FtlParser.parse("page", """
 *     <#macro header><h1>${title}</h1></#macro>
 *     <#list items as item>${item.name}</#list>
 *     """);
 *
 * Tree page = trees.get("page");
 * Tree header = trees.get("header");
 * }</pre>
 */
public final class FtlParser {

    private FtlParser() {
        // Utility class - no instantiation
    }

    /**
     * Parses a source into the top-level tree and every tree it defines.
     *
     * @param name name of the top-level template
     * @param text template source
     * @return trees by name, in installation order: definitions first, then the top-level tree
     * @throws ParseException if the source cannot be parsed
     */
    public static Map<String, Tree> parse(String name, String text) throws ParseException {
        Map<String, Tree> treeSet = new LinkedHashMap<>();
        Tree.create(name).parse(text, treeSet);
        return treeSet;
    }
}
