package com.ftlast.core.template;

import com.ftlast.core.parser.FtlParser;
import com.ftlast.core.parser.ParseException;
import com.ftlast.core.parser.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of named template trees.
 *
 * <p>Sources parsed into the set contribute their top-level tree and every tree they
 * define. A tree with an empty body never replaces a template that is already
 * registered, so a placeholder declaration can come before or after the real one.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * TemplateSet set = new TemplateSet("site");
 * set.parse("layout", layoutSource);
 * set.parse("page", pageSource);
 *
 * Tree header = set.lookup("header").orElseThrow();
 * }</pre>
 *
 * <p>All methods are synchronized; a set may be filled and read from several threads.
 */
public final class TemplateSet {

    private static final Logger log = LoggerFactory.getLogger(TemplateSet.class);

    private final String name;
    private final Map<String, Tree> trees = new LinkedHashMap<>();

    public TemplateSet(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Parses a source under the name of this set.
     *
     * @param text template source
     * @return this set
     * @throws ParseException if the source cannot be parsed
     */
    public TemplateSet parse(String text) throws ParseException {
        return parse(name, text);
    }

    /**
     * Parses a source as the template {@code templateName} and registers every tree it yields.
     *
     * @param templateName name of the top-level template of the source
     * @param text template source
     * @return this set
     * @throws ParseException if the source cannot be parsed; the set is left unchanged
     */
    public synchronized TemplateSet parse(String templateName, String text) throws ParseException {
        Map<String, Tree> parsed = FtlParser.parse(templateName, text);
        parsed.forEach(this::addParseTree);
        log.debug("Added {} trees from {} to template set {}", parsed.size(), templateName, name);
        return this;
    }

    /**
     * Registers a tree under a name.
     *
     * @param templateName name to register under
     * @param tree parsed tree
     * @return true if the tree was registered, false if it was empty and a template
     *         of that name already exists
     */
    public synchronized boolean addParseTree(String templateName, Tree tree) {
        if (trees.containsKey(templateName) && Tree.isEmptyTree(tree.root())) {
            log.debug("Keeping existing template {}; new body is empty", templateName);
            return false;
        }
        trees.put(templateName, tree);
        return true;
    }

    public synchronized Optional<Tree> lookup(String templateName) {
        return Optional.ofNullable(trees.get(templateName));
    }

    /**
     * Returns all registered trees in registration order.
     *
     * @return snapshot of the registered trees
     */
    public synchronized List<Tree> templates() {
        return List.copyOf(trees.values());
    }

    public synchronized int size() {
        return trees.size();
    }
}
