package com.ftlast.core.ast;

import com.ftlast.core.util.Quoting;

import java.util.Objects;

/**
 * {@code <#include "name">}: inclusion of another named template.
 */
public final class IncludeNode extends AbstractNode {

    private final String templateName;

    public IncludeNode(int position, TemplateSource source, String templateName) {
        super(NodeType.INCLUDE, position, source);
        this.templateName = Objects.requireNonNull(templateName, "templateName must not be null");
    }

    public String templateName() {
        return templateName;
    }

    @Override
    public String render(TextFormat format) {
        return "<#include " + Quoting.quote(templateName) + ">";
    }

    @Override
    public IncludeNode copy() {
        return new IncludeNode(position(), source(), templateName);
    }
}
