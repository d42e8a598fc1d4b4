package com.ftlast.core.template;

import com.ftlast.core.ast.TextFormat;
import com.ftlast.core.parser.ParseException;
import com.ftlast.core.parser.Tree;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TemplateSet}.
 */
class TemplateSetTest {

    private static String body(TemplateSet set, String name) {
        return set.lookup(name).orElseThrow().root().render(TextFormat.RAW);
    }

    @Test
    void parse_withoutName_usesSetName() throws ParseException {
        TemplateSet set = new TemplateSet("site").parse("Hello");

        assertThat(set.name()).isEqualTo("site");
        assertThat(set.lookup("site")).isPresent();
        assertThat(set.size()).isEqualTo(1);
    }

    @Test
    void parse_sourceWithDefinitions_registersAllTrees() throws ParseException {
        TemplateSet set = new TemplateSet("site")
            .parse("layout", "<#macro header>H</#macro><#macro footer>F</#macro>${body}");

        assertThat(set.templates()).extracting(Tree::name).containsExactly("header", "footer", "layout");
        assertThat(body(set, "footer")).isEqualTo("F");
    }

    @Test
    void parse_laterNonEmptyDefinition_replacesEarlierOne() throws ParseException {
        TemplateSet set = new TemplateSet("site")
            .parse("a", "<#macro header>old</#macro>")
            .parse("b", "<#macro header>new</#macro>");

        assertThat(body(set, "header")).isEqualTo("new");
    }

    @Test
    void parse_laterEmptyDefinition_keepsEarlierOne() throws ParseException {
        TemplateSet set = new TemplateSet("site")
            .parse("a", "<#macro header>kept</#macro>")
            .parse("b", "<#macro header>  </#macro>");

        assertThat(body(set, "header")).isEqualTo("kept");
    }

    @Test
    void parse_failure_leavesSetUnchanged() throws ParseException {
        TemplateSet set = new TemplateSet("site").parse("a", "A");

        assertThatThrownBy(() -> set.parse("b", "<#macro x>x</#macro>${"))
            .isInstanceOf(ParseException.class);
        assertThat(set.size()).isEqualTo(1);
        assertThat(set.lookup("x")).isEmpty();
    }

    @Test
    void addParseTree_emptyTreeForNewName_isRegistered() throws ParseException {
        TemplateSet set = new TemplateSet("site");
        Tree empty = Tree.create("blank").parse(" ", new HashMap<>());

        assertThat(set.addParseTree("blank", empty)).isTrue();
        assertThat(set.addParseTree("blank", empty.copy())).isFalse();
        assertThat(set.lookup("blank")).containsSame(empty);
    }

    @Test
    void lookup_unknownName_isEmpty() {
        assertThat(new TemplateSet("site").lookup("missing")).isEmpty();
    }

    @Test
    void templates_isSnapshot() throws ParseException {
        TemplateSet set = new TemplateSet("site").parse("a", "A");

        List<Tree> snapshot = set.templates();
        set.parse("b", "B");

        assertThat(snapshot).hasSize(1);
        assertThat(set.templates()).hasSize(2);
    }
}
