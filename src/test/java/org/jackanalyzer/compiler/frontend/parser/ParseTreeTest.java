package org.jackanalyzer.compiler.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ParseTreeTest {

    @Test
    void markupEscapesLeafText() {
        ParseTree tree = new ParseTree();
        tree.open("term");
        tree.leaf("stringConstant", "a < b & \"c\" > d");
        tree.close("term");

        assertThat(tree.toMarkup())
                .isEqualTo("<term><stringConstant>a &lt; b &amp; &quot;c&quot; &gt; d</stringConstant></term>");
        assertThat(tree.leafTexts()).containsExactly("a < b & \"c\" > d");
    }

    @Test
    void truncateDropsLaterEvents() {
        ParseTree tree = new ParseTree();
        tree.open("statements");
        int size = tree.size();
        tree.open("letStatement");
        tree.leaf("keyword", "let");

        tree.truncate(size);
        tree.close("statements");

        assertThat(tree.toMarkup()).isEqualTo("<statements></statements>");
    }

    @Test
    void eventsAreReadOnly() {
        ParseTree tree = new ParseTree();
        tree.leaf("symbol", ";");

        assertThatThrownBy(() -> tree.events().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
