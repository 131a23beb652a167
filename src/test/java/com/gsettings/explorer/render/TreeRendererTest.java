package com.gsettings.explorer.render;

import com.gsettings.explorer.ExplorerConfig;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.tree.Decomposer;
import com.gsettings.explorer.value.text.ValueTextParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TreeRendererTest {

    private final Decomposer decomposer = new Decomposer();

    @Test
    void testCompoundNodesShowTheirType() {
        KeyTree tree = tree("window-sizes", "a{s(ii)}", "{'main': (800, 600)}");

        List<String> lines = new TreeRenderer().renderLines(tree);

        assertThat(lines).containsExactly(
                "window-sizes [a{s(ii)}]",
                "  main [(ii)]",
                "    0 = 800 (int32)",
                "    1 = 600 (int32)");
    }

    @Test
    void testVariantMarksAndHiddenTypes() {
        KeyTree tree = tree("k", "av", "[<1>, <<true>>]");
        ExplorerConfig config = ExplorerConfig.builder().showTypes(false).indentWidth(4).build();

        List<String> lines = new TreeRenderer(config).renderLines(tree);

        assertThat(lines).containsExactly(
                "k [av]",
                "    0 = 1 <v>",
                "    1 = True <v> <v>");
    }

    @Test
    void testLongValuesAreCut() {
        KeyTree tree = tree("k", "s", "'abcdefghijklmnop'");
        ExplorerConfig config = ExplorerConfig.builder().showTypes(false).maxValueLength(10).build();

        assertThat(new TreeRenderer(config).render(tree)).isEqualTo("k = abcdefg...");

        ExplorerConfig unlimited = ExplorerConfig.builder().showTypes(false).maxValueLength(0).build();
        assertThat(new TreeRenderer(unlimited).render(tree)).isEqualTo("k = abcdefghijklmnop");
    }

    @Test
    void testPendingEditIsShownAndMarked() {
        KeyTree tree = tree("k", "ai", "[1]");
        tree.nodeAt(List.of("0")).edit("2");

        List<String> lines = new TreeRenderer().renderLines(tree);

        assertThat(lines.get(1)).isEqualTo("  0 = 2 (int32) *");
    }

    @Test
    void testEmptyMaybeAndRootVariant() {
        assertThat(new TreeRenderer().renderLines(tree("k", "mi", "nothing"))).containsExactly("k [mi]");
        assertThat(new TreeRenderer().renderLines(tree("k", "v", "<'x'>"))).containsExactly(
                "k [v]",
                "  value = x (string) <v>");
    }

    private KeyTree tree(String keyName, String type, String text) {
        KeyMetadata key = KeyMetadata.builder().schemaId("org.example.app").keyName(keyName).type(type).build();
        return decomposer.decomposeKey(key, ValueTextParser.parse(type, text));
    }
}
