package com.gsettings.explorer.render;

import com.gsettings.explorer.ExplorerConfig;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.model.ValueNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a value tree as indented text, one node per line.
 *
 * <pre>
 * window-sizes [a{s(ii)}]
 *   main [(ii)]
 *     0 = 800
 *     1 = 600
 * </pre>
 */
public class TreeRenderer {
    private static final String ELLIPSIS = "...";
    private static final String VARIANT_MARK = " <v>";

    private final ExplorerConfig config;

    public TreeRenderer(ExplorerConfig config) {
        this.config = config;
    }

    public TreeRenderer() {
        this(ExplorerConfig.defaults());
    }

    public List<String> renderLines(KeyTree tree) {
        return renderLines(tree.getRoot());
    }

    public List<String> renderLines(ValueNode root) {
        List<String> lines = new ArrayList<>();
        appendNode(root, 0, lines);
        return lines;
    }

    public String render(KeyTree tree) {
        return String.join(System.lineSeparator(), renderLines(tree));
    }

    private void appendNode(ValueNode node, int depth, List<String> lines) {
        StringBuilder line = new StringBuilder(" ".repeat(depth * config.getIndentWidth()));
        line.append(node.getName());
        if (node.isLeaf()) {
            line.append(" = ").append(truncate(node.getDisplayValue()));
            if (config.isShowTypes()) {
                line.append(" (").append(node.getKind().getDisplayName()).append(')');
            }
        } else {
            line.append(" [").append(node.getSignature()).append(']');
        }
        if (node.isVariantWrapped()) {
            line.append(VARIANT_MARK.repeat(node.getVariantDepth()));
        }
        if (node.isEdited()) {
            line.append(" *");
        }
        lines.add(line.toString());
        for (ValueNode child : node.getChildren()) {
            appendNode(child, depth + 1, lines);
        }
    }

    private String truncate(String text) {
        int max = config.getMaxValueLength();
        if (max <= 0 || text.length() <= max) {
            return text;
        }
        return text.substring(0, Math.max(0, max - ELLIPSIS.length())) + ELLIPSIS;
    }
}
