package com.gsettings.explorer.render;

import com.gsettings.explorer.exception.IndexOutOfRangeException;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.model.ValueNode;
import com.gsettings.explorer.tree.Recomposer;
import com.gsettings.explorer.value.GValue;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the details pane for one node of a key's value tree: where it lives, what the schema
 * says about the key, its current value and the default that applies to it.
 */
public class KeyDetailsRenderer {
    private static final Logger log = LoggerFactory.getLogger(KeyDetailsRenderer.class);

    static final String TEMPLATE_NAME = "key-details.ftl";

    private final Configuration freemarkerConfig;
    private final Recomposer recomposer = new Recomposer();

    public KeyDetailsRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @param path child names from the root to the node to describe; empty for the key itself
     */
    public String render(KeyTree tree, List<String> path) {
        Map<String, Object> model = buildModel(tree, path);
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load template " + TEMPLATE_NAME, e);
        } catch (TemplateException e) {
            throw new IllegalStateException("Cannot render details of " + tree.fullPath(path), e);
        }
    }

    Map<String, Object> buildModel(KeyTree tree, List<String> path) {
        KeyMetadata key = tree.getMetadata();
        ValueNode node = tree.nodeAt(path);

        // FreeMarker treats missing keys as null, so absent entries are simply left out
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("fullPath", tree.fullPath(path));
        model.put("schemaId", key.getSchemaId());
        model.put("keyName", key.getKeyName());
        putIfPresent(model, "summary", key.getSummary());
        putIfPresent(model, "description", key.getDescription());
        if (!path.isEmpty()) {
            model.put("elementName", node.getName());
        }
        model.put("type", node.getSignature().toString());
        model.put("value", valueText(node));
        putIfPresent(model, "defaultValue", defaultText(tree, path));
        if (key.getRange().isRestricted()) {
            model.put("range", key.getRange().describe());
        }
        model.put("writable", key.isWritable());
        return model;
    }

    private String valueText(ValueNode node) {
        if (node.isLeaf()) {
            return node.getDisplayValue();
        }
        return recomposer.recomposeNode(node).toString();
    }

    private String defaultText(KeyTree tree, List<String> path) {
        try {
            return tree.defaultFor(path).map(GValue::toString).orElse(null);
        } catch (IndexOutOfRangeException e) {
            log.debug("No default for {}: {}", tree.fullPath(path), e.getMessage());
            return "(none: " + e.getMessage() + ")";
        }
    }

    private static void putIfPresent(Map<String, Object> model, String name, String value) {
        if (value != null && !value.isBlank()) {
            model.put(name, value);
        }
    }
}
