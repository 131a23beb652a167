package com.gsettings.explorer.model;

import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.tree.DefaultResolver;
import com.gsettings.explorer.value.GValue;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The decomposed value of one settings key together with the key's metadata.
 *
 * Nodes are addressed by path: the list of child names from the root down.
 */
@Getter
@RequiredArgsConstructor
public class KeyTree {
    @NonNull
    private final KeyMetadata metadata;
    @NonNull
    private final ValueNode root;

    public TypeSignature getSignature() {
        return metadata.getSignature();
    }

    public Optional<ValueNode> find(List<String> path) {
        ValueNode current = root;
        for (String name : path) {
            Optional<ValueNode> next = current.findChild(name);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    public ValueNode nodeAt(List<String> path) {
        return find(path).orElseThrow(() -> new IllegalArgumentException(
                "No node at path '" + String.join("/", path) + "' in " + metadata));
    }

    /**
     * Dotted display path, e.g. {@code org.gnome.desktop.interface.font-name} or
     * {@code org.example.app.window-sizes.1}.
     */
    public String fullPath(List<String> path) {
        List<String> parts = new ArrayList<>();
        parts.add(metadata.getSchemaId());
        parts.add(metadata.getKeyName());
        parts.addAll(path);
        return String.join(".", parts);
    }

    /**
     * Default applicable to the node at {@code path}, resolved level by level by sibling position.
     */
    public Optional<GValue> defaultFor(List<String> path) {
        if (!metadata.hasDefault()) {
            return Optional.empty();
        }
        GValue current = metadata.getDefaultValue();
        ValueNode node = root;
        for (String name : path) {
            int index = node.indexOf(name);
            if (index < 0) {
                throw new IllegalArgumentException("No child '" + name + "' under '" + node.getName() + "'");
            }
            ValueNode child = node.getChildren().get(index);
            if (node.isVariantWrapper()) {
                current = DefaultResolver.unwrapVariants(current);
            } else {
                current = DefaultResolver.resolveDefault(current, false, index);
                if (child.isVariantWrapped()) {
                    current = DefaultResolver.unwrapVariants(current);
                }
            }
            node = child;
        }
        return Optional.of(current);
    }

    /**
     * Split a path such as {@code main/0} into child names.
     *
     * Empty unquoted segments are skipped. A segment in single quotes is taken literally, so
     * {@code 'a/b'/0} and {@code ''/0} reach dictionary keys containing '/' or empty keys.
     * Inside quotes a backslash escapes the next character.
     *
     * @throws IllegalArgumentException on an unterminated quote or text after a closing quote
     */
    public static List<String> parsePath(String path) {
        if (path == null || path.isBlank()) {
            return List.of();
        }
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int pos = 0;
        while (pos < path.length()) {
            char c = path.charAt(pos);
            if (c == '/') {
                if (quoted || current.length() > 0) {
                    segments.add(current.toString());
                }
                current.setLength(0);
                quoted = false;
                pos++;
            } else if (c == '\'' && current.length() == 0 && !quoted) {
                pos = readQuoted(path, pos + 1, current);
                quoted = true;
                if (pos < path.length() && path.charAt(pos) != '/') {
                    throw new IllegalArgumentException("Expected '/' after quoted name at offset " + pos + " in '" + path + "'");
                }
            } else {
                current.append(c);
                pos++;
            }
        }
        if (quoted || current.length() > 0) {
            segments.add(current.toString());
        }
        return segments;
    }

    private static int readQuoted(String path, int pos, StringBuilder out) {
        while (pos < path.length()) {
            char c = path.charAt(pos);
            if (c == '\\' && pos + 1 < path.length()) {
                out.append(path.charAt(pos + 1));
                pos += 2;
            } else if (c == '\'') {
                return pos + 1;
            } else {
                out.append(c);
                pos++;
            }
        }
        throw new IllegalArgumentException("Unterminated quote in path '" + path + "'");
    }
}
