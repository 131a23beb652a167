package com.gsettings.explorer.cli.output;

import com.gsettings.explorer.cli.exception.OptionsValidationException;
import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.store.LoadDiagnostics;
import com.gsettings.explorer.value.GValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Responsible only for printing CLI output.
 * No validation, no execution.
 */
public class ResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResultsPrinter.class);

    public void printSignature(TypeSignature signature) {
        printSignature(signature, "", 0);
    }

    private void printSignature(TypeSignature signature, String role, int depth) {
        log.info("{}{}{} : {}", "  ".repeat(depth), role, signature, signature.getKind().getDisplayName());
        List<TypeSignature> children = signature.getChildren();
        for (int i = 0; i < children.size(); i++) {
            printSignature(children.get(i), childRole(signature, i), depth + 1);
        }
    }

    private static String childRole(TypeSignature parent, int index) {
        return switch (parent.getKind()) {
            case ARRAY -> "element ";
            case MAYBE -> "inner ";
            case DICT_ENTRY_ARRAY -> index == 0 ? "key " : "value ";
            case TUPLE -> "#" + index + " ";
            default -> "";
        };
    }

    public void printTree(List<String> lines) {
        lines.forEach(log::info);
    }

    public void printDetails(String details) {
        log.info("-------------------------------------------------");
        details.lines().forEach(log::info);
    }

    public void printNoValue(String key) {
        log.info("{} has no value and no default", key);
    }

    public void printCommitted(String fullPath, GValue value) {
        log.info("Set {}", fullPath);
        log.info("New value: {}", value);
        log.info("-------------------------------------------------");
    }

    public void printLoadFailures(LoadDiagnostics diagnostics) {
        for (Map.Entry<String, String> failed : diagnostics.getFailedKeys().entrySet()) {
            log.error("Cannot display key {}: {}", failed.getKey(), failed.getValue());
        }
        diagnostics.getWarnings().forEach(log::warn);
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        e.getErrors().forEach(error -> log.error("  - {}", error));
    }

    public void printFailure(String message) {
        log.error("Failed: {}", message);
    }
}
