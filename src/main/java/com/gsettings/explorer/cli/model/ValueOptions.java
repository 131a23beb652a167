package com.gsettings.explorer.cli.model;

import com.gsettings.explorer.ExplorerConfig;
import lombok.Getter;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * Options describing one key and its value, shared by the commands that load a key.
 * No validation, no execution logic, no printing.
 */
@Getter
public class ValueOptions {

    @Option(names = { "--type", "-t" }, description = "Type signature of the key, e.g. a{sv}")
    private String type;

    @Option(names = { "--value", "-v" }, description = "Current value in text notation; the key has no value when omitted")
    private String value;

    @Option(names = { "--default", "-d" }, description = "Schema default in text notation")
    private String defaultValue;

    @Option(names = { "--range-min" }, description = "Smallest permitted value of a numeric key")
    private String rangeMin;

    @Option(names = { "--range-max" }, description = "Largest permitted value of a numeric key")
    private String rangeMax;

    @Option(names = { "--choice" }, split = ",", description = "Permitted values of a string key (comma-separated)")
    private List<String> choices = new ArrayList<>();

    @Option(names = { "--schema" }, defaultValue = "org.example.local", description = "Schema id (default: ${DEFAULT-VALUE})")
    private String schemaId;

    @Option(names = { "--key", "-k" }, defaultValue = "value", description = "Key name (default: ${DEFAULT-VALUE})")
    private String keyName;

    @Option(names = { "--summary" }, description = "One-line summary of the key")
    private String summary;

    @Option(names = { "--description" }, description = "Longer description of the key")
    private String description;

    @Option(names = { "--read-only" }, description = "Treat the key as not writable")
    private boolean readOnly;

    @Option(names = { "--relocation-path" }, description = "Path of a relocatable schema instance, e.g. /org/example/profiles/a/")
    private String relocationPath;

    @Option(names = { "--indent" }, defaultValue = "" + ExplorerConfig.DEFAULT_INDENT_WIDTH, description = "Indent width of the tree (default: ${DEFAULT-VALUE})")
    private int indentWidth;

    @Option(names = { "--no-types" }, description = "Do not print the type of each leaf")
    private boolean noTypes;

    @Option(names = { "--max-length" }, defaultValue = "" + ExplorerConfig.DEFAULT_MAX_VALUE_LENGTH, description = "Longest leaf text printed before it is cut; 0 for no limit (default: ${DEFAULT-VALUE})")
    private int maxValueLength;
}
