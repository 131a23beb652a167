package com.gsettings.explorer.cli;

import com.gsettings.explorer.cli.exception.OptionsValidationException;
import com.gsettings.explorer.cli.model.ValidatedValueOptions;
import com.gsettings.explorer.cli.model.ValueOptions;
import com.gsettings.explorer.cli.output.ResultsPrinter;
import com.gsettings.explorer.cli.validation.ValueOptionsValidator;
import com.gsettings.explorer.exception.ValueTreeException;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.render.KeyDetailsRenderer;
import com.gsettings.explorer.render.TreeRenderer;
import com.gsettings.explorer.store.InMemorySchemaSource;
import com.gsettings.explorer.store.InMemorySettingsStore;
import com.gsettings.explorer.store.LoadResult;
import com.gsettings.explorer.store.SettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Decomposes a key's value and prints the tree and the details of one node.
 */
@Command(
        name = "show",
        mixinStandardHelpOptions = true,
        description = "Prints a value as a tree, followed by the details of the key or of one node."
)
public class ShowCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ShowCommand.class);

    @Mixin
    private ValueOptions options;

    @Option(names = { "--node", "-n" }, description = "Node to describe, as child names separated by '/', e.g. main/0; quote odd names: 'a/b'/0")
    private String node;

    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        ValidatedValueOptions validated;
        try {
            validated = new ValueOptionsValidator().validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        }

        KeyMetadata key = validated.getKey();
        String path = validated.getConfig().getRelocationPath();
        InMemorySchemaSource schemas = new InMemorySchemaSource().register(key);
        InMemorySettingsStore store = new InMemorySettingsStore(schemas);
        if (validated.getValue() != null) {
            store.preload(key.getSchemaId(), key.getKeyName(), path, validated.getValue());
        }

        LoadResult result = new SettingsLoader().load(schemas, store, path);
        if (result.getDiagnostics().hasFailures()) {
            printer.printLoadFailures(result.getDiagnostics());
            return 1;
        }
        Optional<KeyTree> tree = result.find(key.getSchemaId(), key.getKeyName());
        if (tree.isEmpty()) {
            printer.printNoValue(key.toString());
            return 0;
        }

        List<String> nodePath;
        try {
            nodePath = KeyTree.parsePath(node);
        } catch (IllegalArgumentException e) {
            printer.printFailure(e.getMessage());
            return 1;
        }
        if (tree.get().find(nodePath).isEmpty()) {
            printer.printFailure("No node '" + node + "' in " + key);
            return 1;
        }
        try {
            printer.printTree(new TreeRenderer(validated.getConfig()).renderLines(tree.get()));
            printer.printDetails(new KeyDetailsRenderer().render(tree.get(), nodePath));
            return 0;
        } catch (ValueTreeException e) {
            log.debug("Rendering {} failed", key, e);
            printer.printFailure(e.getMessage());
            return 1;
        }
    }
}
