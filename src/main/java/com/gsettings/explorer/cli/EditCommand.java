package com.gsettings.explorer.cli;

import com.gsettings.explorer.cli.exception.OptionsValidationException;
import com.gsettings.explorer.cli.model.ValidatedValueOptions;
import com.gsettings.explorer.cli.model.ValueOptions;
import com.gsettings.explorer.cli.output.ResultsPrinter;
import com.gsettings.explorer.cli.validation.ValueOptionsValidator;
import com.gsettings.explorer.exception.ValueTreeException;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.render.TreeRenderer;
import com.gsettings.explorer.store.EditResult;
import com.gsettings.explorer.store.EditSession;
import com.gsettings.explorer.store.InMemorySchemaSource;
import com.gsettings.explorer.store.InMemorySettingsStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Changes one leaf of a key's value and prints the recomposed value.
 */
@Command(
        name = "edit",
        mixinStandardHelpOptions = true,
        description = "Sets one leaf of a value, then prints the whole new value."
)
public class EditCommand implements Callable<Integer> {

    @Mixin
    private ValueOptions options;

    @Option(names = { "--path", "-p" }, required = true, description = "Leaf to change, as child names separated by '/', e.g. main/0; quote odd names: 'a/b'/0")
    private String leafPath;

    @Option(names = { "--set", "-s" }, required = true, description = "New leaf text, e.g. 42, True or plain text for strings")
    private String text;

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

        EditSession session;
        try {
            session = EditSession.open(schemas, store, key.getSchemaId(), key.getKeyName(), path);
        } catch (ValueTreeException e) {
            printer.printFailure(e.getMessage());
            return 1;
        }

        List<String> nodePath;
        try {
            nodePath = KeyTree.parsePath(leafPath);
        } catch (IllegalArgumentException e) {
            printer.printFailure(e.getMessage());
            return 1;
        }
        EditResult result = session.commit(nodePath, text);
        if (!result.isSuccess()) {
            printer.printFailure(result.getErrorMessage());
            return 1;
        }
        printer.printCommitted(session.getTree().fullPath(nodePath), result.getCommittedValue());
        printer.printTree(new TreeRenderer(validated.getConfig()).renderLines(session.getTree()));
        return 0;
    }
}
