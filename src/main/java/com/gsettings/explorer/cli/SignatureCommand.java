package com.gsettings.explorer.cli;

import com.gsettings.explorer.cli.output.ResultsPrinter;
import com.gsettings.explorer.exception.MalformedSignatureException;
import com.gsettings.explorer.signature.TypeSignature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * Parses a type signature and prints its structure.
 */
@Command(
        name = "signature",
        mixinStandardHelpOptions = true,
        description = "Parses a type signature and prints the kind of each part."
)
public class SignatureCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "SIGNATURE", description = "Type signature, e.g. a{sv}")
    private String signature;

    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            printer.printSignature(TypeSignature.parse(signature));
            return 0;
        } catch (MalformedSignatureException e) {
            printer.printFailure(e.getMessage());
            return 1;
        }
    }
}
