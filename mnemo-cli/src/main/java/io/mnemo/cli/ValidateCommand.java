package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.ContextPaths;
import io.mnemo.core.session.SessionContext;
import io.mnemo.core.validation.ValidationError;
import io.mnemo.core.validation.ValidationReport;
import io.mnemo.core.validation.ValidationWarning;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "validate", description = "Check a store file line by line")
public final class ValidateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Store file; defaults to the --context snapshot")
    Path file;

    @Mixin
    NamingOptions naming;

    public ValidateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            Path target = file;
            if (target == null) {
                SessionContext sessionContext = naming.sessionContext();
                if (sessionContext == null) {
                    throw new IllegalArgumentException("Give a store file or --context");
                }
                target = ContextPaths.resolve(runtime.workspace(), sessionContext).snapshot();
            }

            ValidationReport report = runtime.validator().validate(target, naming.policy(runtime));
            for (ValidationWarning warning : report.warnings()) {
                System.out.println("warning: " + warning.message());
            }
            for (ValidationError error : report.errors()) {
                System.out.println(error);
            }
            if (report.isValid()) {
                System.out.println(target + " " + report.summary());
                return 0;
            }
            System.out.println(target + " invalid: " + report.errors().size() + " error(s) in " + report.linesScanned() + " lines scanned");
            return 1;
        } catch (Exception e) {
            System.err.println("Validate failed: " + e.getMessage());
            return 1;
        }
    }
}
