package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.SessionContext;
import io.mnemo.core.validation.NamingPolicy;
import picocli.CommandLine.Option;

public final class NamingOptions {

    @Option(names = {"-c", "--context"}, description = "Context whose naming rules apply: framework or project:<name>")
    String context;

    @Option(names = "--prefix", description = "Required entity name prefix; overrides --context")
    String prefix;

    @Option(names = "--strict-duplicates", description = "Report repeated entity names as errors")
    Boolean strictDuplicates;

    SessionContext sessionContext() {
        return context == null ? null : SessionContext.parse(context);
    }

    NamingPolicy policy(MnemoRuntime runtime) {
        NamingPolicy policy;
        if (prefix != null) {
            policy = new NamingPolicy(
                prefix,
                runtime.config().validation().caseInsensitivePrefix(),
                runtime.config().validation().strictDuplicates()
            );
        } else if (context != null) {
            policy = runtime.policies().forContext(sessionContext());
        } else {
            policy = NamingPolicy.structural().withStrictDuplicates(runtime.config().validation().strictDuplicates());
        }
        return strictDuplicates == null ? policy : policy.withStrictDuplicates(strictDuplicates);
    }
}
