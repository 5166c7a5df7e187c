package io.mnemo.core.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ContextDiscovery {
    private static final Logger LOG = LoggerFactory.getLogger(ContextDiscovery.class);

    private ContextDiscovery() {
    }

    public static List<SessionContext> discover(Path workspace) throws IOException {
        List<SessionContext> contexts = new ArrayList<>();
        if (!Files.isDirectory(workspace)) {
            LOG.debug("Workspace {} does not exist", workspace);
            return contexts;
        }
        SessionContext framework = SessionContext.framework();
        if (Files.isRegularFile(ContextPaths.resolve(workspace, framework).snapshot())) {
            contexts.add(framework);
        }
        try (Stream<Path> children = Files.list(workspace)) {
            children
                .filter(Files::isDirectory)
                .map(dir -> dir.getFileName().toString())
                .filter(name -> !name.startsWith("."))
                .sorted(Comparator.naturalOrder())
                .map(SessionContext::project)
                .filter(project -> Files.isRegularFile(ContextPaths.resolve(workspace, project).snapshot()))
                .forEach(contexts::add);
        }
        return contexts;
    }
}
