package com.tempeh.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tempeh.config.TempehConfig;
import com.tempeh.internal.plugins.InternalPlugins;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.PluginNotFoundException;
import com.tempeh.plugin.PluginSecurityException;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.PluginValidationException;
import com.tempeh.plugin.audit.AuditResult;
import com.tempeh.plugin.loader.LoadedPlugin;
import com.tempeh.plugin.loader.PluginLoader;
import com.tempeh.plugin.manager.BatchReport;
import com.tempeh.plugin.manager.LifecycleState;
import com.tempeh.plugin.manager.LoadReport;
import com.tempeh.plugin.manager.ManagedPlugin;
import com.tempeh.plugin.manager.PluginManager;
import com.tempeh.plugin.registry.PluginRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * {@code tempeh plugin} command group. Every subcommand except {@code validate} opens a {@link PluginSession},
 * runs against its manager and closes it. Single-target commands exit with 1 when the plugin is not found or
 * ends up failed.
 */
@Command(
        name = "plugin",
        mixinStandardHelpOptions = true,
        description = "Manage Tempeh plugins",
        subcommands = {
            PluginCommand.ListCommand.class,
            PluginCommand.InstallCommand.class,
            PluginCommand.EnableCommand.class,
            PluginCommand.DisableCommand.class,
            PluginCommand.RemoveCommand.class,
            PluginCommand.ValidateCommand.class,
            PluginCommand.InfoCommand.class
        })
public final class PluginCommand implements Runnable {

    private final TempehConfig config;

    @Spec
    CommandSpec spec;

    public PluginCommand(TempehConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    TempehConfig getConfig() {
        return config;
    }

    PluginSession openSession() {
        return PluginSession.open(config);
    }

    /** Shared plumbing of the subcommands. */
    abstract static class PluginSubcommand implements Callable<Integer> {

        private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        @ParentCommand
        PluginCommand parent;

        @Spec
        CommandSpec spec;

        PrintWriter out() {
            return spec.commandLine().getOut();
        }

        PrintWriter err() {
            return spec.commandLine().getErr();
        }

        void printJson(Object value) throws JsonProcessingException {
            out().println(JSON.writeValueAsString(value));
        }

        int notFound(String id) {
            err().println("Plugin not found: " + id);
            return 1;
        }

        void printFailure(PluginException e) {
            err().println("Error: " + e.getMessage());
            if (e instanceof PluginValidationException) {
                for (String error : ((PluginValidationException) e).getValidationResult().getErrors()) {
                    err().println("  error: " + error);
                }
            } else if (e instanceof PluginSecurityException) {
                AuditResult audit = ((PluginSecurityException) e).getAuditResult();
                if (audit != null) {
                    for (String finding : PluginViews.findings(audit.getFindings())) {
                        err().println("  finding: " + finding);
                    }
                }
            }
        }

        /** 1 when the plugin ended up FAILED, else 0. */
        static int exitCode(PluginManager manager, String id) {
            return manager.getState(id) == LifecycleState.FAILED ? 1 : 0;
        }
    }

    @Command(name = "list", description = "List plugins and their state")
    static final class ListCommand extends PluginSubcommand {

        @Option(names = "--enabled", description = "Only enabled plugins")
        boolean enabledOnly;

        @Option(names = "--disabled", description = "Only registered plugins that are not enabled")
        boolean disabledOnly;

        @Option(names = "--capability", paramLabel = "TYPE:NAME", description = "Only plugins providing this capability")
        String capability;

        @Option(names = "--keyword", description = "Only plugins with this keyword")
        String keyword;

        @Option(names = "--author", description = "Only plugins by this author")
        String author;

        @Option(names = "--json", description = "Print JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            if (enabledOnly && disabledOnly) {
                throw new ParameterException(spec.commandLine(), "--enabled and --disabled are mutually exclusive");
            }
            try (PluginSession session = parent.openSession()) {
                PluginManager manager = session.getManager();
                Set<String> matching = registryMatches(manager.getRegistry());
                List<ManagedPlugin> rows = new ArrayList<>();
                for (ManagedPlugin record : manager.getPlugins()) {
                    LifecycleState state = record.getState();
                    if (state == LifecycleState.UNLOADED
                            || (enabledOnly && state != LifecycleState.ENABLED)
                            || (disabledOnly && state != LifecycleState.REGISTERED && state != LifecycleState.DISABLED)
                            || (matching != null && !matching.contains(record.getId()))) {
                        continue;
                    }
                    rows.add(record);
                }
                rows.sort(Comparator.comparing(ManagedPlugin::getId));
                if (json) {
                    List<Map<String, Object>> views = new ArrayList<>();
                    rows.forEach(r -> views.add(PluginViews.summary(r)));
                    printJson(views);
                } else if (rows.isEmpty()) {
                    out().println("No plugins found");
                } else {
                    rows.forEach(r -> out().println(PluginViews.row(r)));
                }
                return 0;
            }
        }

        /** Ids matching every given registry filter; null when no filter was given. */
        private Set<String> registryMatches(PluginRegistry registry) {
            Set<String> ids = null;
            if (capability != null) {
                ids = retain(ids, registry.findByCapability(capability));
            }
            if (keyword != null) {
                ids = retain(ids, registry.findByKeyword(keyword));
            }
            if (author != null) {
                ids = retain(ids, registry.findByAuthor(author));
            }
            return ids;
        }

        private static Set<String> retain(Set<String> ids, List<PluginDescriptor> found) {
            Set<String> foundIds = new HashSet<>();
            found.forEach(d -> foundIds.add(d.getId()));
            if (ids == null) {
                return foundIds;
            }
            ids.retainAll(foundIds);
            return ids;
        }
    }

    @Command(name = "install", description = "Install a plugin from a directory or a classpath manifest")
    static final class InstallCommand extends PluginSubcommand {

        @Parameters(arity = "0..1", paramLabel = "PATH", description = "Plugin directory holding plugin.json")
        Path path;

        @Option(names = "--classpath", paramLabel = "NAME", description = "Classpath plugin name")
        String classpathName;

        @Option(names = "--no-enable", description = "Register without enabling")
        boolean noEnable;

        @Override
        public Integer call() {
            if ((path == null) == (classpathName == null)) {
                throw new ParameterException(spec.commandLine(), "Specify either a plugin directory or --classpath NAME");
            }
            PluginSource source;
            try {
                source = path != null ? PluginSource.directory(path) : PluginSource.classpath(classpathName);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage());
            }
            try (PluginSession session = parent.openSession()) {
                PluginManager manager = session.getManager();
                ManagedPlugin existing = liveRecordFor(manager, source);
                if (existing != null) {
                    return reinstall(session, existing);
                }
                LoadReport report = manager.loadAll(List.of(source));
                PluginException loadFailure = report.getFailures().get(source);
                if (loadFailure != null) {
                    printFailure(loadFailure);
                    return 1;
                }
                LoadedPlugin loaded = report.getLoaded().get(0);
                String id = loaded.getId();
                if (noEnable) {
                    manager.register(id);
                } else {
                    BatchReport batch = manager.enableAll(report);
                    PluginException failure = batch.getFailures().get(id);
                    if (failure != null) {
                        printFailure(failure);
                        return 1;
                    }
                }
                session.persist();
                for (String warning : loaded.getWarnings()) {
                    out().println("  warning: " + warning);
                }
                out().println("Installed " + loaded.getDescriptor() + (noEnable ? " (not enabled)" : ""));
                return 0;
            }
        }

        private int reinstall(PluginSession session, ManagedPlugin existing) {
            if (!noEnable && existing.getState() != LifecycleState.ENABLED) {
                try {
                    session.getManager().enable(existing.getId());
                } catch (PluginException e) {
                    printFailure(e);
                    return 1;
                }
            }
            session.persist();
            out().println("Plugin " + existing.getId() + " is already installed from " + existing.getSource());
            return 0;
        }

        private static ManagedPlugin liveRecordFor(PluginManager manager, PluginSource source) {
            for (ManagedPlugin record : manager.getPlugins()) {
                if (source.equals(record.getSource()) && !record.getState().isTerminal()) {
                    return record;
                }
            }
            return null;
        }
    }

    @Command(name = "enable", description = "Enable an installed plugin")
    static final class EnableCommand extends PluginSubcommand {

        @Parameters(paramLabel = "ID")
        String id;

        @Override
        public Integer call() {
            try (PluginSession session = parent.openSession()) {
                try {
                    session.getManager().enable(id);
                } catch (PluginNotFoundException e) {
                    return notFound(id);
                } catch (PluginException e) {
                    printFailure(e);
                    return 1;
                }
                session.persist();
                out().println("Enabled " + id);
                return 0;
            }
        }
    }

    @Command(name = "disable", description = "Disable an enabled plugin")
    static final class DisableCommand extends PluginSubcommand {

        @Parameters(paramLabel = "ID")
        String id;

        @Option(names = "--force", description = "Also disable enabled plugins that depend on it")
        boolean force;

        @Override
        public Integer call() {
            try (PluginSession session = parent.openSession()) {
                PluginManager manager = session.getManager();
                try {
                    manager.disable(id, force);
                } catch (PluginNotFoundException e) {
                    return notFound(id);
                } catch (PluginException e) {
                    printFailure(e);
                    return 1;
                }
                session.persist();
                out().println("Disabled " + id);
                return exitCode(manager, id);
            }
        }
    }

    @Command(name = "remove", description = "Disable, unregister and forget a plugin")
    static final class RemoveCommand extends PluginSubcommand {

        @Parameters(paramLabel = "ID")
        String id;

        @Option(names = "--force", description = "Also disable enabled plugins that depend on it")
        boolean force;

        @Override
        public Integer call() {
            try (PluginSession session = parent.openSession()) {
                PluginManager manager = session.getManager();
                ManagedPlugin record = manager.getPlugin(id);
                boolean builtIn = record != null && record.getSource() != null && !record.getSource().isDirectory()
                        && InternalPlugins.BUILT_IN_PLUGINS.contains(record.getSource().getLocation());
                try {
                    manager.remove(id, force);
                } catch (PluginNotFoundException e) {
                    return notFound(id);
                } catch (PluginException e) {
                    printFailure(e);
                    return 1;
                }
                session.persist();
                out().println("Removed " + id + (builtIn ? " (built-in plugins are loaded again on the next run)" : ""));
                return 0;
            }
        }
    }

    @Command(name = "validate", description = "Validate and audit a plugin directory without installing it")
    static final class ValidateCommand extends PluginSubcommand {

        @Parameters(paramLabel = "PATH", description = "Plugin directory holding plugin.json")
        Path path;

        @Option(names = "--json", description = "Print JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            PluginSource source = PluginSource.directory(path);
            TempehConfig config = parent.getConfig();
            PluginLoader loader = new PluginLoader(InternalPlugins.createCatalog(), InternalPlugins.createAuditService(config));
            String id = null;
            boolean valid = false;
            List<String> errors = List.of();
            List<String> warnings = List.of();
            List<String> findings = List.of();
            try {
                LoadedPlugin loaded = loader.load(source);
                id = loaded.getId();
                warnings = loaded.getWarnings();
                AuditResult audit = loaded.getAuditResult();
                findings = audit != null ? PluginViews.findings(audit.getFindings()) : List.of();
                valid = true;
                loader.unload(loaded);
            } catch (PluginValidationException e) {
                id = e.getPluginId();
                errors = e.getValidationResult().getErrors();
                warnings = e.getValidationResult().getWarnings();
            } catch (PluginSecurityException e) {
                id = e.getPluginId();
                errors = List.of(e.getMessage());
                findings = e.getAuditResult() != null ? PluginViews.findings(e.getAuditResult().getFindings()) : List.of();
            } catch (PluginException e) {
                id = e.getPluginId();
                errors = List.of(e.getMessage());
            }

            if (json) {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("source", source.toString());
                view.put("id", id);
                view.put("valid", valid);
                view.put("errors", errors);
                view.put("warnings", warnings);
                view.put("findings", findings);
                printJson(view);
            } else {
                PrintWriter out = out();
                out.println(valid ? "Plugin " + id + " is valid" : "Plugin validation failed: " + source);
                errors.forEach(e -> out.println("  error: " + e));
                warnings.forEach(w -> out.println("  warning: " + w));
                findings.forEach(f -> out.println("  finding: " + f));
            }
            return valid ? 0 : 1;
        }
    }

    @Command(name = "info", description = "Show details of a plugin")
    static final class InfoCommand extends PluginSubcommand {

        @Parameters(paramLabel = "ID")
        String id;

        @Option(names = "--json", description = "Print JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            try (PluginSession session = parent.openSession()) {
                PluginManager manager = session.getManager();
                ManagedPlugin record = manager.getPlugin(id);
                if (record == null || record.getState() == LifecycleState.UNLOADED) {
                    return notFound(id);
                }
                Map<String, Object> view = PluginViews.detail(record);
                if (json) {
                    printJson(view);
                } else {
                    view.forEach((key, value) -> {
                        if (value != null) {
                            out().println(key + ": " + value);
                        }
                    });
                }
                return exitCode(manager, id);
            }
        }
    }
}
