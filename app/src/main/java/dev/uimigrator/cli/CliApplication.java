package dev.uimigrator.cli;

import dev.uimigrator.config.ConfigLoader;
import dev.uimigrator.config.MigratorConfig;
import dev.uimigrator.config.SystemEnvironmentReader;
import dev.uimigrator.engine.TransformationOptions;
import dev.uimigrator.logging.LoggingConfigurator;
import dev.uimigrator.mapping.InMemoryMappingSource;
import dev.uimigrator.mapping.JsonMappingLoader;
import dev.uimigrator.mapping.MappingDatabase;
import dev.uimigrator.mapping.MappingLoadException;
import dev.uimigrator.migrate.MigrationOutcome;
import dev.uimigrator.migrate.MigrationPlanner;
import dev.uimigrator.migrate.MigrationReportFormatter;
import dev.uimigrator.migrate.MigrationService;
import dev.uimigrator.migrate.MigrationTask;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and migration service.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final JsonMappingLoader mappingLoader;
    private final PrintWriter reportWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new JsonMappingLoader(), null);
    }

    CliApplication(ConfigLoader configLoader, JsonMappingLoader mappingLoader, PrintWriter reportWriter) {
        this.configLoader = configLoader;
        this.mappingLoader = mappingLoader;
        this.reportWriter = reportWriter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        PrintWriter out = reportWriter != null ? reportWriter : commandLine.getOut();

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        MigratorConfig config;
        List<MigrationTask> tasks;
        MappingDatabase mappings;
        try {
            config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
            mappings = config.mappingsFile().map(mappingLoader::load).orElseGet(mappingLoader::loadDefaults);
            tasks = new MigrationPlanner(config).plan();
        } catch (IllegalArgumentException | MappingLoadException | UncheckedIOException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LOGGER.info("Migrating {} document(s) with strategy {} (dryRun={})", tasks.size(), config.strategy(), config.dryRun());

        MigrationService service = new MigrationService(new InMemoryMappingSource(mappings), config.strategy(),
                new TransformationOptions(config.elementNameShorthand(), true, config.compiledBindings()));
        List<MigrationOutcome> outcomes = new ArrayList<>();
        for (MigrationTask task : tasks) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warn("Interrupted; {} of {} document(s) processed", outcomes.size(), tasks.size());
                break;
            }
            outcomes.add(service.migrate(task, config.dryRun()));
        }

        out.print(new MigrationReportFormatter(false).format(outcomes));
        out.flush();
        return exitCode(outcomes, config.failOnError());
    }

    static int exitCode(List<MigrationOutcome> outcomes, boolean failOnError) {
        boolean anyFailed = outcomes.stream().anyMatch(MigrationOutcome::failed);
        boolean anyErrors = outcomes.stream().anyMatch(MigrationOutcome::hasErrors);
        return anyFailed || (failOnError && anyErrors) ? EXIT_FAILED : EXIT_OK;
    }
}
