package io.fabricla.collector;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.fabricla.collector.config.CollectorConfig;
import io.fabricla.collector.config.Settings;
import io.fabricla.collector.error.AuthException;
import io.fabricla.collector.error.ConfigException;
import io.fabricla.collector.error.DiscoveryException;
import io.fabricla.collector.model.CollectionMode;
import io.fabricla.collector.model.DetailLevel;
import io.fabricla.collector.model.RunResult;
import io.fabricla.collector.model.RunStatus;
import io.fabricla.collector.runtime.CollectionOrchestrator;
import io.fabricla.core.Json;
import io.fabricla.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI for one collection run. Prints the run result as JSON and exits 0 (completed), 1 (partially failed),
 * 2 (configuration error) or 3 (authentication or discovery failure).
 */
@CommandLine.Command(name = "fabricla-collect", mixinStandardHelpOptions = true,
        description = "Collect Fabric and Power BI telemetry into Log Analytics streams")
public final class CollectorMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CollectorMain.class);

    static final int EXIT_COMPLETED = 0;
    static final int EXIT_PARTIAL = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_AUTH = 3;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Properties file (keys may also come from -D or FABRICLA_* env)")
    Path configFile;

    @CommandLine.Option(names = {"-m", "--mode"}, description = "bulk, incremental or activity_backfill")
    String mode;

    @CommandLine.Option(names = {"-l", "--lookback-minutes"}, description = "Window length in minutes; default depends on mode")
    Long lookbackMinutes;

    @CommandLine.Option(names = {"-d", "--detail"}, description = "summary or full; default depends on mode")
    String detail;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Entities collected in parallel")
    Integer workers;

    @CommandLine.Option(names = {"-s", "--stream"}, split = ",", description = "Streams to collect (comma-separated or repeat option)")
    List<String> streams = new ArrayList<>();

    @CommandLine.Option(names = {"--deadline-seconds"}, description = "Abandon collection after this many seconds")
    Long deadlineSeconds;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new CollectorMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        CollectorConfig config;
        Settings settings;
        try {
            settings = Settings.load(configFile);
            config = CollectorConfig.from(settings).withOverrides(
                    mode == null ? null : CollectionMode.parse(mode),
                    lookbackMinutes == null ? null : Duration.ofMinutes(lookbackMinutes),
                    detail == null ? null : DetailLevel.parse(detail),
                    workers,
                    streams,
                    deadlineSeconds == null ? null : Duration.ofSeconds(deadlineSeconds));
        } catch (ConfigException | IllegalArgumentException | ArithmeticException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        Injector injector = Guice.createInjector(new CollectorModule(config, settings));
        CollectionOrchestrator orchestrator = injector.getInstance(CollectionOrchestrator.class);
        RunResult result;
        try {
            result = orchestrator.run();
        } catch (ConfigException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (AuthException | DiscoveryException e) {
            err.println("Run aborted: " + e.getMessage());
            return EXIT_AUTH;
        }

        out.println(Json.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
        out.flush();
        new Metrics(injector.getInstance(MetricRegistry.class)).counterSnapshot()
                .forEach((name, count) -> log.info("metric {} = {}", name, count));
        return result.status() == RunStatus.COMPLETED ? EXIT_COMPLETED : EXIT_PARTIAL;
    }
}
