package com.stockmetrics.app;

import com.stockmetrics.config.Config;
import com.stockmetrics.core.RunTelemetry;
import com.stockmetrics.data.InvalidInputException;
import com.stockmetrics.data.LoadedPanel;
import com.stockmetrics.data.PriceCsvLoader;
import com.stockmetrics.model.MetricsReport;
import com.stockmetrics.output.MetricsJsonWriter;
import com.stockmetrics.runner.MetricsRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

public final class StockMetricsApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new StockMetricsApplication().run(args, Path.of(".").toAbsolutePath().normalize());
        System.exit(exit);
    }

    public int run(String[] args, Path workingDir) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stock-metrics", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stock-metrics", options);
            return 0;
        }

        try {
            Config config = Config.load(workingDir).withOverrides(overridesFrom(cmd));
            installLogRoutingIfNeeded(config);

            String inputRaw = firstNonBlank(config.getString("input.path"), System.getenv("STOCKMETRICS_INPUT"));
            if (inputRaw.isEmpty()) {
                System.err.println("ERROR: no input panel. Use --input <csv> or config input.path.");
                return 2;
            }
            Path input = workingDir.resolve(inputRaw).normalize();
            if (!Files.isRegularFile(input)) {
                System.err.println("ERROR: input file not found: " + input);
                return 2;
            }
            System.out.println("Config: " + config.resolve("rolling.window")
                    + ", " + config.resolve("rolling.summary_alignment")
                    + ", " + config.resolve("pipeline.threads"));

            RunTelemetry telemetry = new RunTelemetry("cli", Instant.now());
            telemetry.startStep(RunTelemetry.STEP_LOAD);
            LoadedPanel loaded = new PriceCsvLoader().load(input);
            telemetry.endStep(RunTelemetry.STEP_LOAD, loaded.totalRows(), loaded.rows().size(), 0,
                    input.getFileName().toString() + ", bad_dates=" + loaded.rejected().size());

            MetricsReport report = new MetricsRunner(config, telemetry).run(loaded);

            telemetry.startStep(RunTelemetry.STEP_WRITE);
            MetricsJsonWriter writer = new MetricsJsonWriter(config.getBoolean("output.pretty_json", true));
            Path out = writer.write(config.getPath("outputs.dir"), report, telemetry, LocalDateTime.now());
            telemetry.endStep(RunTelemetry.STEP_WRITE, 1, 1, 0, out.getFileName().toString());
            telemetry.finish();

            System.out.println("Metrics written: " + out);
            System.out.println(telemetry.getSummary());
            return 0;
        } catch (InvalidInputException e) {
            System.err.println("FATAL: invalid input panel: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private Map<String, String> overridesFrom(CommandLine cmd) {
        Map<String, String> overrides = new LinkedHashMap<>();
        if (cmd.hasOption("input")) {
            overrides.put("input.path", cmd.getOptionValue("input"));
        }
        if (cmd.hasOption("output-dir")) {
            overrides.put("outputs.dir", cmd.getOptionValue("output-dir"));
        }
        if (cmd.hasOption("window")) {
            overrides.put("rolling.window", cmd.getOptionValue("window"));
        }
        if (cmd.hasOption("threads")) {
            overrides.put("pipeline.threads", cmd.getOptionValue("threads"));
        }
        if (cmd.hasOption("symbol-correlation")) {
            overrides.put("correlation.symbol_pairwise.enabled", "true");
        }
        return overrides;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED || !config.getBoolean("log.route_stdout", true)) {
            return;
        }
        synchronized (StockMetricsApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("stockmetrics.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(StockMetricsApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("input").hasArg().argName("csv").desc("price panel CSV (symbol,date,open,high,low,close,adjusted,volume)").build());
        options.addOption(Option.builder().longOpt("output-dir").hasArg().argName("dir").desc("directory for metrics_<ts>.json (default outputs)").build());
        options.addOption(Option.builder().longOpt("window").hasArg().argName("n").desc("rolling window width in observations (default 30)").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("worker threads for per-symbol metrics (default 1)").build());
        options.addOption(Option.builder().longOpt("symbol-correlation").desc("also compute symbol-vs-symbol correlation of daily returns").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }
}
