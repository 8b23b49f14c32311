package io.sqlpulse.monitor.engine;

import io.sqlpulse.monitor.common.recommendation.ApprovalState;
import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.Report;
import io.sqlpulse.monitor.engine.connect.ConnectionException;
import io.sqlpulse.monitor.engine.recommendation.ConsoleApprovalHandler;
import io.sqlpulse.monitor.engine.recommendation.RecommendationApprovals;
import io.sqlpulse.monitor.engine.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar sqlpulse-engine.jar --settings=settings.yaml --level=expert --enable-tables --interactive
 * </pre>
 *
 * Exit codes: 0 report produced (possibly degraded), 1 configuration error, 2 connection failure,
 * 3 report files could not be written.
 */
public class SqlPulseCli {
    private static final Logger logger = LoggerFactory.getLogger(SqlPulseCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION = 1;
    static final int EXIT_CONNECTION = 2;
    static final int EXIT_OUTPUT = 3;

    private final Function<MonitorConfig, HealthCheckRunner> runnerFactory;

    public SqlPulseCli() {
        this(HealthCheckRunner::create);
    }

    SqlPulseCli(Function<MonitorConfig, HealthCheckRunner> runnerFactory) {
        this.runnerFactory = runnerFactory;
    }

    public static void main(String[] args) {
        int code = new SqlPulseCli().run(args, System.out, System.in);
        System.exit(code);
    }

    public int run(String[] args, PrintStream out, InputStream in) {
        MonitorConfig config;
        boolean interactive;
        try {
            Map<String, String> options = parseArgs(args);
            interactive = Boolean.parseBoolean(options.remove("interactive"));
            String settings = options.remove("settings");
            MonitorConfig.Builder builder = settings != null
                    ? new MonitorSettingsLoader().load(Paths.get(settings))
                    : MonitorConfig.builder();
            config = MonitorConfig.fromArgs(builder, options);
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            out.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIGURATION;
        }
        logger.debug("Effective configuration: {}", config);

        HealthCheckRunner runner = runnerFactory.apply(config);
        try {
            Report report = runner.run();

            if (interactive && !report.getRecommendations().isEmpty()) {
                BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
                RecommendationApprovals.review(report.getRecommendations(), new ConsoleApprovalHandler(reader, out));
            }

            List<Path> written = new ReportWriter(Paths.get(config.getOutputDirectory()), config.getOutputFormats())
                    .write(report);
            printSummary(report, written, out);
            return EXIT_OK;
        } catch (ConnectionException e) {
            logger.error("Connection failed: {}", e.getMessage());
            out.println("Connection failed: " + e.getMessage());
            return EXIT_CONNECTION;
        } catch (IOException e) {
            logger.error("Failed to write report files", e);
            out.println("Failed to write report: " + e.getMessage());
            return EXIT_OUTPUT;
        } finally {
            runner.shutdown();
        }
    }

    private static void printSummary(Report report, List<Path> written, PrintStream out) {
        out.println();
        out.println("Health check " + (report.isDegraded() ? "completed with failures" : "completed")
                + ": " + report.getFindings().size() + " findings, "
                + report.getRecommendations().size() + " recommendations ("
                + report.getRecommendationMode() + ")");
        for (Recommendation recommendation : report.getRecommendations()) {
            if (recommendation.getApprovalState() == ApprovalState.APPROVED) {
                out.println("  Approved, run manually: " + recommendation.getProposedCommand().orElse(""));
            }
        }
        for (Path path : written) {
            out.println("Report: " + path);
        }
    }

    /**
     * {@code --key=value} pairs; a bare {@code --flag} means {@code true}
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        if (args == null) {
            return options;
        }
        for (String arg : args) {
            if (!arg.startsWith("--") || arg.length() == 2) {
                throw new ConfigurationException("Unexpected argument: " + arg);
            }
            String body = arg.substring(2);
            int eq = body.indexOf('=');
            if (eq < 0) {
                options.put(body, "true");
            } else {
                options.put(body.substring(0, eq), body.substring(eq + 1));
            }
        }
        return options;
    }
}
