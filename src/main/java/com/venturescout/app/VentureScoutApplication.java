package com.venturescout.app;

import com.venturescout.config.Config;
import com.venturescout.core.RunTelemetry;
import com.venturescout.core.TimeSource;
import com.venturescout.data.ProfileJsonReader;
import com.venturescout.model.BatchResult;
import com.venturescout.model.CompanyProfile;
import com.venturescout.model.MalformedProfileException;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.model.OverallWeights;
import com.venturescout.output.ReportWriter;
import com.venturescout.portfolio.PortfolioConflictAnalyzer;
import com.venturescout.ratelimit.SlidingWindowRateLimiter;
import com.venturescout.runner.BatchScoringCoordinator;
import com.venturescout.runner.CancellationSignal;
import com.venturescout.runner.ScoringPipeline;
import com.venturescout.scoring.FitScorer;
import com.venturescout.scoring.QualityScorer;
import com.venturescout.scoring.RecommendationPolicy;
import com.venturescout.vector.EmbeddingClient;
import com.venturescout.vector.EmbeddingClients;
import com.venturescout.vector.SimilarityCache;
import com.venturescout.vector.TextSimilarity;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class VentureScoutApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Path workingDir;
    private final boolean routeLogs;

    public VentureScoutApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), false);
    }

    public VentureScoutApplication(Path workingDir, boolean routeLogs) {
        this.workingDir = workingDir;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        int exit = new VentureScoutApplication(Path.of(".").toAbsolutePath().normalize(), true).run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("venturescout", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("venturescout", options);
            return 0;
        }
        if (!cmd.hasOption("organization") || !cmd.hasOption("candidates")) {
            new HelpFormatter().printHelp("venturescout", options);
            System.err.println("ERROR: --organization and --candidates are required.");
            return 2;
        }

        try {
            Config config = Config.load(workingDir);
            if (routeLogs) {
                installLogRoutingIfNeeded(config);
            }
            return runBatch(cmd, config);
        } catch (MalformedProfileException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private int runBatch(CommandLine cmd, Config config) throws IOException, InterruptedException {
        RunTelemetry telemetry = new RunTelemetry("batch", "cli", Instant.now());
        ProfileJsonReader reader = new ProfileJsonReader();

        OrganizationProfile organization;
        List<CompanyProfile> candidates;
        telemetry.startStep(RunTelemetry.STEP_LOAD_PROFILES);
        try {
            organization = reader.readOrganization(workingDir.resolve(cmd.getOptionValue("organization")));
            candidates = reader.readCandidates(workingDir.resolve(cmd.getOptionValue("candidates")));
            telemetry.endStep(RunTelemetry.STEP_LOAD_PROFILES, 2, candidates.size() + 1L, 0);
        } catch (IOException | JSONException e) {
            telemetry.endStep(RunTelemetry.STEP_LOAD_PROFILES, 2, 0, 1, e.getClass().getSimpleName());
            System.err.println("ERROR: failed to read profiles: " + e.getMessage());
            return 2;
        }

        int threads = parsePositive(cmd.getOptionValue("threads"), config.getInt("batch.threads", BatchScoringCoordinator.DEFAULT_THREADS));
        int topN = parsePositive(cmd.getOptionValue("top"), config.getInt("batch.top_n", 20));
        String provider = cmd.getOptionValue("embedding", config.getString("embedding.provider", "hashing"));

        SlidingWindowRateLimiter rateLimiter = SlidingWindowRateLimiter.fromConfig(config, TimeSource.system());
        EmbeddingClient encoder = EmbeddingClients.create(provider, config, rateLimiter);
        SimilarityCache cache = EmbeddingClients.cacheFromConfig(config, encoder);
        TextSimilarity similarity = new TextSimilarity(cache);
        QualityScorer qualityScorer = new QualityScorer(config);
        ScoringPipeline pipeline = new ScoringPipeline(
                qualityScorer,
                new FitScorer(similarity, qualityScorer, config),
                PortfolioConflictAnalyzer.fromConfig(similarity, config),
                RecommendationPolicy.fromConfig(config),
                OverallWeights.fromConfig(config)
        );
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(pipeline, threads, telemetry);

        System.out.println("Scoring " + candidates.size() + " candidates for " + organization.name
                + " threads=" + coordinator.threads() + " encoder=" + cache.encoderName());

        CancellationSignal cancel = new CancellationSignal();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancel.cancel();
            try {
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "venturescout-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        BatchResult result;
        try {
            result = coordinator.scoreAll(candidates, organization, cancel);

            telemetry.startStep(RunTelemetry.STEP_REPORT);
            Path outputDir = cmd.hasOption("output")
                    ? workingDir.resolve(cmd.getOptionValue("output")).normalize()
                    : config.getPath("outputs.dir");
            ReportWriter writer = new ReportWriter(topN);
            Instant generatedAt = Instant.now();
            Path json = writer.writeJson(result, outputDir, generatedAt);
            Path digest = writer.writeDigest(result, outputDir, generatedAt);
            telemetry.endStep(RunTelemetry.STEP_REPORT, result.ranked().size(), 2, 0);

            System.out.println(writer.digest(result));
            System.out.println("Report written: " + json.toAbsolutePath());
            System.out.println("Digest written: " + digest.toAbsolutePath());
        } finally {
            finished.countDown();
            removeHook(hook);
        }

        telemetry.recordCache(cache.stats());
        telemetry.finish();
        System.out.println(telemetry.getSummary());
        return result.summary().cancelled ? 130 : 0;
    }

    private void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            System.err.println("WARN: shutdown in progress, cancel hook left registered: " + e.getMessage());
        }
    }

    private int parsePositive(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return Math.max(1, fallback);
        }
        try {
            return Math.max(1, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            System.err.println("WARN: invalid number '" + raw + "', using " + fallback);
            return Math.max(1, fallback);
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (VentureScoutApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("venturescout.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(VentureScoutApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("organization").hasArg().argName("file").desc("organization profile JSON").build());
        options.addOption(Option.builder().longOpt("candidates").hasArg().argName("file").desc("candidate profiles JSON").build());
        options.addOption(Option.builder().longOpt("output").hasArg().argName("dir").desc("report directory (default outputs.dir)").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("worker threads (default batch.threads)").build());
        options.addOption(Option.builder().longOpt("embedding").hasArg().argName("provider").desc("hashing or ollama (default embedding.provider)").build());
        options.addOption(Option.builder().longOpt("top").hasArg().argName("n").desc("rows in the text digest (default batch.top_n)").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
