package io.parareq.openai;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.ProvisionException;
import io.parareq.config.DispatchConfig;
import io.parareq.core.CostEstimator;
import io.parareq.core.RawJob;
import io.parareq.core.Source;
import io.parareq.core.Transport;
import io.parareq.error.MalformedInputException;
import io.parareq.runtime.AdmissionLoop;
import io.parareq.runtime.StatusSnapshot;
import io.parareq.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI that sends every request in a JSONL file to an API endpoint in parallel, under request and
 * token rate limits, and writes one result line per request.
 */
@CommandLine.Command(name = "parareq", mixinStandardHelpOptions = true, description = "Process API requests in parallel under rate limits")
public final class ParareqMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ParareqMain.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_MALFORMED = 3;

    @CommandLine.Option(names = {"-i", "--requests-file"}, description = "JSONL file with one request per line")
    Path requestsFile;

    @CommandLine.Option(names = {"-o", "--save-file"}, description = "Results file; default <requests>_results.jsonl")
    Path saveFile;

    @CommandLine.Option(names = {"-u", "--request-url"}, description = "Endpoint every request is POSTed to", defaultValue = "https://api.openai.com/v1/embeddings")
    String requestUrl;

    @CommandLine.Option(names = "--api-key", description = "API key; default $" + CredentialResolver.ENV_VAR)
    String apiKey;

    @CommandLine.Option(names = {"-r", "--max-requests"}, description = "Requests allowed per request period")
    Double maxRequests;

    @CommandLine.Option(names = "--request-period", description = "Request period in seconds")
    Long requestPeriodSeconds;

    @CommandLine.Option(names = {"-t", "--max-tokens"}, description = "Tokens allowed per token period")
    Double maxTokens;

    @CommandLine.Option(names = "--token-period", description = "Token period in seconds")
    Long tokenPeriodSeconds;

    @CommandLine.Option(names = {"-a", "--max-attempts"}, description = "Attempts per request, first one included")
    Integer maxAttempts;

    @CommandLine.Option(names = "--cooldown", description = "Seconds to pause new requests after a rate-limit error")
    Long cooldownSeconds;

    @CommandLine.Option(names = "--timeout", description = "Per-request HTTP timeout in seconds; default none")
    Long timeoutSeconds;

    @CommandLine.Option(names = {"-e", "--token-encoding"}, description = "Token encoding used to estimate request cost", defaultValue = "cl100k_base")
    String tokenEncoding;

    @CommandLine.Option(names = "--cost-estimator", description = "openai or zero", defaultValue = CostEstimators.OPENAI)
    String costEstimator;

    @CommandLine.Option(names = "--dry-run", description = "Check configuration and input, then exit")
    boolean dryRun;

    @CommandLine.Option(names = "--auto-rename-output", description = "Pick a free name when the results file exists")
    boolean autoRenameOutput;

    @CommandLine.Option(names = "--create-requests-file", description = "Write an example requests file here and exit")
    Path createRequestsFile;

    @CommandLine.Option(names = "--log-level", description = "TRACE, DEBUG, INFO, WARN or ERROR")
    String logLevel;

    public static void main(String[] args) {
        int code = new CommandLine(new ParareqMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        if (logLevel != null) setRootLevel(logLevel);

        if (createRequestsFile != null) {
            new RequestsFileGenerator(new ObjectMapper()).write(createRequestsFile, RequestsFileGenerator.DEFAULT_COUNT);
            return 0;
        }
        if (requestsFile == null) {
            log.error("Missing --requests-file");
            return EXIT_USAGE;
        }
        if (!Files.isRegularFile(requestsFile)) {
            log.error("Requests file {} not found", requestsFile);
            return EXIT_USAGE;
        }

        Path results = saveFile != null ? saveFile : OutputPaths.resultsFor(requestsFile);
        if (Files.exists(results)) {
            if (!autoRenameOutput) {
                log.error("Results file {} already exists; remove it or pass --auto-rename-output", results);
                return EXIT_USAGE;
            }
            results = OutputPaths.firstFree(results);
            log.info("Results file exists, writing to {} instead", results);
        }

        DispatchConfig config;
        try {
            config = dispatchConfig().validate();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        RunSettings settings = new RunSettings(requestsFile, results, requestUrl, apiKey, tokenEncoding, costEstimator,
                timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds), config);
        Injector injector = Guice.createInjector(new ParareqModule(settings));
        try {
            injector.getInstance(CostEstimator.class);
            injector.getInstance(Transport.class);
        } catch (ProvisionException e) {
            log.error("Invalid configuration: {}", causeOf(e).getMessage());
            return EXIT_USAGE;
        }

        if (dryRun) {
            log.info("Dry run: {} would be sent to {}, results to {}", requestsFile, requestUrl, results);
            return 0;
        }
        return run(injector, results);
    }

    private int run(Injector injector, Path results) throws IOException, InterruptedException {
        // the results file is created last so a failed start leaves nothing behind
        Source<RawJob> source;
        ResultSink sink;
        try {
            source = injector.getInstance(new Key<Source<RawJob>>() {});
        } catch (ProvisionException e) {
            return startFailed(e);
        }
        try {
            sink = injector.getInstance(ResultSink.class);
        } catch (ProvisionException e) {
            source.close();
            return startFailed(e);
        }
        AdmissionLoop loop;
        try {
            loop = injector.getInstance(AdmissionLoop.class);
        } catch (ProvisionException e) {
            source.close();
            sink.close();
            Files.deleteIfExists(results);
            return startFailed(e);
        }

        log.info("Sending requests from {} to {}", requestsFile, requestUrl);
        StatusSnapshot status;
        try (sink; loop) {
            status = loop.run();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MalformedInputException) {
                log.error("{}", e.getCause().getMessage());
                return EXIT_MALFORMED;
            }
            log.error("Run failed", e.getCause());
            return EXIT_FAILED;
        }

        if (status.hasFailures()) {
            Path renamed = OutputPaths.firstFree(OutputPaths.withErrors(results));
            Files.move(results, renamed);
            results = renamed;
            log.warn("{} / {} requests failed. Errors logged to {}.", status.failed(), status.started(), results);
        }
        if (status.rateLimitErrors() > 0) {
            log.warn("{} rate limit errors received. Consider running at a lower rate.", status.rateLimitErrors());
        }
        log.info("Parallel processing complete. Results saved to {}", results);
        return 0;
    }

    DispatchConfig dispatchConfig() {
        DispatchConfig env = DispatchConfig.fromEnv();
        return new DispatchConfig(
                maxRequests != null ? maxRequests : env.requestLimit(),
                requestPeriodSeconds != null ? Duration.ofSeconds(requestPeriodSeconds) : env.requestPeriod(),
                maxTokens != null ? maxTokens : env.costLimit(),
                tokenPeriodSeconds != null ? Duration.ofSeconds(tokenPeriodSeconds) : env.costPeriod(),
                maxAttempts != null ? maxAttempts : env.maxAttempts(),
                cooldownSeconds != null ? Duration.ofSeconds(cooldownSeconds) : env.cooldown(),
                env.loopSleep(),
                env.rateLimitSignature(),
                env.reportInterval());
    }

    private static int startFailed(ProvisionException e) {
        Throwable cause = causeOf(e);
        // FileAlreadyExistsException, AccessDeniedException and NoSuchFileException alike
        if (cause instanceof FileSystemException) {
            log.error("Cannot open {}: {}", ((FileSystemException) cause).getFile(), cause.getClass().getSimpleName());
        } else {
            log.error("Cannot start run: {}", cause.getMessage());
        }
        return EXIT_USAGE;
    }

    private static Throwable causeOf(ProvisionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }

    private static void setRootLevel(String level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
            LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
            ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
        }
    }
}
