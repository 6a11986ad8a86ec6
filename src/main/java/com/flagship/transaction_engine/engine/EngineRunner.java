package com.flagship.transaction_engine.engine;

import com.flagship.transaction_engine.io.CsvAccountWriter;
import com.flagship.transaction_engine.io.CsvMutationReader;
import com.flagship.transaction_engine.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: reads the CSV named by the first argument, runs
 * the engine and writes the account table to stdout.
 *
 * Exit code is 0 when every record was consumed, 1 otherwise. Diagnostics go
 * to the log (stderr), never to stdout.
 */
@Component
@ConditionalOnProperty(name = "engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EngineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = "Usage: java -jar transaction-engine.jar <transactions.csv> > accounts.csv";

    private final CsvMutationReader mutationReader;
    private final CsvAccountWriter accountWriter;
    private final TransactionEngine engine;
    private final EngineMetrics metrics;

    @Value("${engine.summary.enabled:true}")
    private boolean summaryEnabled = true;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        exitCode = execute(args.getNonOptionArgs(), stdout);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs the whole pipeline for the given positional arguments.
     *
     * @return process exit code
     */
    int execute(List<String> arguments, Writer output) {
        if (arguments.isEmpty()) {
            log.error(USAGE);
            return 1;
        }
        Path input = Path.of(arguments.get(0));

        try (Reader source = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            EngineReport report = engine.process(mutationReader.read(source));
            if (report.isAborted()) {
                log.error("Run aborted after {} records, no account table written", report.getProcessed() + 1);
                return 1;
            }
            accountWriter.write(report.getAccounts(), output);
            return 0;
        } catch (IOException e) {
            log.error("Cannot read {}: {}", input, e.getMessage());
            return 1;
        } catch (UncheckedIOException e) {
            log.error("The transaction engine failed reading {}: {}", input, e.getMessage(), e);
            return 1;
        } catch (RuntimeException e) {
            log.error("The transaction engine failed with message: {}", e.getMessage(), e);
            return 1;
        } finally {
            if (summaryEnabled) {
                log.info("Engine summary: {}", metrics.summary());
            }
        }
    }
}
