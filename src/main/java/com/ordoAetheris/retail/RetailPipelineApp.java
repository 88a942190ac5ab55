package com.ordoAetheris.retail;

import com.ordoAetheris.retail.analysis.RetailAnalysis;
import com.ordoAetheris.retail.analysis.RetailReport;
import com.ordoAetheris.retail.analysis.Transaction;
import com.ordoAetheris.retail.io.TransactionCsvReader;
import com.ordoAetheris.retail.pipeline.Pipeline;
import com.ordoAetheris.retail.pipeline.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 *   RetailPipelineApp --csv data/OnlineRetail.csv [--capacity 10]
 * </pre>
 *
 * The CSV is read lazily on the producer thread and pushed through a bounded queue;
 * the consumer thread collects the rows, and the report runs over the valid ones.
 * The cancellation rate needs the raw rows, so the file is also read once directly,
 * ahead of the pipeline run.
 */
public class RetailPipelineApp {
    private static final Logger log = LoggerFactory.getLogger(RetailPipelineApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) throws Exception {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws InterruptedException {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(Options.USAGE);
            return EXIT_USAGE;
        }

        Instant t0 = Instant.now();
        log.info("Analysing {} with queue capacity {}", options.csv, options.capacity);
        try {
            // a malformed file fails on this direct read before any worker starts
            double cancellationRate;
            try (TransactionCsvReader reader = TransactionCsvReader.open(options.csv)) {
                cancellationRate = RetailAnalysis.cancellationRate(reader);
            }
            List<Transaction> raw;
            try (TransactionCsvReader reader = TransactionCsvReader.open(options.csv)) {
                raw = Pipeline.run(reader, options.capacity);
            }
            RetailReport report = new RetailReport(out);
            report.print(RetailAnalysis.validTransactions(raw));
            report.printCancellationRate(cancellationRate);
        } catch (IOException | UncheckedIOException | PipelineException e) {
            log.error("Analysis of {} failed", options.csv, e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        log.info("Done in {} ms", Duration.between(t0, Instant.now()).toMillis());
        return EXIT_OK;
    }

    static final class Options {
        static final String USAGE = "usage: RetailPipelineApp --csv <path> [--capacity <n>]";

        final Path csv;
        final int capacity;

        private Options(Path csv, int capacity) {
            this.csv = csv;
            this.capacity = capacity;
        }

        static Options parse(String[] args) {
            Path csv = null;
            int capacity = Pipeline.DEFAULT_CAPACITY;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--csv":
                        csv = Paths.get(value(args, ++i, arg));
                        break;
                    case "--capacity":
                        String raw = value(args, ++i, arg);
                        try {
                            capacity = Integer.parseInt(raw);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--capacity must be an integer, got '" + raw + "'", e);
                        }
                        if (capacity <= 0) throw new IllegalArgumentException("--capacity must be > 0, got " + capacity);
                        break;
                    default:
                        throw new IllegalArgumentException("unknown argument: " + arg);
                }
            }
            if (csv == null) throw new IllegalArgumentException("--csv is required");
            if (!Files.isRegularFile(csv)) throw new IllegalArgumentException("no such file: " + csv);
            return new Options(csv, capacity);
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) throw new IllegalArgumentException(flag + " needs a value");
            return args[i];
        }
    }
}
