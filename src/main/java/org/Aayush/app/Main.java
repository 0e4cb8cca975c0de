package org.Aayush.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dispatch.core.DispatchCore;
import org.Aayush.dispatch.core.DispatchCoreException;
import org.Aayush.dispatch.core.DispatchPlan;
import org.Aayush.dispatch.core.DispatchRuntimeConfig;
import org.Aayush.serialization.json.DispatchInput;
import org.Aayush.serialization.json.DispatchJsonReader;
import org.Aayush.serialization.json.DispatchJsonWriter;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point: {@code Main [input.json] [output.json]}.
 */
@Slf4j
public class Main {
    static final String DEFAULT_INPUT = "input.json";
    static final String DEFAULT_OUTPUT = "output.json";

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_IO = 2;

    /**
     * Plans the input document and writes the output document.
     *
     * @param args optional input and output paths.
     */
    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs one planning pass and returns the process exit code.
     */
    static int run(String[] args) {
        if (args.length > 2) {
            log.error("usage: Main [input.json] [output.json]");
            return EXIT_INVALID;
        }
        Path input = Paths.get(args.length > 0 ? args[0] : DEFAULT_INPUT);
        Path output = Paths.get(args.length > 1 ? args[1] : DEFAULT_OUTPUT);

        try {
            log.info("reading dispatch input from {}", input);
            DispatchInput document = new DispatchJsonReader().read(input);
            DispatchPlan plan = DispatchCore.builder()
                    .config(DispatchRuntimeConfig.defaults())
                    .build()
                    .plan(document.getRequest());
            new DispatchJsonWriter().write(plan, document, output);
            log.info("wrote {} drone assignments to {} (covered {}/{} orders)",
                    plan.getDroneAssignments().size(), output,
                    plan.getCoveredOrderCount(), document.getRequest().getOrders().size());
            return EXIT_OK;
        } catch (UncheckedIOException ex) {
            log.error("dispatch I/O failed: {}", ex.getMessage(), ex);
            return EXIT_IO;
        } catch (IllegalArgumentException | DispatchCoreException ex) {
            log.error("dispatch input rejected: {}", ex.getMessage());
            return EXIT_INVALID;
        }
    }
}
