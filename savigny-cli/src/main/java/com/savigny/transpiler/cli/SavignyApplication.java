/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.cli;

import com.savigny.transpiler.api.TranspilationListener;
import com.savigny.transpiler.api.exceptions.DocumentLoadException;
import com.savigny.transpiler.api.exceptions.TranspilationException;
import com.savigny.transpiler.compiler.DocumentLoader;
import com.savigny.transpiler.compiler.SchemaTranspiler;
import com.savigny.transpiler.compiler.config.ConfigurationDocument;
import com.savigny.transpiler.compiler.context.LegalContext;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Date;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command-line entry point.
 *
 * <pre>
 * savigny [options] input_file [output_file]
 *   -h, --help           show usage
 *   -v, --verbose        detailed progress on the log
 *   -c, --config FILE    configuration document (default: schema_config.json)
 *   -x, --context FILE   legal-context document
 * </pre>
 *
 * The configuration and context paths fall back to the {@code savigny.config}
 * and {@code savigny.context} system properties. Without an output file the
 * program is written to standard output.
 */
public class SavignyApplication {

    private static final Logger logger = Logger.getLogger(SavignyApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        boolean verbose = false;
        for (String arg : args) {
            if (arg.equals("-v") || arg.equals("--verbose")) {
                verbose = true;
            }
        }
        configureLogging(verbose);
        int status = new SavignyApplication().run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs the transpiler with the given arguments.
     *
     * @return process exit status
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (options.help) {
            printUsage(out);
            return EXIT_OK;
        }

        DocumentLoader loader = new DocumentLoader();
        try (TracingService tracing = TracingService.fromSystemProperties()) {
            ConfigurationDocument configuration = loader.loadConfiguration(options.configPath);
            LegalContext context = null;
            if (options.contextPath != null) {
                context = loader.loadContext(options.contextPath);
            }

            SchemaTranspiler transpiler = new SchemaTranspiler(configuration, context, tracing.getTracer());
            if (options.verbose) {
                transpiler.setTranspilationListener(new LoggingListener());
            }

            logger.fine("Parsing schema from " + options.inputPath);
            String code = transpiler.transpile(options.inputPath);

            if (options.outputPath == null) {
                out.print(code);
                out.flush();
            } else {
                Files.writeString(options.outputPath, code, StandardCharsets.UTF_8);
                logger.info("Kelsen code written to " + options.outputPath);
            }
            return EXIT_OK;
        } catch (DocumentLoadException e) {
            err.println("Error: " + e.getMessage());
            logger.log(Level.FINE, "Document load failed", e);
            return EXIT_FAILURE;
        } catch (NoSuchFileException e) {
            err.println("Error: Failed to open input file " + e.getFile());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            logger.log(Level.FINE, "I/O failure", e);
            return EXIT_FAILURE;
        } catch (TranspilationException e) {
            err.println("Error: " + e.getMessage());
            logger.log(Level.FINE, "Transpilation failed", e);
            return EXIT_FAILURE;
        }
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: savigny [options] input_file [output_file]");
        stream.println();
        stream.println("Options:");
        stream.println("  -h, --help           Display this help message");
        stream.println("  -v, --verbose        Enable verbose output");
        stream.println("  -c, --config FILE    Specify configuration file (default: schema_config.json)");
        stream.println("  -x, --context FILE   Specify legal context file");
        stream.println();
        stream.println("If output_file is not specified, output is written to stdout.");
    }

    private static void configureLogging(boolean verbose) {
        LogManager.getLogManager().reset();
        Logger rootLogger = Logger.getLogger("");
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(verbose ? Level.FINE : Level.INFO);
        consoleHandler.setFormatter(new SimpleFormatter() {
            @Override
            public String format(LogRecord record) {
                return String.format("[%1$tF %1$tT.%1$tL] [%2$-7s] %3$s - %4$s%n",
                    new Date(record.getMillis()), record.getLevel(),
                    record.getLoggerName(), record.getMessage());
            }
        });
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(verbose ? Level.FINE : Level.INFO);
    }

    static final class Options {
        boolean help;
        boolean verbose;
        Path configPath = Paths.get(System.getProperty("savigny.config", "schema_config.json"));
        Path contextPath = contextFromProperty();
        Path inputPath;
        Path outputPath;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h", "--help" -> options.help = true;
                    case "-v", "--verbose" -> options.verbose = true;
                    case "-c", "--config" -> options.configPath = Paths.get(valueOf(args, ++i, arg));
                    case "-x", "--context" -> options.contextPath = Paths.get(valueOf(args, ++i, arg));
                    default -> {
                        if (options.inputPath == null) {
                            options.inputPath = Paths.get(arg);
                        } else if (options.outputPath == null) {
                            options.outputPath = Paths.get(arg);
                        } else {
                            throw new IllegalArgumentException("Too many arguments");
                        }
                    }
                }
            }
            if (!options.help && options.inputPath == null) {
                throw new IllegalArgumentException("No input file specified");
            }
            return options;
        }

        private static String valueOf(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing argument for " + option);
            }
            return args[index];
        }

        private static Path contextFromProperty() {
            String context = System.getProperty("savigny.context");
            return context == null || context.isBlank() ? null : Paths.get(context);
        }
    }

    /**
     * Logs stage progress, used with {@code --verbose}.
     */
    static final class LoggingListener implements TranspilationListener {

        @Override
        public void onStageStart(String stageName, int stageNumber, int totalStages) {
            logger.info(String.format("[%d/%d] %s...", stageNumber, totalStages, stageName));
        }

        @Override
        public void onStageComplete(String stageName, StageResult result) {
            logger.info(String.format("%s completed in %d ms %s", stageName, result.durationMillis(), result.metrics()));
        }

        @Override
        public void onError(String stageName, Exception error) {
            logger.severe(String.format("%s failed: %s", stageName, error.getMessage()));
        }
    }
}
