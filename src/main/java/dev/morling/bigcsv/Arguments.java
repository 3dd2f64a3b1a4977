/*
 *  Copyright 2023 The original authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package dev.morling.bigcsv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

/**
 * Command line of {@link BigCsv}: {@code [profile|split|summarize] [--option=value ...] [file]}.
 * Without a file the input is read from stdin.
 */
public final class Arguments {

    public enum Command {
        PROFILE,
        SPLIT,
        SUMMARIZE
    }

    private static final Path DEFAULT_OUTPUT_DIR = Paths.get("./columns");

    private final Command command;
    private final Path input;
    private final Path outputDir;
    private final ProfilerOptions options;
    private final ReportWriter.Format format;
    private final boolean keepFiles;
    private final boolean help;

    private Arguments(Command command, Path input, Path outputDir, ProfilerOptions options, ReportWriter.Format format, boolean keepFiles,
                      boolean help) {
        this.command = command;
        this.input = input;
        this.outputDir = outputDir;
        this.options = options;
        this.format = format;
        this.keepFiles = keepFiles;
        this.help = help;
    }

    public static Arguments parse(String[] args) {
        Command command = Command.PROFILE;
        Path input = null;
        Path outputDir = null;
        ReportWriter.Format format = ReportWriter.Format.JSON;
        boolean keepFiles = false;
        boolean help = false;
        ProfilerOptions.Builder options = ProfilerOptions.builder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i == 0 && !arg.startsWith("-") && isCommand(arg)) {
                command = Command.valueOf(arg.toUpperCase(Locale.ROOT));
            }
            else if (arg.equals("-h") || arg.equals("--help")) {
                help = true;
            }
            else if (arg.equals("--keep-files")) {
                keepFiles = true;
            }
            else if (arg.equals("--sequential-split")) {
                options.sequentialSplit(true);
            }
            else if (arg.startsWith("--")) {
                int eq = arg.indexOf('=');
                if (eq < 0) {
                    throw new IllegalArgumentException("Option " + arg + " needs a value, e.g. " + arg + "=...");
                }
                String name = arg.substring(2, eq);
                String value = arg.substring(eq + 1);
                switch (name) {
                    case "delimiter" -> options.delimiter(delimiter(value));
                    case "workers" -> options.workerCount(number(name, value));
                    case "batch-size" -> options.batchSize(number(name, value));
                    case "queue-capacity" -> options.queueCapacity(number(name, value));
                    case "average" -> options.averageBasis(AverageBasis.parse(value));
                    case "stats" -> options.statistics(ColumnStatistic.parseList(value));
                    case "timeout" -> options.timeout(Duration.ofSeconds(number(name, value)));
                    case "output-dir" -> outputDir = Paths.get(value);
                    case "format" -> format = ReportWriter.Format.parse(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + name);
                }
            }
            else if (input == null) {
                input = Paths.get(arg);
            }
            else {
                throw new IllegalArgumentException("Unexpected argument '" + arg + "', only one input file is supported");
            }
        }

        return new Arguments(command, input, outputDir, options.build(), format, keepFiles, help);
    }

    private static boolean isCommand(String arg) {
        for (Command command : Command.values()) {
            if (command.name().equalsIgnoreCase(arg)) {
                return true;
            }
        }
        return false;
    }

    private static char delimiter(String value) {
        if (value.equals("\\t") || value.equalsIgnoreCase("tab")) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character: '" + value + "'");
        }
        return value.charAt(0);
    }

    private static int number(String name, String value) {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number: '" + value + "'", e);
        }
    }

    public static String usage() {
        return """
                Usage: bigcsv [profile|split|summarize] [options] [file]
                  profile     row-length histogram and per-column fill count and value lengths (default)
                  split       write every column to <output-dir>/col-<index>.txt
                  summarize   split, then summarize every column file
                Options:
                  --delimiter=<char>        field delimiter, default '|' ('tab' for tabs)
                  --workers=<n>             profiling worker threads, default $BIGCSV_WORKERS or the number of cores
                                            (splitting always runs one writer per column)
                  --batch-size=<n>          rows per queued batch, default 10000
                  --queue-capacity=<n>      batches queued per column when splitting, 0 = unbounded, default 16
                  --average=all|matching    rows to average value lengths over, default all
                  --stats=fill,min,max,avg  statistics to track, default all
                  --timeout=<seconds>       abort the run after this many seconds
                  --output-dir=<dir>        column file directory, default ./columns (summarize: a temporary directory)
                  --format=json|text        output format, default json
                  --sequential-split        split: write all columns on the calling thread
                  --keep-files              summarize: keep the column files""";
    }

    public Command command() {
        return command;
    }

    /**
     * @return the input file, or {@code null} for stdin
     */
    public Path input() {
        return input;
    }

    /**
     * @return the configured output directory, or {@code null} if none was given
     */
    public Path outputDir() {
        return outputDir;
    }

    public Path outputDirOrDefault() {
        return outputDir != null ? outputDir : DEFAULT_OUTPUT_DIR;
    }

    public ProfilerOptions options() {
        return options;
    }

    public ReportWriter.Format format() {
        return format;
    }

    public boolean keepFiles() {
        return keepFiles;
    }

    public boolean help() {
        return help;
    }
}
