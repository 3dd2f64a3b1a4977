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

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Results go to stdout, logging to stderr. A run that fails
 * prints nothing to stdout and exits with status 1.
 */
public class BigCsv {

    private static final Logger LOG = LoggerFactory.getLogger(BigCsv.class);

    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        }
        catch (IllegalArgumentException e) {
            err.println("bigcsv: " + e.getMessage());
            err.println(Arguments.usage());
            return 2;
        }
        if (arguments.help()) {
            out.println(Arguments.usage());
            return 0;
        }

        try (LineSource source = arguments.input() == null ? ReaderLineSource.of(in) : ReaderLineSource.of(arguments.input())) {
            ReportWriter report = new ReportWriter(out, arguments.format());
            switch (arguments.command()) {
                case PROFILE -> report.writeProfile(new ColumnProfiler(arguments.options()).profile(source));
                case SPLIT -> split(arguments, source, report);
                case SUMMARIZE -> summarize(arguments, source, report);
            }
            return 0;
        }
        catch (IOException | ProfilingException e) {
            LOG.error("[BIGCSV] {} failed", arguments.command(), e);
            err.println("bigcsv: " + e.getMessage());
            return 1;
        }
    }

    private static void split(Arguments arguments, LineSource source, ReportWriter report) throws IOException {
        ColumnFiles files = new ColumnFiles(arguments.outputDirOrDefault());
        SplitResult result = new ColumnSplitter(arguments.options()).split(source, files);
        report.writeSplit(result, files);
    }

    private static void summarize(Arguments arguments, LineSource source, ReportWriter report) throws IOException {
        boolean temporary = arguments.outputDir() == null;
        Path directory = temporary ? Files.createTempDirectory("bigcsv-") : arguments.outputDir();
        ColumnFiles files = new ColumnFiles(directory);
        try {
            SplitResult result = new ColumnSplitter(arguments.options()).split(source, files);
            List<ColumnFileSummary> summaries = new ColumnFileSummarizer(arguments.options().workerCount())
                    .summarize(result.header(), files.paths());
            report.writeSummaries(result.histogram(), summaries);
        }
        finally {
            if (!arguments.keepFiles()) {
                files.delete();
                if (temporary) {
                    Files.deleteIfExists(directory);
                }
            }
        }
    }
}
