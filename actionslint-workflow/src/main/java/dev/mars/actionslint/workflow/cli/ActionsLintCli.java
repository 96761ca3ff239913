/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.actionslint.workflow.cli;

import dev.mars.actionslint.config.LintConfiguration;
import dev.mars.actionslint.core.LintResult;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.WorkflowFiles;
import dev.mars.actionslint.workflow.WorkflowLintException;
import dev.mars.actionslint.workflow.WorkflowLinter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command Line Interface for Actions Lint.
 * Lints the workflow files of a repository and prints one line per problem.
 *
 * <p>Exit status: 0 when every file is successful, 1 when problems fail the run, 2 on usage or
 * I/O errors.</p>
 */
public class ActionsLintCli {

    static final int EXIT_OK = 0;
    static final int EXIT_PROBLEMS = 1;
    static final int EXIT_ERROR = 2;

    private final LintConfiguration configuration;
    private final PrintStream out;
    private final PrintStream err;

    public ActionsLintCli(LintConfiguration configuration, PrintStream out, PrintStream err) {
        this.configuration = configuration;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(execute(args, new LintConfiguration(), System.out, System.err));
    }

    /**
     * Parses {@code args} into {@code configuration} and runs the linter.
     */
    static int execute(String[] args, LintConfiguration configuration, PrintStream out, PrintStream err) {
        String target = null;

        // Parse command line arguments
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--fix":
                    configuration.setProperty(LintConfiguration.FIX_ENABLED, "true");
                    break;
                case "--max-warnings":
                    if (i + 1 < args.length) {
                        configuration.setProperty(LintConfiguration.MAX_WARNINGS, args[++i]);
                    }
                    break;
                case "--parallel":
                    configuration.setProperty(LintConfiguration.RULES_PARALLEL, "true");
                    break;
                case "--metadata":
                    configuration.setProperty(LintConfiguration.METADATA_ENABLED, "true");
                    break;
                case "--help":
                case "-h":
                    printUsage(out);
                    return EXIT_OK;
                default:
                    if (args[i].startsWith("-")) {
                        err.println("Unknown option: " + args[i]);
                        printUsage(err);
                        return EXIT_ERROR;
                    }
                    target = args[i];
            }
        }

        Path path = target != null ? Paths.get(target) : Paths.get(".");
        return new ActionsLintCli(configuration, out, err).run(path);
    }

    public int run(Path target) {
        List<Path> files;
        try {
            files = WorkflowFiles.discover(target);
        } catch (WorkflowLintException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        if (files.isEmpty()) {
            out.println("No workflow files found in " + target);
            return EXIT_OK;
        }

        int maxWarnings = configuration.getMaxWarnings();
        boolean successful = true;
        try (WorkflowLinter linter = new WorkflowLinter(configuration)) {
            for (Path file : files) {
                LintResult result = linter.lint(file);
                if (configuration.isFixEnabled() && linter.writeFixes(file, result)) {
                    out.println(file + ": applied " + result.getFixedProblems().size() + " fix(es)");
                }
                for (Problem problem : result.getRemainingProblems()) {
                    out.println(format(file, problem));
                }
                successful &= result.isSuccessful(maxWarnings);
            }
        } catch (WorkflowLintException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        return successful ? EXIT_OK : EXIT_PROBLEMS;
    }

    static String format(Path file, Problem problem) {
        return file + ":" + problem.getPos().displayLine() + ":" + problem.getPos().displayColumn() + ": "
                + problem.getSeverity().getLabel() + ": " + problem.getMessage() + " [" + problem.getRuleId() + "]";
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: actionslint [options] [path]");
        stream.println("  path                  - Workflow file, workflow directory or repository root (default: .)");
        stream.println("  --fix                 - Apply available fixes to the workflow files");
        stream.println("  --max-warnings <n>    - Fail when more than n warnings remain");
        stream.println("  --parallel            - Run rules in parallel");
        stream.println("  --metadata            - Look up action metadata on GitHub");
        stream.println("  -h, --help            - Show this help message");
    }
}
