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

package dev.mars.actionslint.workflow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates workflow files to lint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowFiles {

    private static final Logger logger = Logger.getLogger(WorkflowFiles.class.getName());

    private static final Path DEFAULT_DIRECTORY = Path.of(".github", "workflows");

    private WorkflowFiles() {
    }

    /**
     * Finds the workflow files designated by {@code target}.
     *
     * <p>A regular file is returned as is. For a directory containing {@code .github/workflows}
     * that directory is searched, otherwise the directory itself. Only {@code *.yml} and
     * {@code *.yaml} files directly inside the searched directory are returned, sorted by name.</p>
     *
     * @param target file or directory
     * @return the workflow files, possibly empty
     * @throws WorkflowLintException if the target does not exist or cannot be listed
     */
    public static List<Path> discover(Path target) throws WorkflowLintException {
        if (Files.isRegularFile(target)) {
            return List.of(target);
        }
        if (!Files.isDirectory(target)) {
            throw new WorkflowLintException(target, "Workflow path does not exist", null);
        }
        Path directory = Files.isDirectory(target.resolve(DEFAULT_DIRECTORY))
                ? target.resolve(DEFAULT_DIRECTORY)
                : target;
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> files = entries
                    .filter(Files::isRegularFile)
                    .filter(WorkflowFiles::isWorkflowFile)
                    .sorted()
                    .collect(Collectors.toList());
            logger.fine("Found " + files.size() + " workflow file(s) in " + directory);
            return files;
        } catch (IOException e) {
            throw new WorkflowLintException(directory, "Failed to list workflow directory", e);
        }
    }

    static boolean isWorkflowFile(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }
}
