package io.mrimate.command.common;

/*
 * Copyright (c) mrimate
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import picocli.CommandLine;

import java.util.Optional;

/**
 * Options controlling how many threads assemble images.
 * Each image type is assembled by its own task, so more threads than image types do not help.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Assemble image types in parallel (auto-sizes based on available CPU cores)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of assembly threads, overriding the config file"
    )
    private Integer explicitThreads;

    /**
     * Gets the thread count these options ask for, if they ask for one.
     * An explicit {@code --threads} wins over {@code --parallel}, which uses all but one core.
     *
     * @return the requested thread count, or empty to keep the configured one
     */
    public Optional<Integer> getRequestedThreads() {
        if (explicitThreads != null) {
            return Optional.of(Math.max(1, explicitThreads));
        }
        if (parallel) {
            return Optional.of(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        }
        return Optional.empty();
    }
}
