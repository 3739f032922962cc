/*
 * Copyright 2022 devgianlu
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

package xyz.gianlu.jukebox.loader;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator facing channel for failures the user only gets an apology for.
 *
 * @author devgianlu
 */
public interface FailureReporter {
    FailureReporter LOGGING = new FailureReporter() {
        private final Logger LOGGER = LoggerFactory.getLogger(FailureReporter.class);

        @Override
        public void report(@NotNull String message, @NotNull Throwable ex, @NotNull LoadRequest request) {
            LOGGER.error("{} {identifier: '{}', requester: {}}", message, request.identifier, request.requester, ex);
        }
    };

    void report(@NotNull String message, @NotNull Throwable ex, @NotNull LoadRequest request);
}
