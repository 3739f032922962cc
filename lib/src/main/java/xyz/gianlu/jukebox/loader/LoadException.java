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
import org.jetbrains.annotations.Nullable;

/**
 * A resolver failure, classified by how much of it can be shown to the user.
 *
 * @author devgianlu
 */
public class LoadException extends Exception {
    public final Severity severity;

    public LoadException(@NotNull String message, @NotNull Severity severity) {
        super(message);
        this.severity = severity;
    }

    public LoadException(@NotNull String message, @NotNull Severity severity, @Nullable Throwable cause) {
        super(message, cause);
        this.severity = severity;
    }

    public enum Severity {
        /**
         * Expected and understandable by the user, e.g. unsupported or unavailable content.
         */
        COMMON,
        /**
         * Possibly a problem on the resolver side.
         */
        SUSPICIOUS,
        /**
         * Certainly a bug or an unexpected condition.
         */
        FAULT
    }
}
