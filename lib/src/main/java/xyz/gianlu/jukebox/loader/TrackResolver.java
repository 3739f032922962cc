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

import java.util.concurrent.CompletionStage;

/**
 * Turns identifiers (URLs, search terms, playlist ids...) into playable items.
 *
 * @author devgianlu
 */
public interface TrackResolver {

    /**
     * Starts resolving the given identifier. The returned stage may complete on any thread, and may complete
     * exceptionally for unexpected faults.
     *
     * @param identifier The identifier to resolve
     * @return A stage completing exactly once with the outcome
     */
    @NotNull
    CompletionStage<ResolutionResult> resolve(@NotNull String identifier);
}
