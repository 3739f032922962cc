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

package xyz.gianlu.jukebox.playable;

import org.jetbrains.annotations.NotNull;

/**
 * A resolved item that the playback engine knows how to play.
 *
 * @author devgianlu
 */
public interface Playable {

    /**
     * @return The identifier the item was resolved from, or a stable identifier for it
     */
    @NotNull
    String identifier();

    @NotNull
    String title();

    /**
     * @return The total duration in milliseconds, meaningless for streams
     */
    long durationMillis();

    boolean isStream();
}
