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

public final class TestPlayable implements Playable {
    private final String id;
    private final long duration;
    private final boolean stream;

    public TestPlayable(@NotNull String id, long duration, boolean stream) {
        this.id = id;
        this.duration = duration;
        this.stream = stream;
    }

    public TestPlayable(@NotNull String id) {
        this(id, 180_000, false);
    }

    @Override
    public @NotNull String identifier() {
        return id;
    }

    @Override
    public @NotNull String title() {
        return "Title of " + id;
    }

    @Override
    public long durationMillis() {
        return duration;
    }

    @Override
    public boolean isStream() {
        return stream;
    }

    @Override
    public String toString() {
        return id;
    }
}
