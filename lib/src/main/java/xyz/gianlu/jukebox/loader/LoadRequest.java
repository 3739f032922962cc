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

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import xyz.gianlu.jukebox.playable.Requester;

/**
 * Something a user asked to be played, waiting to be resolved by the {@link TrackLoader}.
 *
 * @author devgianlu
 */
public final class LoadRequest {
    public final String identifier;
    public final Requester requester;
    public final boolean priority;
    public final boolean quiet;
    public final long position;
    private final ReplySink sink;

    private LoadRequest(@NotNull String identifier, @NotNull Requester requester, boolean priority, boolean quiet, long position, @NotNull ReplySink sink) {
        this.identifier = identifier;
        this.requester = requester;
        this.priority = priority;
        this.quiet = quiet;
        this.position = position;
        this.sink = sink;
    }

    @NotNull
    public static Builder newBuilder(@NotNull String identifier, @NotNull Requester requester, @NotNull ReplySink sink) {
        return new Builder(identifier, requester, sink);
    }

    public void reply(@NotNull String text) {
        sink.reply(text);
    }

    public void replyWithName(@NotNull String text) {
        sink.replyWithName(text);
    }

    @Override
    public String toString() {
        return "LoadRequest{identifier='" + identifier + "', requester=" + requester.id
                + ", priority=" + priority + ", quiet=" + quiet + ", position=" + position + "}";
    }

    public final static class Builder {
        private final String identifier;
        private final Requester requester;
        private final ReplySink sink;
        private boolean priority = false;
        private boolean quiet = false;
        private long position = 0;

        private Builder(@NotNull String identifier, @NotNull Requester requester, @NotNull ReplySink sink) {
            this.identifier = identifier;
            this.requester = requester;
            this.sink = sink;
        }

        public Builder setPriority(boolean priority) {
            this.priority = priority;
            return this;
        }

        public Builder setQuiet(boolean quiet) {
            this.quiet = quiet;
            return this;
        }

        public Builder setPosition(long position) {
            if (position < 0)
                throw new IllegalArgumentException("Invalid position: " + position);

            this.position = position;
            return this;
        }

        @Contract(value = " -> new", pure = true)
        public @NotNull LoadRequest build() {
            return new LoadRequest(identifier, requester, priority, quiet, position, sink);
        }
    }
}
