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

/**
 * @author devgianlu
 */
public final class LoaderConfiguration {
    public static final int DEFAULT_QUEUE_TRACK_LIMIT = 10000;
    public static final int DEFAULT_ANNOUNCE_THRESHOLD = 50;

    // Limits
    public final int queueTrackLimit;
    public final int announceThreshold;

    // Replies
    public final boolean showBlockingWarning;
    public final LoaderMessages messages;

    private LoaderConfiguration(int queueTrackLimit, int announceThreshold, boolean showBlockingWarning, @NotNull LoaderMessages messages) {
        this.queueTrackLimit = queueTrackLimit;
        this.announceThreshold = announceThreshold;
        this.showBlockingWarning = showBlockingWarning;
        this.messages = messages;
    }

    public final static class Builder {
        // Limits
        private int queueTrackLimit = DEFAULT_QUEUE_TRACK_LIMIT;
        private int announceThreshold = DEFAULT_ANNOUNCE_THRESHOLD;

        // Replies
        private boolean showBlockingWarning = false;
        private LoaderMessages messages = LoaderMessages.defaults();

        public Builder() {
        }

        public Builder setQueueTrackLimit(int queueTrackLimit) {
            if (queueTrackLimit <= 0)
                throw new IllegalArgumentException("Invalid queue track limit: " + queueTrackLimit);

            this.queueTrackLimit = queueTrackLimit;
            return this;
        }

        public Builder setAnnounceThreshold(int announceThreshold) {
            if (announceThreshold < 0)
                throw new IllegalArgumentException("Invalid announce threshold: " + announceThreshold);

            this.announceThreshold = announceThreshold;
            return this;
        }

        public Builder setShowBlockingWarning(boolean showBlockingWarning) {
            this.showBlockingWarning = showBlockingWarning;
            return this;
        }

        public Builder setMessages(@NotNull LoaderMessages messages) {
            this.messages = messages;
            return this;
        }

        @Contract(value = " -> new", pure = true)
        public @NotNull LoaderConfiguration build() {
            return new LoaderConfiguration(queueTrackLimit, announceThreshold, showBlockingWarning, messages);
        }
    }
}
