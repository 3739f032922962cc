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

import java.util.EnumMap;
import java.util.Map;

/**
 * The texts sent back to requesters, as {@link String#format(String, Object...)} patterns.
 *
 * @author devgianlu
 */
public final class LoaderMessages {
    private final Map<Key, String> patterns;

    private LoaderMessages(@NotNull Map<Key, String> patterns) {
        this.patterns = patterns;
    }

    @NotNull
    public static LoaderMessages defaults() {
        return new Builder().build();
    }

    @NotNull
    public String format(@NotNull Key key, Object... args) {
        return String.format(patterns.get(key), args);
    }

    public enum Key {
        /**
         * Title
         */
        SINGLE_TRACK("**%s** has been added to the queue."),
        /**
         * Title
         */
        SINGLE_TRACK_FIRST("**%s** has been added to the top of the queue."),
        /**
         * Title
         */
        SINGLE_TRACK_AND_PLAY("**%s** will now play."),
        /**
         * Count, collection name
         */
        LIST_SUCCESS("Found and added `%d` songs from playlist **%s**."),
        /**
         * Identifier
         */
        NO_MATCHES("No audio could be found for `%s`."),
        /**
         * Identifier, resolver message
         */
        ERROR_COMMON("Error occurred when loading info for `%s`:\n%s"),
        /**
         * Identifier
         */
        ERROR_SUSPICIOUS("Suspicious error when loading info for `%s`."),
        /**
         * Identifier
         */
        ERROR_BLOCKED("Error occurred when loading info for `%s`.\nThis may be the source blocking us, try again later."),
        ERROR_GENERIC("Something went wrong while loading, sorry about that."),
        /**
         * Limit
         */
        QUEUE_TRACK_LIMIT("You can't add tracks to a queue with more than %d tracks! This is to prevent abuse."),
        /**
         * Collection name
         */
        RATE_LIMITED("You are loading playlists too fast, please wait before loading **%s**."),
        /**
         * Collection name, item count
         */
        ANNOUNCE_COLLECTION("Downloading playlist **%s** with up to `%d` tracks. This may take a while, please be patient.");

        private final String defaultPattern;

        Key(@NotNull String defaultPattern) {
            this.defaultPattern = defaultPattern;
        }
    }

    public final static class Builder {
        private final Map<Key, String> patterns = new EnumMap<>(Key.class);

        public Builder() {
            for (Key key : Key.values()) patterns.put(key, key.defaultPattern);
        }

        public Builder set(@NotNull Key key, @NotNull String pattern) {
            patterns.put(key, pattern);
            return this;
        }

        @NotNull
        public LoaderMessages build() {
            return new LoaderMessages(new EnumMap<>(patterns));
        }
    }
}
