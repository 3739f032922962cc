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

import java.util.Optional;

/**
 * Decides whether slow loading collections (big imported playlists and the like) may be loaded.
 *
 * @author devgianlu
 */
public interface RateLimiter {
    RateLimiter NONE = new RateLimiter() {
        @Override
        public @NotNull Optional<CollectionInfo> collectionMetadata(@NotNull String identifier) {
            return Optional.empty();
        }

        @Override
        public boolean isRateLimited(@NotNull LoadRequest request, @NotNull CollectionInfo info, int itemCount) {
            return false;
        }
    };

    /**
     * @return Some data about the collection if {@code identifier} refers to a slow loading one, empty otherwise
     */
    @NotNull
    Optional<CollectionInfo> collectionMetadata(@NotNull String identifier);

    boolean isRateLimited(@NotNull LoadRequest request, @NotNull CollectionInfo info, int itemCount);

    final class CollectionInfo {
        public final String name;
        public final int totalItems;

        public CollectionInfo(@NotNull String name, int totalItems) {
            this.name = name;
            this.totalItems = totalItems;
        }

        @Override
        public String toString() {
            return "CollectionInfo{name='" + name + "', totalItems=" + totalItems + "}";
        }
    }
}
