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

package xyz.gianlu.jukebox.player.catalog;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.loader.LoadRequest;
import xyz.gianlu.jukebox.loader.RateLimiter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Limits how many slow collections each requester can load in a sliding time window, and how big they can be.
 *
 * @author devgianlu
 */
public final class WindowRateLimiter implements RateLimiter {
    private static final Logger LOGGER = LoggerFactory.getLogger(WindowRateLimiter.class);
    private final Catalog catalog;
    private final Configuration conf;
    private final LongSupplier clock;
    private final Map<Long, Deque<Long>> history = new HashMap<>();

    public WindowRateLimiter(@NotNull Catalog catalog, @NotNull Configuration conf) {
        this(catalog, conf, System::currentTimeMillis);
    }

    WindowRateLimiter(@NotNull Catalog catalog, @NotNull Configuration conf, @NotNull LongSupplier clock) {
        this.catalog = catalog;
        this.conf = conf;
        this.clock = clock;
    }

    @Override
    public @NotNull Optional<CollectionInfo> collectionMetadata(@NotNull String identifier) {
        return catalog.collection(identifier)
                .filter(collection -> collection.slow)
                .map(collection -> new CollectionInfo(collection.name, collection.tracks.size()));
    }

    @Override
    public synchronized boolean isRateLimited(@NotNull LoadRequest request, @NotNull CollectionInfo info, int itemCount) {
        if (!conf.enabled) return false;

        if (itemCount > conf.maxCollectionItems) {
            LOGGER.debug("{} requested {} with {} items, over the limit of {}.", request.requester, info.name, itemCount, conf.maxCollectionItems);
            return true;
        }

        long now = clock.getAsLong();
        evictExpired(now);

        Deque<Long> times = history.computeIfAbsent(request.requester.id, id -> new ArrayDeque<>());

        if (times.size() >= conf.maxRequests) {
            LOGGER.debug("{} hit the rate limit loading {}.", request.requester, info.name);
            return true;
        }

        times.addLast(now);
        return false;
    }

    /**
     * Drops the loads that left the window, and the requesters left with none.
     */
    private void evictExpired(long now) {
        Iterator<Deque<Long>> iter = history.values().iterator();
        while (iter.hasNext()) {
            Deque<Long> times = iter.next();
            while (!times.isEmpty() && now - times.peekFirst() >= conf.windowMillis)
                times.pollFirst();

            if (times.isEmpty()) iter.remove();
        }
    }

    synchronized int trackedRequesters() {
        return history.size();
    }

    public final static class Configuration {
        public final boolean enabled;
        public final int maxRequests;
        public final long windowMillis;
        public final int maxCollectionItems;

        private Configuration(boolean enabled, int maxRequests, long windowMillis, int maxCollectionItems) {
            this.enabled = enabled;
            this.maxRequests = maxRequests;
            this.windowMillis = windowMillis;
            this.maxCollectionItems = maxCollectionItems;
        }

        public final static class Builder {
            private boolean enabled = true;
            private int maxRequests = 2;
            private long windowMillis = 60_000;
            private int maxCollectionItems = 5000;

            public Builder() {
            }

            public Builder setEnabled(boolean enabled) {
                this.enabled = enabled;
                return this;
            }

            public Builder setMaxRequests(int maxRequests) {
                if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
                this.maxRequests = maxRequests;
                return this;
            }

            public Builder setWindowSeconds(int windowSeconds) {
                if (windowSeconds < 1) throw new IllegalArgumentException("windowSeconds must be positive: " + windowSeconds);
                this.windowMillis = windowSeconds * 1000L;
                return this;
            }

            public Builder setMaxCollectionItems(int maxCollectionItems) {
                if (maxCollectionItems < 0) throw new IllegalArgumentException("maxCollectionItems can't be negative: " + maxCollectionItems);
                this.maxCollectionItems = maxCollectionItems;
                return this;
            }

            @Contract(value = " -> new", pure = true)
            public @NotNull Configuration build() {
                return new Configuration(enabled, maxRequests, windowMillis, maxCollectionItems);
            }
        }
    }
}
