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

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of what happened to the requests of a {@link TrackLoader}.
 *
 * @author devgianlu
 */
public final class LoaderMetrics {
    final AtomicLong tracksLoaded = new AtomicLong();
    final AtomicLong loadsFailed = new AtomicLong();
    final AtomicLong noMatches = new AtomicLong();
    final AtomicLong rateLimited = new AtomicLong();
    final AtomicLong overQueueLimit = new AtomicLong();

    LoaderMetrics() {
    }

    /**
     * @return The number of tracks added to the queue, counting every item of a collection
     */
    public long tracksLoaded() {
        return tracksLoaded.get();
    }

    public long loadsFailed() {
        return loadsFailed.get();
    }

    public long noMatches() {
        return noMatches.get();
    }

    public long rateLimited() {
        return rateLimited.get();
    }

    public long overQueueLimit() {
        return overQueueLimit.get();
    }

    @NotNull
    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("tracksLoaded", tracksLoaded.get());
        obj.addProperty("loadsFailed", loadsFailed.get());
        obj.addProperty("noMatches", noMatches.get());
        obj.addProperty("rateLimited", rateLimited.get());
        obj.addProperty("overQueueLimit", overQueueLimit.get());
        return obj;
    }
}
