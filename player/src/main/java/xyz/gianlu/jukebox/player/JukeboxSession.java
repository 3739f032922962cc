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

package xyz.gianlu.jukebox.player;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.loader.FailureReporter;
import xyz.gianlu.jukebox.loader.LoadRequest;
import xyz.gianlu.jukebox.loader.LoaderConfiguration;
import xyz.gianlu.jukebox.loader.RateLimiter;
import xyz.gianlu.jukebox.loader.ReplySink;
import xyz.gianlu.jukebox.loader.TrackLoader;
import xyz.gianlu.jukebox.playable.Requester;
import xyz.gianlu.jukebox.player.catalog.Catalog;
import xyz.gianlu.jukebox.player.catalog.CatalogResolver;
import xyz.gianlu.jukebox.player.catalog.WindowRateLimiter;
import xyz.gianlu.jukebox.queue.FairTrackQueue;
import xyz.gianlu.jukebox.queue.QueuedTrack;
import xyz.gianlu.jukebox.queue.TrackQueue;

import java.io.Closeable;

/**
 * Wires a queue, a player and a loader together for a single jukebox.
 *
 * @author devgianlu
 */
public final class JukeboxSession implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JukeboxSession.class);
    private final TrackQueue queue;
    private final SimulatedPlayer player;
    private final CatalogResolver resolver;
    private final TrackLoader loader;

    public JukeboxSession(@NotNull FileConfiguration conf, @NotNull Catalog catalog) {
        this(conf.toLoader(), catalog, new WindowRateLimiter(catalog, conf.toRateLimiter()), conf.timeScale(), conf.startPaused());
    }

    public JukeboxSession(@NotNull LoaderConfiguration conf, @NotNull Catalog catalog, @NotNull RateLimiter rateLimiter,
                          double timeScale, boolean startPaused) {
        this.queue = new FairTrackQueue();
        this.player = new SimulatedPlayer(queue, timeScale, startPaused);
        this.resolver = new CatalogResolver(catalog);
        this.loader = new TrackLoader(conf, queue, player, resolver, rateLimiter, FailureReporter.LOGGING);

        LOGGER.info("Jukebox ready with {} tracks in catalog.", catalog.size());
    }

    @NotNull
    public TrackQueue queue() {
        return queue;
    }

    @NotNull
    public SimulatedPlayer player() {
        return player;
    }

    @NotNull
    public TrackLoader loader() {
        return loader;
    }

    public boolean load(@NotNull Requester requester, @NotNull String identifier, @NotNull ReplySink sink, boolean priority, boolean quiet) {
        LoadRequest request = LoadRequest.newBuilder(identifier, requester, sink)
                .setPriority(priority)
                .setQuiet(quiet)
                .build();

        return loader.submit(request);
    }

    public void clear() {
        queue.clear();
        player.stop();
    }

    @NotNull
    public JsonObject status() {
        JsonObject obj = new JsonObject();
        obj.addProperty("playing", player.isPlaying());
        obj.addProperty("paused", player.isPaused());

        QueuedTrack current = player.current();
        if (current != null) {
            JsonObject track = new JsonObject();
            track.addProperty("id", current.playable.identifier());
            track.addProperty("title", current.playable.title());
            track.addProperty("user", current.userId);
            track.addProperty("position", player.position());
            obj.add("current", track);
        }

        obj.addProperty("queueSize", queue.size());
        obj.addProperty("queueDuration", queue.durationMillis());
        obj.addProperty("streams", queue.streamsCount());
        obj.addProperty("shuffle", queue.isShuffle());
        obj.addProperty("repeat", queue.repeatMode().name());
        obj.addProperty("loading", loader.isLoading());
        obj.addProperty("pending", loader.pendingCount());
        obj.add("loader", loader.metrics().toJson());
        return obj;
    }

    @Override
    public void close() {
        player.close();
        resolver.close();
        LOGGER.info("Jukebox closed.");
    }
}
