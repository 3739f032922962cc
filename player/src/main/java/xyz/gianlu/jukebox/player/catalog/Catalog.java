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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.playable.Playable;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * A local, JSON described, library of tracks and collections of tracks.
 *
 * <pre>
 * {
 *   "tracks": [{"id": "t1", "title": "Song", "duration": 180000, "stream": false}],
 *   "collections": [{"id": "mix", "name": "Mix", "slow": true, "tracks": ["t1"]}]
 * }
 * </pre>
 *
 * @author devgianlu
 */
public final class Catalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(Catalog.class);
    private final Map<String, Track> tracks;
    private final Map<String, Collection> collections;

    private Catalog(@NotNull Map<String, Track> tracks, @NotNull Map<String, Collection> collections) {
        this.tracks = tracks;
        this.collections = collections;
    }

    @NotNull
    public static Catalog empty() {
        return new Catalog(Collections.emptyMap(), Collections.emptyMap());
    }

    @NotNull
    public static Catalog load(@NotNull File file) throws IOException {
        try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    @NotNull
    public static Catalog parse(@NotNull Reader reader) throws IOException {
        JsonObject obj;
        try {
            obj = JsonParser.parseReader(reader).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException ex) {
            throw new IOException("Invalid catalog!", ex);
        }

        Map<String, Track> tracks = new LinkedHashMap<>();
        JsonArray tracksArray = obj.has("tracks") ? obj.getAsJsonArray("tracks") : new JsonArray();
        for (JsonElement elm : tracksArray) {
            JsonObject track = elm.getAsJsonObject();
            String id = track.get("id").getAsString();
            String title = track.has("title") ? track.get("title").getAsString() : id;
            long duration = track.has("duration") ? track.get("duration").getAsLong() : 0;
            boolean stream = track.has("stream") && track.get("stream").getAsBoolean();
            if (tracks.put(id, new Track(id, title, duration, stream)) != null)
                LOGGER.warn("Duplicated track in catalog: {}", id);
        }

        Map<String, Collection> collections = new LinkedHashMap<>();
        JsonArray collectionsArray = obj.has("collections") ? obj.getAsJsonArray("collections") : new JsonArray();
        for (JsonElement elm : collectionsArray) {
            JsonObject collection = elm.getAsJsonObject();
            String id = collection.get("id").getAsString();
            String name = collection.has("name") ? collection.get("name").getAsString() : id;
            boolean slow = collection.has("slow") && collection.get("slow").getAsBoolean();

            List<Track> items = new ArrayList<>();
            for (JsonElement ref : collection.getAsJsonArray("tracks")) {
                Track track = tracks.get(ref.getAsString());
                if (track == null) LOGGER.warn("Collection {} references unknown track {}.", id, ref.getAsString());
                else items.add(track);
            }

            collections.put(id, new Collection(id, name, slow, items));
        }

        LOGGER.debug("Loaded catalog with {} tracks and {} collections.", tracks.size(), collections.size());
        return new Catalog(tracks, collections);
    }

    @NotNull
    public Optional<Track> track(@NotNull String id) {
        return Optional.ofNullable(tracks.get(id));
    }

    @NotNull
    public Optional<Collection> collection(@NotNull String id) {
        return Optional.ofNullable(collections.get(id));
    }

    /**
     * @return The first track whose title contains {@code term}, ignoring case
     */
    @NotNull
    public Optional<Track> search(@NotNull String term) {
        String lower = term.trim().toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) return Optional.empty();

        for (Track track : tracks.values())
            if (track.title.toLowerCase(Locale.ROOT).contains(lower))
                return Optional.of(track);

        return Optional.empty();
    }

    public int size() {
        return tracks.size();
    }

    public static final class Track implements Playable {
        public final String id;
        public final String title;
        public final long duration;
        public final boolean stream;

        Track(@NotNull String id, @NotNull String title, long duration, boolean stream) {
            this.id = id;
            this.title = title;
            this.duration = duration;
            this.stream = stream;
        }

        @Override
        public @NotNull String identifier() {
            return id;
        }

        @Override
        public @NotNull String title() {
            return title;
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
            return "Track{id='" + id + "', title='" + title + "'}";
        }
    }

    public static final class Collection {
        public final String id;
        public final String name;
        public final boolean slow;
        public final List<Track> tracks;

        Collection(@NotNull String id, @NotNull String name, boolean slow, @NotNull List<Track> tracks) {
            this.id = id;
            this.name = name;
            this.slow = slow;
            this.tracks = Collections.unmodifiableList(tracks);
        }

        @Nullable
        public Track first() {
            return tracks.isEmpty() ? null : tracks.get(0);
        }
    }
}
