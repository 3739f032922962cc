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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author devgianlu
 */
class CatalogTest {
    static final String JSON = "{\"tracks\": [" +
            "{\"id\": \"t1\", \"title\": \"Song One\", \"duration\": 180000}," +
            "{\"id\": \"t2\", \"title\": \"Another Song\", \"duration\": 200000}," +
            "{\"id\": \"t3\", \"title\": \"Live Radio\", \"stream\": true}]," +
            "\"collections\": [" +
            "{\"id\": \"mix\", \"name\": \"Mix\", \"tracks\": [\"t1\", \"t2\"]}," +
            "{\"id\": \"big\", \"name\": \"Big Mix\", \"slow\": true, \"tracks\": [\"t1\", \"missing\", \"t2\", \"t3\"]}]}";

    static Catalog sample() throws IOException {
        return Catalog.parse(new StringReader(JSON));
    }

    @Test
    void parsesTracks() throws IOException {
        Catalog catalog = sample();
        assertEquals(3, catalog.size());

        Catalog.Track track = catalog.track("t1").orElseThrow(AssertionError::new);
        assertEquals("Song One", track.title());
        assertEquals(180000, track.durationMillis());
        assertFalse(track.isStream());

        assertTrue(catalog.track("t3").orElseThrow(AssertionError::new).isStream());
        assertFalse(catalog.track("t4").isPresent());
    }

    @Test
    void parsesCollections() throws IOException {
        Catalog catalog = sample();

        Catalog.Collection mix = catalog.collection("mix").orElseThrow(AssertionError::new);
        assertEquals("Mix", mix.name);
        assertFalse(mix.slow);
        assertEquals(2, mix.tracks.size());

        Catalog.Collection big = catalog.collection("big").orElseThrow(AssertionError::new);
        assertTrue(big.slow);
        assertEquals(3, big.tracks.size(), "Unknown references are skipped");
        assertEquals("t1", big.first().id);
    }

    @Test
    void searchIgnoresCase() throws IOException {
        Catalog catalog = sample();
        assertEquals("t2", catalog.search("another").orElseThrow(AssertionError::new).id);
        assertEquals("t1", catalog.search("SONG").orElseThrow(AssertionError::new).id);
        assertFalse(catalog.search("nothing").isPresent());
        assertFalse(catalog.search("  ").isPresent());
    }

    @Test
    void invalidJson() {
        assertThrows(IOException.class, () -> Catalog.parse(new StringReader("[1, 2")));
        assertThrows(IOException.class, () -> Catalog.parse(new StringReader("\"just a string\"")));
    }
}
