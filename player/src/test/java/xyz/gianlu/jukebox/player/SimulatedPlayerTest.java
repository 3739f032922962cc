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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.gianlu.jukebox.player.catalog.Catalog;
import xyz.gianlu.jukebox.queue.FairTrackQueue;
import xyz.gianlu.jukebox.queue.QueuedTrack;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author devgianlu
 */
class SimulatedPlayerTest {
    private final FairTrackQueue queue = new FairTrackQueue();
    private Catalog catalog;
    private SimulatedPlayer player;

    @BeforeEach
    void setUp() throws IOException {
        catalog = Catalog.parse(new StringReader("{\"tracks\": [" +
                "{\"id\": \"a\", \"duration\": 600000}," +
                "{\"id\": \"b\", \"duration\": 600000}," +
                "{\"id\": \"short\", \"duration\": 50}]}"));
    }

    @AfterEach
    void tearDown() {
        if (player != null) player.close();
    }

    private QueuedTrack entry(String id, long user) {
        return new QueuedTrack(catalog.track(id).orElseThrow(AssertionError::new), user, false);
    }

    @Test
    void playsInOrder() {
        player = new SimulatedPlayer(queue, 1, false);
        QueuedTrack a = entry("a", 1);
        QueuedTrack b = entry("b", 2);
        queue.add(a);
        queue.add(b);
        assertEquals(2, player.trackCount());
        assertFalse(player.isPlaying());

        player.play();
        assertTrue(player.isPlaying());
        assertSame(a, player.current());
        assertEquals(2, player.trackCount(), "The playing track is counted");

        player.skip();
        assertSame(b, player.current());
        assertEquals(1, player.trackCount());

        player.skip();
        assertNull(player.current());
        assertFalse(player.isPlaying());
        assertEquals(0, player.trackCount());
    }

    @Test
    void pauseAndResume() {
        player = new SimulatedPlayer(queue, 1, true);
        queue.add(entry("a", 1));

        player.play();
        assertNull(player.current(), "Paused players don't start");
        assertTrue(player.isPaused());

        player.resume();
        assertTrue(player.isPlaying());
        long position = player.position();
        assertTrue(position >= 0 && position < 600000);

        player.pause();
        assertTrue(player.isPaused());
        assertFalse(player.isPlaying());
        assertNotNull(player.current());
    }

    @Test
    void tracksEnd() throws InterruptedException {
        player = new SimulatedPlayer(queue, 1, false);
        queue.add(entry("short", 1));
        player.play();

        long deadline = System.currentTimeMillis() + 5000;
        while (player.current() != null && System.currentTimeMillis() < deadline)
            Thread.sleep(10);

        assertNull(player.current());
        assertNull(queue.lastTrack());
    }

    @Test
    void negativeTimeScale() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedPlayer(queue, -1, false));
    }
}
