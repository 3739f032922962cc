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
import xyz.gianlu.jukebox.loader.LoaderConfiguration;
import xyz.gianlu.jukebox.loader.RateLimiter;
import xyz.gianlu.jukebox.player.catalog.Catalog;
import xyz.gianlu.jukebox.queue.RepeatMode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author devgianlu
 */
class CommandsHandlerTest {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private JukeboxSession session;
    private CommandsHandler handler;

    @BeforeEach
    void setUp() throws IOException {
        Catalog catalog = Catalog.parse(new StringReader("{\"tracks\": [" +
                "{\"id\": \"t1\", \"title\": \"Song One\", \"duration\": 600000}," +
                "{\"id\": \"t2\", \"title\": \"Song Two\", \"duration\": 600000}," +
                "{\"id\": \"t3\", \"title\": \"Song Three\", \"duration\": 600000}]," +
                "\"collections\": [{\"id\": \"mix\", \"name\": \"Mix\", \"tracks\": [\"t2\", \"t3\"]}]}"));

        session = new JukeboxSession(new LoaderConfiguration.Builder().build(), catalog, RateLimiter.NONE, 1, false);
        handler = new CommandsHandler(session, new PrintStream(bytes, true));
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private String output() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private void awaitLoader() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while ((session.loader().isLoading() || session.loader().pendingCount() > 0) && System.currentTimeMillis() < deadline)
            Thread.sleep(10);

        assertFalse(session.loader().isLoading());
    }

    @Test
    void playAndList() throws InterruptedException {
        assertTrue(handler.handle("play alice t1"));
        awaitLoader();
        assertTrue(output().contains("**Song One** will now play."), output());
        assertTrue(session.player().isPlaying());

        assertTrue(handler.handle("play bob mix"));
        awaitLoader();
        assertTrue(output().contains("Found and added `2` songs from playlist **Mix**."), output());
        assertEquals(2, session.queue().size());

        assertTrue(handler.handle("list"));
        assertTrue(output().contains("Now playing: Song One"), output());
        assertTrue(output().contains("[0] Song Two"), output());
    }

    @Test
    void noMatch() throws InterruptedException {
        assertTrue(handler.handle("play alice nothing"));
        awaitLoader();
        assertTrue(output().contains("No audio could be found for `nothing`."), output());
    }

    @Test
    void removeOnlyOwnTracks() throws InterruptedException {
        handler.handle("pause");
        handler.handle("play alice t1");
        awaitLoader();
        handler.handle("play bob t2");
        awaitLoader();
        assertEquals(2, session.queue().size());

        assertTrue(handler.handle("remove bob 0 2"));
        assertTrue(output().contains("You can only remove your own tracks."), output());
        assertEquals(2, session.queue().size());

        assertTrue(handler.handle("remove alice 0 1"));
        assertEquals(1, session.queue().size());
        assertEquals("t2", session.queue().peek().playable.identifier());
    }

    @Test
    void queueSettings() {
        assertTrue(handler.handle("shuffle on"));
        assertTrue(session.queue().isShuffle());
        assertTrue(handler.handle("repeat all"));
        assertEquals(RepeatMode.ALL, session.queue().repeatMode());

        assertFalse(handler.handle("repeat sometimes"));
        assertFalse(handler.handle("shuffle maybe"));
        assertFalse(handler.handle("dance"));
    }

    @Test
    void status() {
        assertTrue(handler.handle("status"));
        assertTrue(output().contains("\"queueSize\": 0"), output());
        assertTrue(output().contains("\"tracksLoaded\""), output());
    }
}
