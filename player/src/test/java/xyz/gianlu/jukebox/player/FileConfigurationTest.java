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

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.gianlu.jukebox.loader.LoaderConfiguration;
import xyz.gianlu.jukebox.player.catalog.WindowRateLimiter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author devgianlu
 */
class FileConfigurationTest {

    @Test
    void createsDefaultFile(@TempDir File dir) throws IOException {
        File file = new File(dir, "config.toml");
        FileConfiguration conf = new FileConfiguration("--conf-file=" + file.getAbsolutePath());
        assertTrue(file.exists());

        assertEquals(Level.INFO, conf.loggingLevel());
        assertFalse(conf.startPaused());
        assertEquals(1.0, conf.timeScale());

        LoaderConfiguration loader = conf.toLoader();
        assertEquals(LoaderConfiguration.DEFAULT_QUEUE_TRACK_LIMIT, loader.queueTrackLimit);
        assertEquals(LoaderConfiguration.DEFAULT_ANNOUNCE_THRESHOLD, loader.announceThreshold);
        assertFalse(loader.showBlockingWarning);

        WindowRateLimiter.Configuration limiter = conf.toRateLimiter();
        assertTrue(limiter.enabled);
        assertEquals(2, limiter.maxRequests);
        assertEquals(60_000, limiter.windowMillis);
    }

    @Test
    void commandLineOverrides(@TempDir File dir) throws IOException {
        File file = new File(dir, "config.toml");
        FileConfiguration conf = new FileConfiguration("--conf-file=" + file.getAbsolutePath(),
                "--loader.queueTrackLimit=20", "--ratelimit.enabled=false", "--player.timeScale=0.5", "--logLevel=debug");

        assertEquals(20, conf.toLoader().queueTrackLimit);
        assertFalse(conf.toRateLimiter().enabled);
        assertEquals(0.5, conf.timeScale());
        assertEquals(Level.DEBUG, conf.loggingLevel());
    }

    @Test
    void updatesExistingFile(@TempDir File dir) throws IOException {
        File file = new File(dir, "config.toml");
        Files.write(file.toPath(), ("logLevel = \"WARN\"\noldKey = true\n\n[loader]\nqueueTrackLimit = 5\n").getBytes(StandardCharsets.UTF_8));

        FileConfiguration conf = new FileConfiguration("--conf-file=" + file.getAbsolutePath());
        assertEquals(Level.WARN, conf.loggingLevel());
        assertEquals(5, conf.toLoader().queueTrackLimit);
        assertEquals(LoaderConfiguration.DEFAULT_ANNOUNCE_THRESHOLD, conf.toLoader().announceThreshold);

        String content = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        assertFalse(content.contains("oldKey"));
        assertTrue(content.contains("maxCollectionItems"));
    }

    @Test
    void missingCatalogFallsBackToSample(@TempDir File dir) throws IOException {
        File file = new File(dir, "config.toml");
        FileConfiguration conf = new FileConfiguration("--conf-file=" + file.getAbsolutePath(),
                "--catalog.file=" + new File(dir, "missing.json").getAbsolutePath());

        assertTrue(conf.loadCatalog().size() > 0);
    }
}
