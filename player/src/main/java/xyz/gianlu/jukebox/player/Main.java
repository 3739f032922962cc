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

import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.Version;
import xyz.gianlu.jukebox.common.LoggingUncaughtExceptionHandler;
import xyz.gianlu.jukebox.player.catalog.Catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * @author Gianlu
 */
public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws IOException {
        FileConfiguration conf = new FileConfiguration(args);
        Configurator.setRootLevel(conf.loggingLevel());
        Thread.setDefaultUncaughtExceptionHandler(new LoggingUncaughtExceptionHandler());

        LOGGER.info("Starting {}", Version.systemInfoString());

        Catalog catalog = conf.loadCatalog();
        JukeboxSession session = new JukeboxSession(conf, catalog);
        Runtime.getRuntime().addShutdownHook(new Thread(session::close));

        CommandsHandler handler = new CommandsHandler(session, System.out);
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (line.equals("quit") || line.equals("exit")) break;

                handler.handle(line);
            }
        }

        System.exit(0);
    }
}
