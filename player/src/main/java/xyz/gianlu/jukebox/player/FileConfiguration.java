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

import com.electronwill.nightconfig.core.CommentedConfig;
import com.electronwill.nightconfig.core.Config;
import com.electronwill.nightconfig.core.UnmodifiableCommentedConfig;
import com.electronwill.nightconfig.core.file.CommentedFileConfig;
import com.electronwill.nightconfig.core.file.FileConfig;
import com.electronwill.nightconfig.core.file.FileNotFoundAction;
import com.electronwill.nightconfig.toml.TomlParser;
import org.apache.logging.log4j.Level;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.common.Utils;
import xyz.gianlu.jukebox.loader.LoaderConfiguration;
import xyz.gianlu.jukebox.player.catalog.Catalog;
import xyz.gianlu.jukebox.player.catalog.WindowRateLimiter;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * @author devgianlu
 */
public final class FileConfiguration {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileConfiguration.class);
    private final CommentedFileConfig config;

    public FileConfiguration(@Nullable String... override) throws IOException {
        File confFile = null;
        if (override != null && override.length > 0) {
            for (String arg : override) {
                if (arg != null && arg.startsWith("--conf-file="))
                    confFile = new File(arg.substring(12));
            }
        }

        if (confFile == null) confFile = new File("config.toml");

        config = CommentedFileConfig.builder(confFile).onFileNotFound(FileNotFoundAction.copyData(streamDefaultConfig())).build();
        config.load();

        updateConfigFile(new TomlParser().parse(streamDefaultConfig()));

        if (override != null && override.length > 0) {
            for (String str : override) {
                if (str == null || str.startsWith("--conf-file=")) continue;

                if (str.contains("=") && str.startsWith("--")) {
                    String[] split = Utils.split(str, '=');
                    if (split.length != 2) {
                        LOGGER.warn("Invalid command line argument: " + str);
                        continue;
                    }

                    String key = split[0].substring(2);
                    config.set(key, convertFromString(key, split[1]));
                } else {
                    LOGGER.warn("Invalid command line argument: " + str);
                }
            }
        }
    }

    private static boolean removeDeprecatedKeys(@NotNull Config defaultConfig, @NotNull Config config, @NotNull FileConfig base, @NotNull String prefix) {
        boolean save = false;

        for (Config.Entry entry : new ArrayList<>(config.entrySet())) {
            String key = prefix + entry.getKey();
            if (entry.getValue() instanceof Config) {
                if (removeDeprecatedKeys(defaultConfig, entry.getValue(), base, key + "."))
                    save = true;
            } else {
                if (!defaultConfig.contains(key)) {
                    LOGGER.trace("Removed entry from configuration file: " + key);
                    base.remove(key);
                    save = true;
                }
            }
        }

        return save;
    }

    private static boolean checkMissingKeys(@NotNull Config defaultConfig, @NotNull FileConfig config, @NotNull String prefix) {
        boolean save = false;

        for (Config.Entry entry : defaultConfig.entrySet()) {
            String key = prefix + entry.getKey();
            if (entry.getValue() instanceof Config) {
                if (checkMissingKeys(entry.getValue(), config, key + "."))
                    save = true;
            } else {
                if (!config.contains(key)) {
                    LOGGER.trace("Added new entry to configuration file: " + key);
                    config.set(key, entry.getValue());
                    save = true;
                }
            }
        }

        return save;
    }

    @NotNull
    private static Object convertFromString(@NotNull String key, @NotNull String value) {
        if (Objects.equals(key, "player.timeScale")) {
            return Double.parseDouble(value);
        } else if (Objects.equals(key, "logLevel")) {
            return value.toUpperCase();
        } else if ("true".equals(value) || "false".equals(value)) {
            return Boolean.parseBoolean(value);
        } else {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException ex) {
                return value;
            }
        }
    }

    @NotNull
    private static InputStream streamDefaultConfig() {
        InputStream defaultConfig = FileConfiguration.class.getClassLoader().getResourceAsStream("default.toml");
        if (defaultConfig == null) throw new IllegalStateException();
        return defaultConfig;
    }

    private void updateConfigFile(@NotNull CommentedConfig defaultConfig) {
        boolean save = checkMissingKeys(defaultConfig, config, "");
        if (removeDeprecatedKeys(defaultConfig, config, config, "")) save = true;

        if (save) {
            config.clearComments();

            for (Map.Entry<String, UnmodifiableCommentedConfig.CommentNode> entry : defaultConfig.getComments().entrySet()) {
                UnmodifiableCommentedConfig.CommentNode node = entry.getValue();
                if (config.contains(entry.getKey())) {
                    config.setComment(entry.getKey(), node.getComment());
                    Map<String, UnmodifiableCommentedConfig.CommentNode> children = node.getChildren();
                    if (children != null) ((CommentedConfig) config.getRaw(entry.getKey())).putAllComments(children);
                }
            }

            config.save();
        }
    }

    private int getInt(@NotNull String key) {
        Object raw = config.get(key);
        if (raw instanceof Number) return ((Number) raw).intValue();
        else throw new IllegalArgumentException("Not a number: " + key + " = " + raw);
    }

    @NotNull
    public Level loggingLevel() {
        return Level.toLevel(config.get("logLevel"));
    }

    public double timeScale() {
        Object raw = config.get("player.timeScale");
        if (raw instanceof Number) return ((Number) raw).doubleValue();
        else throw new IllegalArgumentException("Not a number: player.timeScale = " + raw);
    }

    public boolean startPaused() {
        return config.get("player.startPaused");
    }

    @Nullable
    public File catalogFile() {
        String path = config.get("catalog.file");
        return path == null || path.isEmpty() ? null : new File(path);
    }

    /**
     * Loads the configured catalog, or the bundled sample one if the file doesn't exist.
     */
    @NotNull
    public Catalog loadCatalog() throws IOException {
        File file = catalogFile();
        if (file != null && file.exists()) {
            LOGGER.info("Loading catalog from {}.", file.getAbsolutePath());
            return Catalog.load(file);
        }

        LOGGER.warn("Catalog file {} not found, using the sample catalog.", file);
        InputStream in = FileConfiguration.class.getClassLoader().getResourceAsStream("sample-catalog.json");
        if (in == null) return Catalog.empty();

        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return Catalog.parse(reader);
        }
    }

    @NotNull
    public LoaderConfiguration toLoader() {
        return new LoaderConfiguration.Builder()
                .setQueueTrackLimit(getInt("loader.queueTrackLimit"))
                .setAnnounceThreshold(getInt("loader.announceThreshold"))
                .setShowBlockingWarning(config.get("loader.showBlockingWarning"))
                .build();
    }

    @NotNull
    public WindowRateLimiter.Configuration toRateLimiter() {
        return new WindowRateLimiter.Configuration.Builder()
                .setEnabled(config.get("ratelimit.enabled"))
                .setMaxRequests(getInt("ratelimit.maxRequests"))
                .setWindowSeconds(getInt("ratelimit.windowSeconds"))
                .setMaxCollectionItems(getInt("ratelimit.maxCollectionItems"))
                .build();
    }
}
