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

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.common.NameThreadFactory;
import xyz.gianlu.jukebox.loader.LoadException;
import xyz.gianlu.jukebox.loader.ResolutionResult;
import xyz.gianlu.jukebox.loader.TrackResolver;

import java.io.Closeable;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves identifiers against a {@link Catalog} on a dedicated thread. Plain identifiers are looked up as
 * tracks first and collections second, {@code search:} runs a title search and any other scheme is unsupported.
 *
 * @author devgianlu
 */
public final class CatalogResolver implements TrackResolver, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogResolver.class);
    private static final Pattern SCHEME_PATTERN = Pattern.compile("^([a-z][a-z0-9+.-]*):(.*)$");
    private final Catalog catalog;
    private final ExecutorService executorService = Executors.newSingleThreadExecutor(new NameThreadFactory((r) -> "catalog-resolver-" + r.hashCode()));

    public CatalogResolver(@NotNull Catalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public @NotNull CompletionStage<ResolutionResult> resolve(@NotNull String identifier) {
        return CompletableFuture.supplyAsync(() -> resolveNow(identifier), executorService);
    }

    @NotNull
    ResolutionResult resolveNow(@NotNull String identifier) {
        try {
            Optional<Catalog.Track> track = catalog.track(identifier);
            if (track.isPresent()) return ResolutionResult.single(track.get());

            Optional<Catalog.Collection> collection = catalog.collection(identifier);
            if (collection.isPresent())
                return ResolutionResult.collection(collection.get().name, collection.get().tracks);

            Matcher matcher = SCHEME_PATTERN.matcher(identifier);
            if (matcher.matches()) {
                String scheme = matcher.group(1);
                if ("search".equals(scheme)) {
                    return catalog.search(matcher.group(2))
                            .map(ResolutionResult::single)
                            .orElseGet(ResolutionResult::noMatch);
                }

                return ResolutionResult.failure(new LoadException("Unsupported source: " + scheme, LoadException.Severity.COMMON));
            }

            return ResolutionResult.noMatch();
        } catch (RuntimeException ex) {
            LOGGER.error("Failed resolving {}.", identifier, ex);
            return ResolutionResult.failure(new LoadException("Failed resolving " + identifier, LoadException.Severity.SUSPICIOUS, ex));
        }
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(1, TimeUnit.SECONDS))
                executorService.shutdownNow();
        } catch (InterruptedException ex) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
