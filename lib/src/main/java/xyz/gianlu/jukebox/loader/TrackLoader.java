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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.common.Utils;
import xyz.gianlu.jukebox.loader.LoaderMessages.Key;
import xyz.gianlu.jukebox.loader.RateLimiter.CollectionInfo;
import xyz.gianlu.jukebox.playable.Playable;
import xyz.gianlu.jukebox.queue.QueuedTrack;
import xyz.gianlu.jukebox.queue.TrackQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolves {@link LoadRequest}s one at a time and puts the results in the {@link TrackQueue}. Requests can be
 * submitted from any thread, at most one of them is being resolved at any time.
 *
 * @author devgianlu
 */
public final class TrackLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackLoader.class);
    private final ConcurrentLinkedQueue<LoadRequest> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean loading = new AtomicBoolean(false);
    private final LoaderMetrics metrics = new LoaderMetrics();
    private final LoaderConfiguration conf;
    private final TrackQueue queue;
    private final PlaybackController player;
    private final TrackResolver resolver;
    private final RateLimiter rateLimiter;
    private final FailureReporter reporter;

    public TrackLoader(@NotNull LoaderConfiguration conf, @NotNull TrackQueue queue, @NotNull PlaybackController player,
                       @NotNull TrackResolver resolver, @NotNull RateLimiter rateLimiter, @NotNull FailureReporter reporter) {
        this.conf = conf;
        this.queue = queue;
        this.player = player;
        this.resolver = resolver;
        this.rateLimiter = rateLimiter;
        this.reporter = reporter;
    }

    @Nullable
    private static Throwable unwrap(@Nullable Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) return ex.getCause();
        else return ex;
    }

    /**
     * Queues a request for loading. If nothing is being loaded, resolution starts right away on the calling thread.
     *
     * @param request The request
     * @return {@code false} if the request has been rejected by the rate limiter
     */
    public boolean submit(@NotNull LoadRequest request) {
        if (!checkSlowLoadingCollection(request))
            return false;

        pending.add(request);
        if (loading.compareAndSet(false, true)) loadNext();
        return true;
    }

    /**
     * @return Whether a request is being resolved right now
     */
    public boolean isLoading() {
        return loading.get();
    }

    /**
     * @return The number of requests waiting to be resolved
     */
    public int pendingCount() {
        return pending.size();
    }

    @NotNull
    public LoaderMetrics metrics() {
        return metrics;
    }

    /**
     * If the identifier is a slow loading collection we know of, checks the rate limit and tells the user that it
     * might take a while.
     *
     * @return {@code false} if the user is not allowed to load the collection
     */
    private boolean checkSlowLoadingCollection(@NotNull LoadRequest request) {
        Optional<CollectionInfo> info;
        try {
            info = rateLimiter.collectionMetadata(request.identifier);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed retrieving collection metadata for {}.", request.identifier, ex);
            return true;
        }

        if (!info.isPresent()) return true;

        CollectionInfo collection = info.get();
        boolean limited;
        try {
            limited = rateLimiter.isRateLimited(request, collection, collection.totalItems);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed checking rate limit for {}.", request.identifier, ex);
            limited = false;
        }

        if (limited) {
            metrics.rateLimited.incrementAndGet();
            LOGGER.debug("Rate limited {}, {}.", request, collection);
            safeReply(request, conf.messages.format(Key.RATE_LIMITED, collection.name), true);
            return false;
        }

        if (collection.totalItems > conf.announceThreshold)
            safeReply(request, conf.messages.format(Key.ANNOUNCE_COLLECTION, collection.name, collection.totalItems), true);

        return true;
    }

    /**
     * Resolves pending requests until one of them has to be waited for, or goes idle. Must only be called by
     * whoever holds the loading token. Stages that are already complete are handled in place so that a long run of
     * them doesn't grow the stack.
     */
    private void loadNext() {
        while (true) {
            LoadRequest request = null;
            try {
                request = pending.poll();
                if (request == null) {
                    loading.set(false);

                    // Someone may have submitted between the poll and the reset
                    if (pending.isEmpty() || !loading.compareAndSet(false, true)) return;
                    else continue;
                }

                if (player.trackCount() >= conf.queueTrackLimit) {
                    overQueueLimit(request);
                    continue;
                }

                LOGGER.trace("Resolving {}.", request);

                CompletableFuture<ResolutionResult> future = resolver.resolve(request.identifier).toCompletableFuture();
                if (future.isDone()) {
                    ResolutionResult result = null;
                    Throwable ex = null;
                    try {
                        result = future.join();
                    } catch (CompletionException | CancellationException th) {
                        ex = unwrap(th);
                    }

                    dispatch(request, result, ex);
                    continue;
                }

                LoadRequest current = request;
                future.whenComplete((result, ex) -> onResolved(current, result, unwrap(ex)))
                        .exceptionally(th -> {
                            recover(th);
                            return null;
                        });
                return;
            } catch (Throwable th) {
                if (request == null) {
                    LOGGER.error("Error while loading track", th);
                    loading.set(false);
                    return;
                }

                handleThrowable(request, th);
            }
        }
    }

    private void onResolved(@NotNull LoadRequest request, @Nullable ResolutionResult result, @Nullable Throwable ex) {
        dispatch(request, result, ex);
        loadNext();
    }

    /**
     * The chain advancing the queue died, the token is still ours: release it and start over.
     */
    private void recover(@NotNull Throwable th) {
        LOGGER.error("Loader failed while advancing, restarting.", th);
        loading.set(false);
        if (!pending.isEmpty() && loading.compareAndSet(false, true)) loadNext();
    }

    private void dispatch(@NotNull LoadRequest request, @Nullable ResolutionResult result, @Nullable Throwable ex) {
        try {
            if (ex != null) handleThrowable(request, ex);
            else if (result == null) handleThrowable(request, new IllegalStateException("Resolver returned no result for " + request.identifier));
            else handleResult(request, result);
        } catch (Throwable th) {
            handleThrowable(request, th);
        }
    }

    private void overQueueLimit(@NotNull LoadRequest request) {
        metrics.overQueueLimit.incrementAndGet();
        safeReply(request, conf.messages.format(Key.QUEUE_TRACK_LIMIT, conf.queueTrackLimit), true);
    }

    private void handleResult(@NotNull LoadRequest request, @NotNull ResolutionResult result) {
        switch (result.kind()) {
            case SINGLE_ITEM:
                trackLoaded(request, ((ResolutionResult.SingleItem) result).playable);
                break;
            case COLLECTION:
                ResolutionResult.Collection collection = (ResolutionResult.Collection) result;
                if (collection.items.isEmpty()) noMatches(request);
                else collectionLoaded(request, collection.name, collection.items);
                break;
            case NO_MATCH:
                noMatches(request);
                break;
            case FAILURE:
                handleThrowable(request, ((ResolutionResult.Failure) result).exception);
                break;
            default:
                throw new IllegalArgumentException("Unknown result: " + result.kind());
        }
    }

    private void trackLoaded(@NotNull LoadRequest request, @NotNull Playable playable) {
        boolean wasPlaying = player.isPlaying();

        QueuedTrack track = new QueuedTrack(playable, request.requester.id, request.priority, request.position);
        if (request.priority) queue.addFirst(track);
        else queue.add(track);

        metrics.tracksLoaded.incrementAndGet();

        if (!request.quiet) {
            String title = Utils.escapeAndDefuse(playable.title());
            Key key;
            if (!wasPlaying) key = Key.SINGLE_TRACK_AND_PLAY;
            else if (request.priority) key = Key.SINGLE_TRACK_FIRST;
            else key = Key.SINGLE_TRACK;

            safeReply(request, conf.messages.format(key, title), false);
        } else {
            LOGGER.info("Quietly loaded {}.", playable.identifier());
        }

        if (!player.isPaused()) player.play();
    }

    private void collectionLoaded(@NotNull LoadRequest request, @NotNull String name, @NotNull List<Playable> items) {
        if (player.trackCount() + items.size() > conf.queueTrackLimit) {
            LOGGER.debug("{} with {} items doesn't fit in the queue.", name, items.size());
            overQueueLimit(request);
            return;
        }

        List<QueuedTrack> toAdd = new ArrayList<>(items.size());
        for (Playable playable : items)
            toAdd.add(new QueuedTrack(playable, request.requester.id, request.priority));

        if (request.priority) queue.addAllFirst(toAdd);
        else queue.addAll(toAdd);

        metrics.tracksLoaded.addAndGet(toAdd.size());
        safeReply(request, conf.messages.format(Key.LIST_SUCCESS, toAdd.size(), Utils.escapeAndDefuse(name)), false);

        if (!player.isPaused()) player.play();
    }

    private void noMatches(@NotNull LoadRequest request) {
        metrics.noMatches.incrementAndGet();
        safeReply(request, conf.messages.format(Key.NO_MATCHES, request.identifier), false);
    }

    /**
     * Tells the user what went wrong, and the operator too if the user cannot do anything about it.
     */
    void handleThrowable(@NotNull LoadRequest request, @NotNull Throwable th) {
        metrics.loadsFailed.incrementAndGet();

        try {
            if (th instanceof LoadException) {
                LoadException ex = (LoadException) th;
                if (ex.severity == LoadException.Severity.COMMON) {
                    LOGGER.debug("Failed loading {}: {}", request.identifier, ex.getMessage());
                    request.reply(conf.messages.format(Key.ERROR_COMMON, request.identifier, ex.getMessage()));
                } else if (conf.showBlockingWarning) {
                    LOGGER.warn("Failed loading {}, the source may be blocking us.", request.identifier, ex);
                    request.reply(conf.messages.format(Key.ERROR_BLOCKED, request.identifier));
                } else {
                    Throwable exposed = ex.getCause() == null ? ex : ex.getCause();
                    reporter.report("Failed to load a track", exposed, request);
                    request.reply(conf.messages.format(Key.ERROR_SUSPICIOUS, request.identifier));
                }
            } else {
                reporter.report("Failed to load a track", th, request);
                request.reply(conf.messages.format(Key.ERROR_GENERIC));
            }
        } catch (Throwable ex) {
            LOGGER.error("Error when trying to handle another error: {}", request, th);
            LOGGER.error("Failed handling error.", ex);
        }
    }

    private void safeReply(@NotNull LoadRequest request, @NotNull String text, boolean withName) {
        try {
            if (withName) request.replyWithName(text);
            else request.reply(text);
        } catch (Exception ex) {
            LOGGER.warn("Failed replying to {}.", request, ex);
        }
    }
}
