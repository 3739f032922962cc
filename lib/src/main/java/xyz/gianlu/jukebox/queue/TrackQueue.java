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

package xyz.gianlu.jukebox.queue;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * The pending tracks of one player. Implementations decide where new entries go and in which order they are played,
 * every operation must be safe to call from any thread.
 *
 * @author devgianlu
 */
public interface TrackQueue {

    void add(@NotNull QueuedTrack track);

    void addAll(@NotNull Collection<QueuedTrack> tracks);

    /**
     * Puts the track in front of everything else, also when shuffling.
     */
    void addFirst(@NotNull QueuedTrack track);

    /**
     * Puts the tracks in front of everything else, keeping their order.
     */
    void addAllFirst(@NotNull Collection<QueuedTrack> tracks);

    boolean remove(@NotNull QueuedTrack track);

    void removeAll(@NotNull Collection<QueuedTrack> tracks);

    void removeAllById(@NotNull Collection<Long> trackIds);

    /**
     * @param index The index in the presentation order
     * @throws IndexOutOfBoundsException If there is no such track
     */
    @NotNull
    QueuedTrack getTrack(int index);

    /**
     * Returns the tracks between two indexes of the presentation order, the lower bound is inclusive and the upper
     * bound exclusive. Bounds may be given in any order.
     */
    @NotNull
    List<QueuedTrack> getTracksInRange(int startIndex, int endIndex);

    /**
     * @return A copy of the queue in insertion order
     */
    @NotNull
    List<QueuedTrack> asList();

    /**
     * @return The queue in the order it will be played
     */
    @NotNull
    List<QueuedTrack> asListOrdered();

    /**
     * @return The track {@link #provideNext()} would return if the repeat mode is {@link RepeatMode#NONE}
     */
    @Nullable
    QueuedTrack peek();

    /**
     * Takes the next track to play out of the queue, honoring the repeat mode.
     *
     * @return The track to play or {@code null} if there is nothing left
     */
    @Nullable
    QueuedTrack provideNext();

    /**
     * The last track has been skipped, it must not be repeated.
     */
    void skipped();

    @Nullable
    QueuedTrack lastTrack();

    void clear();

    int size();

    boolean isEmpty();

    /**
     * @return The total duration of the queued tracks, streams excluded
     */
    long durationMillis();

    int streamsCount();

    /**
     * Gives every track a new random place in the shuffled order.
     */
    void reshuffle();

    /**
     * @return Whether all the tracks among {@code trackIds} were added by {@code userId}
     */
    boolean isUserTrackOwner(long userId, @NotNull Collection<Long> trackIds);

    boolean isShuffle();

    void setShuffle(boolean shuffle);

    @NotNull
    RepeatMode repeatMode();

    void setRepeatMode(@NotNull RepeatMode mode);
}
