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

/**
 * The player the {@link TrackLoader} feeds.
 *
 * @author devgianlu
 */
public interface PlaybackController {

    boolean isPlaying();

    /**
     * @return Whether the user explicitly paused playback
     */
    boolean isPaused();

    /**
     * Starts playing the queue, if not playing already.
     */
    void play();

    /**
     * @return The number of queued tracks, including the one playing
     */
    int trackCount();
}
