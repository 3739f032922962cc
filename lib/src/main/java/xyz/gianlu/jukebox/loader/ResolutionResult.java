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

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import xyz.gianlu.jukebox.playable.Playable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a {@link TrackResolver} made of an identifier. Exactly one of {@link SingleItem}, {@link Collection},
 * {@link NoMatch} or {@link Failure}.
 *
 * @author devgianlu
 */
public abstract class ResolutionResult {
    private static final NoMatch NO_MATCH = new NoMatch();

    private ResolutionResult() {
    }

    @NotNull
    @Contract("_ -> new")
    public static ResolutionResult single(@NotNull Playable playable) {
        return new SingleItem(playable);
    }

    @NotNull
    @Contract("_, _ -> new")
    public static ResolutionResult collection(@NotNull String name, @NotNull List<? extends Playable> items) {
        return new Collection(name, items);
    }

    @NotNull
    public static ResolutionResult noMatch() {
        return NO_MATCH;
    }

    @NotNull
    @Contract("_ -> new")
    public static ResolutionResult failure(@NotNull LoadException exception) {
        return new Failure(exception);
    }

    @NotNull
    public abstract Kind kind();

    public enum Kind {
        SINGLE_ITEM, COLLECTION, NO_MATCH, FAILURE
    }

    public static final class SingleItem extends ResolutionResult {
        public final Playable playable;

        private SingleItem(@NotNull Playable playable) {
            this.playable = playable;
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.SINGLE_ITEM;
        }
    }

    public static final class Collection extends ResolutionResult {
        public final String name;
        public final List<Playable> items;

        private Collection(@NotNull String name, @NotNull List<? extends Playable> items) {
            this.name = name;
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.COLLECTION;
        }
    }

    public static final class NoMatch extends ResolutionResult {

        private NoMatch() {
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.NO_MATCH;
        }
    }

    public static final class Failure extends ResolutionResult {
        public final LoadException exception;

        private Failure(@NotNull LoadException exception) {
            this.exception = exception;
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.FAILURE;
        }
    }
}
