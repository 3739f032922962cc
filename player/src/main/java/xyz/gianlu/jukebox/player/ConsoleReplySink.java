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

import org.jetbrains.annotations.NotNull;
import xyz.gianlu.jukebox.loader.ReplySink;
import xyz.gianlu.jukebox.playable.Requester;

import java.io.PrintStream;

/**
 * @author devgianlu
 */
public final class ConsoleReplySink implements ReplySink {
    private final Requester requester;
    private final PrintStream out;

    public ConsoleReplySink(@NotNull Requester requester, @NotNull PrintStream out) {
        this.requester = requester;
        this.out = out;
    }

    @Override
    public void reply(@NotNull String text) {
        out.println(text);
    }

    @Override
    public void replyWithName(@NotNull String text) {
        out.println(requester.name + ": " + text);
    }
}
