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

package xyz.gianlu.jukebox.common;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ThreadFactory;
import java.util.function.Function;

/**
 * Creates named daemon threads that log their uncaught exceptions.
 *
 * @author Gianlu
 */
public final class NameThreadFactory implements ThreadFactory {
    private final Function<Runnable, String> nameProvider;
    private final Thread.UncaughtExceptionHandler handler;

    public NameThreadFactory(@NotNull Function<Runnable, String> nameProvider) {
        this(nameProvider, new LoggingUncaughtExceptionHandler());
    }

    public NameThreadFactory(@NotNull Function<Runnable, String> nameProvider, @NotNull Thread.UncaughtExceptionHandler handler) {
        this.nameProvider = nameProvider;
        this.handler = handler;
    }

    @Override
    public @NotNull Thread newThread(@NotNull Runnable r) {
        Thread t = new Thread(r, nameProvider.apply(r));
        t.setDaemon(true);
        t.setUncaughtExceptionHandler(handler);
        if (t.getPriority() != Thread.NORM_PRIORITY) t.setPriority(Thread.NORM_PRIORITY);
        return t;
    }
}
