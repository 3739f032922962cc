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

/**
 * Where the answers for a {@link LoadRequest} go. Delivery is fire-and-forget.
 *
 * @author devgianlu
 */
public interface ReplySink {

    void reply(@NotNull String text);

    /**
     * Same as {@link #reply(String)}, but addressing the requester by name.
     */
    void replyWithName(@NotNull String text);
}
