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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * @author Gianlu
 */
public final class Utils {
    private static final String MARKDOWN_CHARS = "\\*_`~|>";

    private Utils() {
    }

    @NotNull
    public static String[] split(@NotNull String str, char c) {
        if (str.isEmpty()) return new String[]{""};

        List<String> list = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < str.length(); i++) {
            if (str.charAt(i) == c) {
                list.add(str.substring(start, i));
                start = i + 1;
            }
        }

        list.add(str.substring(start));
        return list.toArray(new String[0]);
    }

    /**
     * Escapes markdown and breaks mentions, so that user provided titles can be echoed safely.
     */
    @NotNull
    public static String escapeAndDefuse(@NotNull String str) {
        StringBuilder builder = new StringBuilder(str.length() + 8);
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (MARKDOWN_CHARS.indexOf(c) != -1) builder.append('\\');
            builder.append(c);
            if (c == '@') builder.append('\u200B');
        }

        return builder.toString();
    }

    /**
     * @return The duration formatted as {@code [h:]mm:ss}
     */
    @NotNull
    public static String formatDuration(long millis) {
        long hours = TimeUnit.MILLISECONDS.toHours(millis);
        long minutes = TimeUnit.MILLISECONDS.toMinutes(millis) % 60;
        long seconds = TimeUnit.MILLISECONDS.toSeconds(millis) % 60;
        if (hours > 0) return String.format("%d:%02d:%02d", hours, minutes, seconds);
        else return String.format("%02d:%02d", minutes, seconds);
    }
}
