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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.common.Utils;
import xyz.gianlu.jukebox.playable.Requester;
import xyz.gianlu.jukebox.queue.QueuedTrack;
import xyz.gianlu.jukebox.queue.RepeatMode;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses and runs console commands against a {@link JukeboxSession}.
 *
 * @author devgianlu
 */
public final class CommandsHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandsHandler.class);
    private static final int DEFAULT_LIST_SIZE = 10;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Map<String, Requester> requesters = new HashMap<>();
    private final JukeboxSession session;
    private final PrintStream out;

    public CommandsHandler(@NotNull JukeboxSession session, @NotNull PrintStream out) {
        this.session = session;
        this.out = out;
    }

    @NotNull
    synchronized Requester requester(@NotNull String name) {
        return requesters.computeIfAbsent(name, n -> new Requester(requesters.size() + 1, n));
    }

    /**
     * @return Whether the command was understood
     */
    public boolean handle(@NotNull String cmd) {
        String[] split = cmd.trim().split("\\s+");
        switch (split[0].toLowerCase(Locale.ROOT)) {
            case "play":
                return load(split, false, false);
            case "playnext":
                return load(split, true, false);
            case "quiet":
                return load(split, false, true);
            case "skip":
                session.player().skip();
                return true;
            case "pause":
                session.player().pause();
                return true;
            case "resume":
                session.player().resume();
                return true;
            case "shuffle":
                if (split.length != 2 || !(split[1].equals("on") || split[1].equals("off"))) return invalid(cmd);
                session.queue().setShuffle(split[1].equals("on"));
                out.println("Shuffle is now " + split[1] + ".");
                return true;
            case "reshuffle":
                session.queue().reshuffle();
                out.println("The queue has been reshuffled.");
                return true;
            case "repeat":
                return repeat(split, cmd);
            case "list":
                return list(split, cmd);
            case "remove":
                return remove(split, cmd);
            case "clear":
                session.clear();
                out.println("The queue has been cleared.");
                return true;
            case "status":
                out.println(gson.toJson(session.status()));
                return true;
            default:
                LOGGER.warn("Unknown command: " + cmd);
                return false;
        }
    }

    private boolean invalid(@NotNull String cmd) {
        LOGGER.warn("Invalid command: " + cmd);
        return false;
    }

    private boolean load(@NotNull String[] split, boolean priority, boolean quiet) {
        if (split.length < 3) return invalid(String.join(" ", split));

        Requester requester = requester(split[1]);
        String identifier = String.join(" ", Arrays.copyOfRange(split, 2, split.length));
        session.load(requester, identifier, new ConsoleReplySink(requester, out), priority, quiet);
        return true;
    }

    private boolean repeat(@NotNull String[] split, @NotNull String cmd) {
        if (split.length != 2) return invalid(cmd);

        RepeatMode mode;
        try {
            mode = RepeatMode.valueOf(split[1].toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return invalid(cmd);
        }

        session.queue().setRepeatMode(mode);
        out.println("Repeat mode is now " + mode.name().toLowerCase(Locale.ROOT) + ".");
        return true;
    }

    private boolean list(@NotNull String[] split, @NotNull String cmd) {
        int from = 0;
        int to = DEFAULT_LIST_SIZE;
        if (split.length == 3) {
            try {
                from = Integer.parseInt(split[1]);
                to = Integer.parseInt(split[2]);
            } catch (NumberFormatException ex) {
                return invalid(cmd);
            }
        } else if (split.length != 1) {
            return invalid(cmd);
        }

        QueuedTrack current = session.player().current();
        if (current != null) out.println("Now playing: " + describe(current));

        List<QueuedTrack> tracks = session.queue().getTracksInRange(from, to);
        if (tracks.isEmpty()) {
            out.println("The queue is empty.");
            return true;
        }

        int index = Math.min(from, to);
        for (QueuedTrack track : tracks)
            out.println("[" + (index++) + "] " + describe(track));

        out.println("Total: " + session.queue().size() + " tracks, " + Utils.formatDuration(session.queue().durationMillis())
                + (session.queue().streamsCount() > 0 ? " plus " + session.queue().streamsCount() + " streams" : ""));
        return true;
    }

    @NotNull
    private String describe(@NotNull QueuedTrack track) {
        String user = "?";
        synchronized (this) {
            for (Requester requester : requesters.values())
                if (requester.id == track.userId) user = requester.name;
        }

        return track.playable.title() + " (" + (track.isStream() ? "stream" : Utils.formatDuration(track.effectiveDuration())) + ") by " + user;
    }

    private boolean remove(@NotNull String[] split, @NotNull String cmd) {
        if (split.length != 4) return invalid(cmd);

        int from;
        int to;
        try {
            from = Integer.parseInt(split[2]);
            to = Integer.parseInt(split[3]);
        } catch (NumberFormatException ex) {
            return invalid(cmd);
        }

        Requester requester = requester(split[1]);
        List<Long> ids = new ArrayList<>();
        for (QueuedTrack track : session.queue().getTracksInRange(from, to))
            ids.add(track.trackId);

        if (ids.isEmpty()) {
            out.println(requester.name + ": Nothing to remove in that range.");
        } else if (!session.queue().isUserTrackOwner(requester.id, ids)) {
            out.println(requester.name + ": You can only remove your own tracks.");
        } else {
            session.queue().removeAllById(ids);
            out.println(requester.name + ": Removed " + ids.size() + " tracks.");
        }

        return true;
    }
}
