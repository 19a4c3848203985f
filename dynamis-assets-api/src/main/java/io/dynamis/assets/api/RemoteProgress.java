package io.dynamis.assets.api;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Asset loading progress self-reported by a connected out-of-process client.
 *
 * WIRE FORMAT (inbound command line, one per message):
 *   assets_to_load?total=10&remaining=4
 *   assets_to_load?total=int:10&remaining=int:4
 *
 * Parameters are URL-encoded. Values may carry an "int:" type prefix.
 * The command name is matched case-insensitively.
 *
 * @param total     assets the remote process has to load
 * @param remaining assets it has not loaded yet
 */
public record RemoteProgress(int total, int remaining) {

    /** Command name of the inbound message. */
    public static final String COMMAND = "assets_to_load";

    private static final String INT_PREFIX = "int:";

    public RemoteProgress {
        if (total < 0 || remaining < 0) {
            throw new IllegalArgumentException(
                "total and remaining must be >= 0; got total=" + total + ", remaining=" + remaining);
        }
        if (remaining > total) {
            throw new IllegalArgumentException(
                "remaining " + remaining + " exceeds total " + total);
        }
    }

    /** Assets the remote process has finished loading. */
    public int loaded() {
        return total - remaining;
    }

    /**
     * Decodes one inbound command line.
     *
     * @throws IllegalArgumentException if the command is not assets_to_load or a
     *                                  parameter is missing or not an integer
     */
    public static RemoteProgress decode(String commandLine) {
        if (commandLine == null) {
            throw new NullPointerException("commandLine");
        }
        String line = commandLine.strip();
        int q = line.indexOf('?');
        String command = q < 0 ? line : line.substring(0, q);
        if (!COMMAND.equals(command.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Not an " + COMMAND + " command: '" + line + "'");
        }
        Map<String, String> params = new HashMap<>();
        if (q >= 0) {
            for (String pair : line.substring(q + 1).split("&")) {
                if (pair.isEmpty()) continue;
                int eq = pair.indexOf('=');
                String key = eq < 0 ? pair : pair.substring(0, eq);
                String value = eq < 0 ? "" : pair.substring(eq + 1);
                params.put(URLDecoder.decode(key, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT),
                           URLDecoder.decode(value, StandardCharsets.UTF_8));
            }
        }
        return new RemoteProgress(intParam(params, "total"), intParam(params, "remaining"));
    }

    private static int intParam(Map<String, String> params, String name) {
        String raw = params.get(name);
        if (raw == null) {
            throw new IllegalArgumentException(COMMAND + " is missing parameter '" + name + "'");
        }
        String value = raw.startsWith(INT_PREFIX) ? raw.substring(INT_PREFIX.length()) : raw;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                COMMAND + " parameter '" + name + "' is not an integer: '" + raw + "'", e);
        }
    }
}
