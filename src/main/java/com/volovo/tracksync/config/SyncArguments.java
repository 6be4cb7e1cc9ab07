package com.volovo.tracksync.config;

import com.volovo.tracksync.service.SyncCommand;
import com.volovo.tracksync.util.PortalTimes;
import org.springframework.boot.ApplicationArguments;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Command-line options of a one-shot sync:
 * {@code --sync [--oids=182,716] [--from=...] [--to=...] [--chunk-hours=N] [--reset-state] [--save-raw]}.
 */
public final class SyncArguments {

    public static final String SYNC = "sync";
    public static final String OIDS = "oids";
    public static final String FROM = "from";
    public static final String TO = "to";
    public static final String CHUNK_HOURS = "chunk-hours";
    public static final String RESET_STATE = "reset-state";
    public static final String SAVE_RAW = "save-raw";

    private SyncArguments() {
    }

    public static boolean isSyncRequested(ApplicationArguments args) {
        return args.containsOption(SYNC);
    }

    /**
     * @param defaultDeviceIds used when {@code --oids} is absent
     * @throws IllegalArgumentException on an unparseable value, no devices, or {@code to <= from}
     */
    public static SyncCommand toCommand(ApplicationArguments args, List<Long> defaultDeviceIds) {
        List<Long> deviceIds = args.containsOption(OIDS)
                ? parseDeviceIds(String.join(",", args.getOptionValues(OIDS)))
                : List.copyOf(new TreeSet<>(defaultDeviceIds));
        if (deviceIds.isEmpty()) {
            throw new IllegalArgumentException("No device ids: pass --oids or set tracksync.sync.device-ids");
        }

        LocalDateTime from = time(args, FROM);
        LocalDateTime to = time(args, TO);
        Integer chunkHours = null;
        String chunk = single(args, CHUNK_HOURS);
        if (chunk != null) {
            try {
                chunkHours = Integer.parseInt(chunk.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--chunk-hours must be an integer, got '" + chunk + "'", e);
            }
        }
        return new SyncCommand(deviceIds, from, to, chunkHours, args.containsOption(RESET_STATE));
    }

    /**
     * Comma, semicolon or whitespace separated ids; duplicates removed, ascending.
     */
    public static List<Long> parseDeviceIds(String text) {
        Set<Long> ids = new TreeSet<>();
        if (text == null) {
            return List.of();
        }
        for (String token : text.split("[,;\\s]+")) {
            if (token.isBlank()) {
                continue;
            }
            try {
                ids.add(Long.parseLong(token.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Device id is not a number: '" + token + "'", e);
            }
        }
        return List.copyOf(ids);
    }

    private static LocalDateTime time(ApplicationArguments args, String option) {
        String value = single(args, option);
        return value == null || value.isBlank() ? null : PortalTimes.parse(value);
    }

    private static String single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
