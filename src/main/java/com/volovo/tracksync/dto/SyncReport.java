package com.volovo.tracksync.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of one sync run across devices.
 */
@Value
@Builder
public class SyncReport {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ALL_FAILED = 1;
    public static final int EXIT_BAD_ARGUMENTS = 2;
    public static final int EXIT_AUTHENTICATION_FAILED = 3;

    LocalDateTime startedAt;
    LocalDateTime finishedAt;

    @Singular
    List<DeviceSyncResult> devices;

    /** Set when the run stopped because no portal session could be obtained */
    String authenticationError;

    public boolean isAuthenticationFailed() {
        return authenticationError != null;
    }

    public int getTotalFetched() {
        return devices.stream().mapToInt(DeviceSyncResult::getFetched).sum();
    }

    public int getTotalMatched() {
        return devices.stream().mapToInt(DeviceSyncResult::getMatched).sum();
    }

    public int getTotalInserted() {
        return devices.stream().mapToInt(DeviceSyncResult::getInserted).sum();
    }

    public int getFailedDevices() {
        return (int) devices.stream().filter(DeviceSyncResult::isFailed).count();
    }

    /**
     * 0 when at least one device synced, 1 when all failed, 3 on authentication failure.
     */
    public int exitCode() {
        if (isAuthenticationFailed()) {
            return EXIT_AUTHENTICATION_FAILED;
        }
        if (!devices.isEmpty() && getFailedDevices() == devices.size()) {
            return EXIT_ALL_FAILED;
        }
        return EXIT_OK;
    }
}
