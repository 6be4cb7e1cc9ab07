package com.volovo.tracksync.config;

import com.volovo.tracksync.service.SyncCommand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SyncArgumentsTest {

    @Test
    @DisplayName("Full option set maps onto the command")
    void fullOptions() {
        SyncCommand command = SyncArguments.toCommand(new DefaultApplicationArguments(
                "--sync", "--oids=716,182", "--from=2026-02-01 00:00:00", "--to=2026-02-02T00:00:00",
                "--chunk-hours=12", "--reset-state"), List.of());

        assertThat(command.deviceIds()).containsExactly(182L, 716L);
        assertThat(command.from()).isEqualTo(LocalDateTime.of(2026, 2, 1, 0, 0));
        assertThat(command.to()).isEqualTo(LocalDateTime.of(2026, 2, 2, 0, 0));
        assertThat(command.chunkHours()).isEqualTo(12);
        assertThat(command.resetState()).isTrue();
    }

    @Test
    @DisplayName("Without --oids the configured devices are used")
    void configuredDevices() {
        SyncCommand command = SyncArguments.toCommand(new DefaultApplicationArguments("--sync"), List.of(716L, 182L, 716L));

        assertThat(command.deviceIds()).containsExactly(182L, 716L);
        assertThat(command.from()).isNull();
        assertThat(command.chunkHours()).isNull();
        assertThat(command.resetState()).isFalse();
    }

    @Test
    @DisplayName("Device ids accept commas, semicolons and blanks; duplicates collapse")
    void parseDeviceIds() {
        assertThat(SyncArguments.parseDeviceIds(" 716; 182,  716 5")).containsExactly(5L, 182L, 716L);
        assertThat(SyncArguments.parseDeviceIds("")).isEmpty();
        assertThat(SyncArguments.parseDeviceIds(null)).isEmpty();
        assertThatThrownBy(() -> SyncArguments.parseDeviceIds("182,abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("abc");
    }

    @Test
    @DisplayName("Invalid combinations are rejected")
    void invalidArguments() {
        assertThatThrownBy(() -> SyncArguments.toCommand(new DefaultApplicationArguments("--sync"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncArguments.toCommand(new DefaultApplicationArguments(
                "--oids=1", "--chunk-hours=six"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncArguments.toCommand(new DefaultApplicationArguments(
                "--oids=1", "--chunk-hours=0"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncArguments.toCommand(new DefaultApplicationArguments(
                "--oids=1", "--from=2026-02-02 00:00:00", "--to=2026-02-01 00:00:00"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Only --sync triggers a one-shot run")
    void syncFlag() {
        assertThat(SyncArguments.isSyncRequested(new DefaultApplicationArguments("--sync"))).isTrue();
        assertThat(SyncArguments.isSyncRequested(new DefaultApplicationArguments("--oids=1"))).isFalse();
    }
}
