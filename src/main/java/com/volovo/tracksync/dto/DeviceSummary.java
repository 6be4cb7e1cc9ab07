package com.volovo.tracksync.dto;

public record DeviceSummary(long deviceId, long pointCount) {
}
