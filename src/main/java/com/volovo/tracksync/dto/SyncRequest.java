package com.volovo.tracksync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/sync}. Every field is optional: without {@code oids}
 * the configured devices are synced, without bounds the cursors decide.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    private List<Long> oids;

    @JsonProperty("dt_from")
    private String dtFrom;

    @JsonProperty("dt_to")
    private String dtTo;

    @Min(value = 1, message = "chunk_hours must be at least 1")
    @Max(value = 744, message = "chunk_hours must be at most 744")
    @JsonProperty("chunk_hours")
    private Integer chunkHours;

    @JsonProperty("reset_state")
    private boolean resetState;
}
