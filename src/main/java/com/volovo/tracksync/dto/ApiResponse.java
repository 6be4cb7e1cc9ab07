package com.volovo.tracksync.dto;

import lombok.*;

/**
 * Envelope of every HTTP response.
 *
 *   ApiResponse.success(data, message)
 *   ApiResponse.error(message)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiResponse {

    private boolean success;
    private String message;
    private Object data;

    public static ApiResponse success(Object data, String message) {
        return new ApiResponse(true, message, data);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse(false, message, null);
    }

    public static ApiResponse error(String message, Object data) {
        return new ApiResponse(false, message, data);
    }
}
