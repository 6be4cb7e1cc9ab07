package com.volovo.tracksync.portal;

/**
 * Raw answer of a track request, classified by the fetcher.
 */
public record PortalResponse(int statusCode, String contentType, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isJson() {
        return contentType != null && contentType.toLowerCase().contains("json");
    }

    /** Leading part of the body for diagnostics */
    public String head() {
        if (body == null) {
            return "";
        }
        String flat = body.replace('\n', ' ');
        return flat.length() > 300 ? flat.substring(0, 300) : flat;
    }
}
