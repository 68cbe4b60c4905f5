package com.asrayaos.firstflame.supabase;

/**
 * A store call that was rejected by Supabase or never reached it.
 * The status code is {@code -1} when no HTTP response was received (connect failure, timeout).
 */
public class SupabaseException extends Exception {

    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    private final String responseBody;

    public SupabaseException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public SupabaseException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean hasResponse() {
        return statusCode != NO_RESPONSE;
    }

    /**
     * Storage reports a missing object either as a plain 404 or as a 400 whose
     * body carries {@code "error":"not_found"}.
     */
    public boolean isObjectNotFound() {
        if (statusCode == 404) {
            return true;
        }
        if (statusCode == 400 && responseBody != null) {
            return responseBody.contains("not_found") || responseBody.contains("Object not found");
        }
        return false;
    }
}
