package com.roommates.common.status;

/**
 * Status codes reported by the data-access layer. The names follow the gRPC status vocabulary so
 * that a caller exposing the store over any transport can map them directly.
 */
public enum StatusCode {
    OK,
    INVALID_ARGUMENT,    // Caller passed something unusable, e.g. a null record
    FAILED_PRECONDITION, // Constraint violation reported by the database
    UNAVAILABLE,         // Connection could not be obtained or was lost
    INTERNAL;

    /** SQLSTATE class for connection exceptions. */
    private static final String SQL_STATE_CONNECTION_CLASS = "08";

    /** SQLSTATE class for integrity constraint violations. */
    private static final String SQL_STATE_CONSTRAINT_CLASS = "23";

    /**
     * Maps a five character SQLSTATE to the closest matching StatusCode. Only the two character
     * class prefix is inspected.
     *
     * @param sqlState the SQLSTATE reported by the driver, may be null
     * @return the corresponding StatusCode, INTERNAL when the class is unknown
     */
    public static StatusCode fromSqlState(String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return INTERNAL;
        }
        switch (sqlState.substring(0, 2)) {
            case SQL_STATE_CONNECTION_CLASS: return UNAVAILABLE;
            case SQL_STATE_CONSTRAINT_CLASS: return FAILED_PRECONDITION;
            default: return INTERNAL;
        }
    }
}
