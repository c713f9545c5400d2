package com.rowbase.common.status;

/**
 * Kinds of outcome a database operation can report. The names follow the gRPC canonical codes so
 * that callers exposing the library over RPC can map them one to one.
 */
public enum StatusCode {
    OK,
    INVALID_ARGUMENT,    // bad input, or a required column read back as NULL
    NOT_FOUND,           // no row with the requested identifier
    ALREADY_EXISTS,      // unique constraint violation
    FAILED_PRECONDITION, // other constraint violations, missing table
    ABORTED,             // serialization failure or deadlock
    INTERNAL,            // any other backend failure
    UNAVAILABLE;         // connection failure

    /**
     * Returns whether this status code represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return !isSuccess();
    }

    /**
     * Classifies a SQLState as reported by the JDBC driver.
     *
     * @param sqlState the five character SQLState, may be null
     * @return the closest matching StatusCode, INTERNAL when nothing more specific applies
     */
    public static StatusCode fromSqlState(String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return INTERNAL;
        }
        switch (sqlState) {
            case "23505": return ALREADY_EXISTS;
            case "40001": return ABORTED; // serialization_failure
            case "40P01": return ABORTED; // deadlock_detected
            case "42P01": return FAILED_PRECONDITION; // undefined_table
            default:
                break;
        }
        switch (sqlState.substring(0, 2)) {
            case "23": return FAILED_PRECONDITION;
            case "08": return UNAVAILABLE;
            default: return INTERNAL;
        }
    }
}
