/**
 * Error values returned by every database operation.
 *
 * <p>Repository calls never throw for expected failures. They return either a {@link
 * com.rowbase.common.status.Status} or a {@link com.rowbase.common.status.StatusOr}:
 *
 * <ul>
 *   <li>{@link com.rowbase.common.status.StatusCode} - the kind of failure
 *   <li>{@link com.rowbase.common.status.Status} - a code with an optional message and cause
 *   <li>{@link com.rowbase.common.status.StatusOr} - either a value or a non-OK status
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;User&gt; userOr = users.findExistingById(conn, userId);
 * if (userOr.isNotOk()) {
 *     if (userOr.getStatus().getCode() == StatusCode.NOT_FOUND) {
 *         // the row is gone
 *     }
 *     Logger.error("Lookup failed: {}", userOr.getStatus());
 *     return;
 * }
 * User user = userOr.getValue();
 * </pre>
 */
package com.rowbase.common.status;
