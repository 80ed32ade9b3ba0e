/**
 * Error handling and status reporting for the Room store.
 *
 * <ul>
 *   <li>{@link com.roommates.common.status.StatusCode} - the codes a store operation can report
 *   <li>{@link com.roommates.common.status.Status} - a code with an optional message and cause
 *   <li>{@link com.roommates.common.status.StatusOr} - either a value or a non-OK status
 * </ul>
 *
 * <p>A failed JDBC call becomes a non-OK status whose cause is the driver's exception, so the
 * caller still sees exactly what the database reported:
 *
 * <pre>
 * StatusOr&lt;Integer&gt; deleted = store.delete(roomId);
 * if (deleted.isNotOk()
 *     &amp;&amp; deleted.getStatus().getCode() == StatusCode.FAILED_PRECONDITION) {
 *   // a roommate still references the room
 * }
 * </pre>
 */
package com.roommates.common.status;
