package com.roommates.common.status;

import java.sql.SQLException;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Represents the status of an operation, possibly with the exception that caused it. A failed
 * database call keeps the driver's {@link SQLException} as its cause unchanged.
 */
public class Status {
  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  /** Creates a new OK status. */
  public static Status ok() {
    return new Status(StatusCode.OK, null, null);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** Creates a new UNAVAILABLE status with the given message and cause. */
  public static Status unavailable(String message, Throwable cause) {
    return new Status(StatusCode.UNAVAILABLE, message, cause);
  }

  /**
   * Creates a status for a failed JDBC call. The code is derived from the exception's SQLSTATE and
   * the exception itself is kept as the cause.
   */
  public static Status fromSqlException(@Nonnull SQLException e) {
    return new Status(StatusCode.fromSqlState(e.getSQLState()), e.getMessage(), e);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code != StatusCode.OK;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
