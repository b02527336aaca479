package com.parceltrack.common.status;

import com.google.common.collect.ImmutableMap;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Represents the status of an operation, possibly with additional error details. This class is
 * modelled on the gRPC Status and ErrorInfo concepts: a transport-level {@link StatusCode}, a
 * domain-level {@link ErrorReason}, and a metadata map carrying the identifiers involved.
 */
public class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null, null, ImmutableMap.of());

  private final StatusCode code;
  private final ErrorReason reason;
  private final String message;
  private final Throwable cause;
  private final ImmutableMap<String, String> metadata;

  private Status(
      StatusCode code,
      ErrorReason reason,
      String message,
      Throwable cause,
      ImmutableMap<String, String> metadata) {
    this.code = Objects.requireNonNull(code);
    if (code.isSuccess() != (reason == null)) {
      throw new IllegalArgumentException("An error status requires a reason and OK must not have one");
    }
    this.reason = reason;
    this.message = message;
    this.cause = cause;
    this.metadata = metadata;
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates an error status reported under the reason's default code. */
  public static Status of(@Nonnull ErrorReason reason, String message) {
    return new Status(reason.defaultCode(), reason, message, null, ImmutableMap.of());
  }

  /** Creates an error status with a cause, reported under the reason's default code. */
  public static Status of(@Nonnull ErrorReason reason, String message, Throwable cause) {
    return new Status(reason.defaultCode(), reason, message, cause, ImmutableMap.of());
  }

  /** Creates an error status with an explicit code. */
  public static Status of(
      @Nonnull StatusCode code, @Nonnull ErrorReason reason, String message, Throwable cause) {
    return new Status(code, reason, message, cause, ImmutableMap.of());
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return of(ErrorReason.NOT_FOUND, message);
  }

  /** Creates a new STORAGE_FAILURE status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return of(ErrorReason.STORAGE_FAILURE, message, cause);
  }

  /**
   * Returns a copy of this status with one more metadata entry. A later value for the same key
   * replaces the earlier one.
   */
  @Nonnull
  public Status withMetadata(@Nonnull String key, @Nonnull Object value) {
    if (isOk()) {
      throw new IllegalStateException("Metadata can only be attached to an error status");
    }
    ImmutableMap<String, String> merged =
        ImmutableMap.<String, String>builder()
            .putAll(metadata)
            .put(key, String.valueOf(value))
            .buildKeepingLast();
    return new Status(code, reason, message, cause, merged);
  }

  /**
   * Returns a copy of this status whose message is prefixed with the given context, e.g. the
   * operation that was being performed when the failure occurred.
   */
  @Nonnull
  public Status annotate(@Nonnull String context) {
    if (isOk()) {
      return this;
    }
    String annotated = message == null ? context : context + ": " + message;
    return new Status(code, reason, annotated, cause, metadata);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the reason for this status, or null if the status is OK. */
  @Nullable
  public ErrorReason getReason() {
    return reason;
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns the metadata attached to this status; empty for OK. */
  @Nonnull
  public ImmutableMap<String, String> getMetadata() {
    return metadata;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return !code.isSuccess();
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code.isSuccess();
  }

  /** Returns true if this status failed for the given reason. */
  public boolean is(@Nonnull ErrorReason expected) {
    return reason == expected;
  }

  @Override
  public String toString() {
    if (isOk()) {
      return code.toString();
    }
    StringBuilder sb = new StringBuilder().append(code).append('[').append(reason).append(']');
    if (message != null) {
      sb.append(": ").append(message);
    }
    if (!metadata.isEmpty()) {
      sb.append(' ').append(metadata);
    }
    return sb.toString();
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
        && reason == other.reason
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause)
        && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, reason, message, cause, metadata);
  }
}
