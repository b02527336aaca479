package com.parceltrack.common.status;

/**
 * The closed set of reasons a parcel store operation can fail for.
 *
 * <p>Callers branch on the reason rather than on message text. Each reason carries the
 * {@link StatusCode} it is reported under by default; two reasons may share a code.
 */
public enum ErrorReason {
  /** The store was invoked without a live database handle. */
  NO_CONNECTION(StatusCode.UNAVAILABLE),

  /** A caller-supplied status is outside the known set. */
  NEW_STATUS_UNRECOGNISED(StatusCode.INVALID_ARGUMENT),

  /** A persisted status read back during a guarded operation is outside the known set. */
  STORED_STATUS_UNRECOGNISED(StatusCode.DATA_LOSS),

  /** The requested status is not exactly one step forward from the stored one. */
  INVALID_STATUS_TRANSITION(StatusCode.FAILED_PRECONDITION),

  /** An address update or deletion was attempted on a parcel that is no longer registered. */
  REQUIRE_REGISTERED_STATUS(StatusCode.FAILED_PRECONDITION),

  /** No parcel exists for the given number. */
  NOT_FOUND(StatusCode.NOT_FOUND),

  /** A guarded write matched no row because the parcel changed after the guard was checked. */
  CONCURRENT_MODIFICATION(StatusCode.ABORTED),

  /** The underlying database failed. */
  STORAGE_FAILURE(StatusCode.INTERNAL);

  private final StatusCode defaultCode;

  ErrorReason(StatusCode defaultCode) {
    this.defaultCode = defaultCode;
  }

  public StatusCode defaultCode() {
    return defaultCode;
  }
}
