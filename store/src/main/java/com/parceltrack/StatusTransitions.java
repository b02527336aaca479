package com.parceltrack;

import com.parceltrack.common.status.ErrorReason;
import com.parceltrack.common.status.Status;
import com.parceltrack.db.ParcelStatus;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * The parcel status state machine.
 *
 * <pre>
 *   registered --&gt; sent --&gt; delivered
 * </pre>
 *
 * <p>The only legal move is one step forward. Delivered is terminal. A stored token outside
 * {@link ParcelStatus} is a sink: nothing leaves it until the row is repaired by hand.
 */
public final class StatusTransitions {

  private StatusTransitions() {
    // Utility class
  }

  /**
   * Checks whether a parcel holding {@code storedStatus} may move to {@code requestedStatus}.
   *
   * <p>The requested token is validated before the stored one, and both are resolved against
   * {@link ParcelStatus} before any rank arithmetic is done.
   *
   * @param number the parcel number, reported in the failure metadata
   * @param storedStatus the token currently persisted
   * @param requestedStatus the token the caller asked for
   * @return OK, or a status with reason NEW_STATUS_UNRECOGNISED, STORED_STATUS_UNRECOGNISED or
   *     INVALID_STATUS_TRANSITION
   */
  @Nonnull
  public static Status check(int number, String storedStatus, String requestedStatus) {
    Optional<ParcelStatus> requested = ParcelStatus.fromDatabaseValue(requestedStatus);
    if (requested.isEmpty()) {
      return failure(
          ErrorReason.NEW_STATUS_UNRECOGNISED,
          String.format("unrecognised new status \"%s\" for parcel %d", requestedStatus, number),
          number, storedStatus, requestedStatus);
    }

    Optional<ParcelStatus> stored = ParcelStatus.fromDatabaseValue(storedStatus);
    if (stored.isEmpty()) {
      return failure(
          ErrorReason.STORED_STATUS_UNRECOGNISED,
          String.format("unrecognised stored status \"%s\" for parcel %d", storedStatus, number),
          number, storedStatus, requestedStatus);
    }

    if (!requested.get().isNextAfter(stored.get())) {
      return failure(
          ErrorReason.INVALID_STATUS_TRANSITION,
          String.format(
              "invalid status transition \"%s\" -> \"%s\" for parcel %d",
              storedStatus, requestedStatus, number),
          number, storedStatus, requestedStatus);
    }
    return Status.ok();
  }

  private static Status failure(
      ErrorReason reason, String message, int number, String stored, String requested) {
    return Status.of(reason, message)
        .withMetadata("number", number)
        .withMetadata("stored_status", String.valueOf(stored))
        .withMetadata("requested_status", String.valueOf(requested));
  }
}
