package com.parceltrack.db;

import java.util.Optional;

/**
 * Lifecycle statuses of a parcel, in the order a parcel moves through them.
 *
 * <p>IMPORTANT: The database values are stored verbatim in parcel.status. A value outside this
 * enum marks a corrupt row.
 */
public enum ParcelStatus {
  REGISTERED("registered", 0),
  SENT("sent", 1),
  DELIVERED("delivered", 2);

  private final String databaseValue;
  private final int rank;

  ParcelStatus(String databaseValue, int rank) {
    this.databaseValue = databaseValue;
    this.rank = rank;
  }

  /**
   * Converts the enum to its string representation for database storage.
   *
   * @return The string value for database storage
   */
  public String toDatabaseValue() {
    return databaseValue;
  }

  /** Position of this status in the forward sequence, starting at 0. */
  public int rank() {
    return rank;
  }

  /** Returns true if this status is exactly one step after {@code stored}. */
  public boolean isNextAfter(ParcelStatus stored) {
    return rank - stored.rank == 1;
  }

  /** The status that follows this one, or empty for the terminal status. */
  public Optional<ParcelStatus> next() {
    for (ParcelStatus candidate : values()) {
      if (candidate.isNextAfter(this)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  /**
   * Looks up a status by its database string representation.
   *
   * @param value The database string value, possibly null
   * @return The matching status, or empty if the value is not recognised
   */
  public static Optional<ParcelStatus> fromDatabaseValue(String value) {
    for (ParcelStatus status : values()) {
      if (status.databaseValue.equals(value)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
