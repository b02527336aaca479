package com.parceltrack.db;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Represents a row in the 'parcel' table.
 *
 * <p>The status is kept as the raw stored token so that rows holding an unrecognised value can
 * still be loaded and reported.
 *
 * @param number The store-assigned identifier; 0 before insertion
 * @param client The identifier of the owning client
 * @param status The stored status token, normally one of {@link ParcelStatus}
 * @param address The delivery address
 * @param createdAt The creation timestamp as text
 */
public record Parcel(int number, int client, String status, String address, String createdAt) {

  /**
   * Creates a new, not yet persisted, registered parcel stamped with the current UTC time.
   */
  public static Parcel create(int client, String address) {
    return create(client, address, Instant.now());
  }

  /** Creates a new, not yet persisted, registered parcel with the given creation time. */
  public static Parcel create(int client, String address, Instant createdAt) {
    return new Parcel(
        0,
        client,
        ParcelStatus.REGISTERED.toDatabaseValue(),
        address,
        createdAt.truncatedTo(ChronoUnit.SECONDS).toString());
  }

  /** Returns a copy of this parcel with the given number, as assigned on insertion. */
  public Parcel withNumber(int newNumber) {
    return new Parcel(newNumber, client, status, address, createdAt);
  }

  /** Returns a copy of this parcel with the given status token. */
  public Parcel withStatus(String newStatus) {
    return new Parcel(number, client, newStatus, address, createdAt);
  }

  /** Returns a copy of this parcel with the given address. */
  public Parcel withAddress(String newAddress) {
    return new Parcel(number, client, status, newAddress, createdAt);
  }

  /** The parsed status, or empty if the stored token is not recognised. */
  public Optional<ParcelStatus> recognisedStatus() {
    return ParcelStatus.fromDatabaseValue(status);
  }
}
