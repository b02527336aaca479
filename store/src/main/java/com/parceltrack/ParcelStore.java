package com.parceltrack;

import com.parceltrack.common.status.ErrorReason;
import com.parceltrack.common.status.Status;
import com.parceltrack.common.status.StatusOr;
import com.parceltrack.config.DatabaseConfig;
import com.parceltrack.db.Parcel;
import com.parceltrack.db.ParcelStatus;
import com.parceltrack.db.Parcels;
import com.parceltrack.db.util.DbUtil;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * Guarded CRUD operations on parcels.
 *
 * <p>The store holds no state of its own beyond its {@link Config}; every operation borrows a
 * connection from the configured data source and returns it before completing, so one instance
 * may be shared freely between threads.
 *
 * <h2>Invariants</h2>
 *
 * <ul>
 *   <li>A parcel's status only moves one step forward: registered, sent, delivered.
 *   <li>A parcel's address may be changed, and the parcel deleted, only while it is registered.
 * </ul>
 *
 * <p>Guarded operations read the stored status, check it, and then write with the same check
 * repeated in the statement's WHERE clause. If another caller changed the row in between, the
 * write matches nothing and the operation fails with {@link ErrorReason#CONCURRENT_MODIFICATION}
 * rather than acting on stale state.
 *
 * <h2>Error Handling</h2>
 *
 * <p>No operation throws for an expected failure. Results carry a {@link Status} whose
 * {@link ErrorReason} identifies the failure and whose metadata names the parcel number and the
 * statuses involved. A missing or closed data source is reported as
 * {@link ErrorReason#NO_CONNECTION} before any other validation.
 */
public class ParcelStore {
  private final Config config;

  /**
   * Store configuration.
   *
   * @param dataSource the connection source; a null value leaves the store unbound
   * @param queryTimeout the timeout applied to every statement, or zero for none
   */
  public record Config(DataSource dataSource, Duration queryTimeout) {
    public Config {
      queryTimeout = queryTimeout == null ? Duration.ZERO : queryTimeout;
    }

    public Config(DataSource dataSource) {
      this(dataSource, Duration.ZERO);
    }

    /** Builds a store config from the database settings and the pool created from them. */
    public static Config from(DatabaseConfig databaseConfig, DataSource dataSource) {
      return new Config(dataSource, databaseConfig.queryTimeout());
    }
  }

  public ParcelStore(Config config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Returns a store over the same data source whose statements use the given timeout. This is
   * the way to bound a single operation: {@code store.withTimeout(Duration.ofSeconds(2)).get(n)}.
   */
  @Nonnull
  public ParcelStore withTimeout(Duration timeout) {
    return new ParcelStore(new Config(config.dataSource(), timeout));
  }

  /**
   * Inserts a new parcel. The caller supplies client, status, address and creation time; the
   * number on the given parcel is ignored.
   *
   * <p>Any of the three known statuses is accepted as a starting value. The forward-only rule
   * governs updates, not creation.
   *
   * @return the generated parcel number, or NO_CONNECTION, NEW_STATUS_UNRECOGNISED or
   *     STORAGE_FAILURE
   */
  @Nonnull
  public StatusOr<Integer> add(Parcel parcel) {
    Status connection = checkConnection();
    if (connection.isError()) {
      return StatusOr.ofStatus(report(connection));
    }

    if (ParcelStatus.fromDatabaseValue(parcel.status()).isEmpty()) {
      Status rejected =
          Status.of(
                  ErrorReason.NEW_STATUS_UNRECOGNISED,
                  String.format(
                      "failed to add parcel for client %d: unrecognised new status \"%s\"",
                      parcel.client(), parcel.status()))
              .withMetadata("client", parcel.client())
              .withMetadata("requested_status", String.valueOf(parcel.status()));
      return StatusOr.ofStatus(report(rejected));
    }

    Logger.debug("Adding parcel for client {}", parcel.client());
    StatusOr<Integer> numberOr =
        withConnection(conn -> Parcels.insert(conn, parcel, config.queryTimeout()));
    if (numberOr.isNotOk()) {
      return StatusOr.ofStatus(
          report(
              numberOr
                  .getStatus()
                  .annotate("failed to add parcel for client " + parcel.client())
                  .withMetadata("client", parcel.client())));
    }
    Logger.debug("Added parcel {} for client {}", numberOr.getValue(), parcel.client());
    return numberOr;
  }

  /**
   * Loads a parcel by number.
   *
   * @return the parcel, or NO_CONNECTION, NOT_FOUND or STORAGE_FAILURE
   */
  @Nonnull
  public StatusOr<Parcel> get(int number) {
    Status connection = checkConnection();
    if (connection.isError()) {
      return StatusOr.ofStatus(report(connection));
    }

    StatusOr<Parcel> parcelOr =
        withConnection(
            conn ->
                Parcels.loadByNumber(conn, number, config.queryTimeout())
                    .flatMap(found -> requirePresent(found, number)));
    if (parcelOr.isNotOk()) {
      return StatusOr.ofStatus(
          report(
              parcelOr
                  .getStatus()
                  .annotate("failed to get parcel " + number)
                  .withMetadata("number", number)));
    }
    return parcelOr;
  }

  /**
   * Loads every parcel owned by a client, in no particular order. A client with no parcels
   * yields an empty list.
   */
  @Nonnull
  public StatusOr<List<Parcel>> getByClient(int client) {
    Status connection = checkConnection();
    if (connection.isError()) {
      return StatusOr.ofStatus(report(connection));
    }

    StatusOr<List<Parcel>> parcelsOr =
        withConnection(
            conn -> Parcels.loadByClient(conn, client, config.queryTimeout()));
    if (parcelsOr.isNotOk()) {
      return StatusOr.ofStatus(
          report(
              parcelsOr
                  .getStatus()
                  .annotate("failed to get parcels for client " + client)
                  .withMetadata("client", client)));
    }
    return parcelsOr;
  }

  /**
   * Moves a parcel to the next status.
   *
   * <p>Checks, in order: the parcel exists; the new status is recognised; the stored status is
   * recognised; the new status is exactly one step after the stored one. A row holding an
   * unrecognised status is left untouched and must be repaired by hand.
   *
   * @return OK, or NO_CONNECTION, NOT_FOUND, NEW_STATUS_UNRECOGNISED, STORED_STATUS_UNRECOGNISED,
   *     INVALID_STATUS_TRANSITION, CONCURRENT_MODIFICATION or STORAGE_FAILURE
   */
  @Nonnull
  public Status setStatus(int number, String newStatus) {
    Status connection = checkConnection();
    if (connection.isError()) {
      return report(connection);
    }

    Logger.debug("Setting status of parcel {} to {}", number, newStatus);
    StatusOr<Integer> rowsOr =
        withConnection(
            conn -> {
              StatusOr<String> storedOr = loadStoredStatus(conn, number);
              if (storedOr.isNotOk()) {
                return StatusOr.ofStatus(storedOr.getStatus());
              }
              String stored = storedOr.getValue();
              Status transition = StatusTransitions.check(number, stored, newStatus);
              if (transition.isError()) {
                return StatusOr.ofStatus(transition);
              }
              return Parcels.updateStatus(conn, number, stored, newStatus, config.queryTimeout());
            });
    return finishGuardedWrite(rowsOr, number, "update status");
  }

  /**
   * Changes a registered parcel's address.
   *
   * @return OK, or NO_CONNECTION, NOT_FOUND, REQUIRE_REGISTERED_STATUS, CONCURRENT_MODIFICATION
   *     or STORAGE_FAILURE
   */
  @Nonnull
  public Status setAddress(int number, String newAddress) {
    Status connection = checkConnection();
    if (connection.isError()) {
      return report(connection);
    }

    Logger.debug("Setting address of parcel {}", number);
    StatusOr<Integer> rowsOr =
        withConnection(
            conn -> {
              Status guard = requireRegistered(conn, number);
              if (guard.isError()) {
                return StatusOr.ofStatus(guard);
              }
              return Parcels.updateAddress(
                  conn,
                  number,
                  ParcelStatus.REGISTERED.toDatabaseValue(),
                  newAddress,
                  config.queryTimeout());
            });
    return finishGuardedWrite(rowsOr, number, "update address");
  }

  /**
   * Deletes a registered parcel.
   *
   * @return OK, or NO_CONNECTION, NOT_FOUND, REQUIRE_REGISTERED_STATUS, CONCURRENT_MODIFICATION
   *     or STORAGE_FAILURE
   */
  @Nonnull
  public Status delete(int number) {
    Status connection = checkConnection();
    if (connection.isError()) {
      return report(connection);
    }

    Logger.debug("Deleting parcel {}", number);
    StatusOr<Integer> rowsOr =
        withConnection(
            conn -> {
              Status guard = requireRegistered(conn, number);
              if (guard.isError()) {
                return StatusOr.ofStatus(guard);
              }
              return Parcels.delete(
                  conn, number, ParcelStatus.REGISTERED.toDatabaseValue(), config.queryTimeout());
            });
    return finishGuardedWrite(rowsOr, number, "delete parcel");
  }

  private Status checkConnection() {
    DataSource dataSource = config.dataSource();
    if (dataSource == null) {
      return Status.of(ErrorReason.NO_CONNECTION, "no database connection");
    }
    if (dataSource instanceof HikariDataSource && ((HikariDataSource) dataSource).isClosed()) {
      return Status.of(ErrorReason.NO_CONNECTION, "database connection pool is closed");
    }
    return Status.ok();
  }

  private StatusOr<String> loadStoredStatus(Connection conn, int number) {
    return Parcels.loadStatus(conn, number, config.queryTimeout())
        .flatMap(found -> requirePresent(found, number));
  }

  private Status requireRegistered(Connection conn, int number) {
    StatusOr<String> storedOr = loadStoredStatus(conn, number);
    if (storedOr.isNotOk()) {
      return storedOr.getStatus();
    }
    String stored = storedOr.getValue();
    Optional<ParcelStatus> parsed = ParcelStatus.fromDatabaseValue(stored);
    if (parsed.isPresent() && parsed.get() == ParcelStatus.REGISTERED) {
      return Status.ok();
    }
    return Status.of(
            ErrorReason.REQUIRE_REGISTERED_STATUS,
            String.format(
                "requires registered status (parcel %d has status \"%s\")", number, stored))
        .withMetadata("number", number)
        .withMetadata("stored_status", stored);
  }

  private Status finishGuardedWrite(StatusOr<Integer> rowsOr, int number, String action) {
    if (rowsOr.isNotOk()) {
      return report(
          rowsOr.getStatus().annotate("failed to " + action).withMetadata("number", number));
    }
    if (rowsOr.getValue() == 0) {
      return report(
          Status.of(
                  ErrorReason.CONCURRENT_MODIFICATION,
                  String.format(
                      "failed to %s: parcel %d was modified concurrently", action, number))
              .withMetadata("number", number));
    }
    Logger.debug("Parcel {}: {} done", number, action);
    return Status.ok();
  }

  private static <T> StatusOr<T> requirePresent(Optional<T> found, int number) {
    if (found.isPresent()) {
      return StatusOr.ofValue(found.get());
    }
    return StatusOr.ofStatus(
        Status.notFound("parcel " + number + " not found").withMetadata("number", number));
  }

  private <T> StatusOr<T> withConnection(ConnectionFunction<T> work) {
    try (Connection conn = config.dataSource().getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus("Database connection error", e));
    }
  }

  private static Status report(Status status) {
    if (status.is(ErrorReason.STORAGE_FAILURE) && status.getCause() != null) {
      Logger.error(status.getCause(), "{}", status);
    } else if (status.is(ErrorReason.STORAGE_FAILURE) || status.is(ErrorReason.NO_CONNECTION)) {
      Logger.error("{}", status);
    } else {
      Logger.warn("{}", status);
    }
    return status;
  }

  @FunctionalInterface
  private interface ConnectionFunction<T> {
    StatusOr<T> apply(Connection conn);
  }
}
