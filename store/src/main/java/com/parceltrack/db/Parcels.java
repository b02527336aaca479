package com.parceltrack.db;

import com.parceltrack.common.status.ErrorReason;
import com.parceltrack.common.status.Status;
import com.parceltrack.common.status.StatusOr;
import com.parceltrack.db.util.DbUtil;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * DAO helper class for the 'parcel' table.
 *
 * <p>The update and delete methods take the status the row is expected to hold and only touch
 * the row while it still holds it. Callers compare the returned row count against 1 to detect
 * that the row changed underneath them.
 */
public final class Parcels {

    private Parcels() {
        // Utility class
    }

    /**
     * Inserts a new parcel. The number on the given parcel is ignored.
     *
     * @param conn an open JDBC connection
     * @param parcel the parcel to insert
     * @param timeout the statement timeout, or zero for none
     * @return StatusOr containing the generated parcel number or an error
     */
    @Nonnull
    public static StatusOr<Integer> insert(Connection conn, Parcel parcel, Duration timeout) {
        String sql = """
                INSERT INTO parcel (client, status, address, created_at)
                VALUES (?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql, new String[] {"number"})) {
            DbUtil.applyTimeout(stmt, timeout);
            stmt.setInt(1, parcel.client());
            stmt.setString(2, parcel.status());
            stmt.setString(3, parcel.address());
            stmt.setString(4, parcel.createdAt());
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    return StatusOr.ofStatus(
                            Status.of(ErrorReason.STORAGE_FAILURE, "No generated key returned"));
                }
                return StatusOr.ofValue(keys.getInt(1));
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Insert failed", e));
        }
    }

    /**
     * Loads a single parcel by number.
     *
     * @param conn an open JDBC connection
     * @param number the parcel number
     * @param timeout the statement timeout, or zero for none
     * @return StatusOr containing an Optional Parcel or an error
     */
    @Nonnull
    public static StatusOr<Optional<Parcel>> loadByNumber(Connection conn, int number, Duration timeout) {
        String sql = """
                SELECT number, client, status, address, created_at
                  FROM parcel
                 WHERE number = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            DbUtil.applyTimeout(stmt, timeout);
            stmt.setInt(1, number);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return extractParcel(rs).map(Optional::of);
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Select failed", e));
        }
    }

    /**
     * Loads all parcels owned by a client.
     *
     * @param conn an open JDBC connection
     * @param client the client identifier
     * @param timeout the statement timeout, or zero for none
     * @return StatusOr containing the (possibly empty) list of parcels or an error
     */
    @Nonnull
    public static StatusOr<List<Parcel>> loadByClient(Connection conn, int client, Duration timeout) {
        String sql = """
                SELECT number, client, status, address, created_at
                  FROM parcel
                 WHERE client = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            DbUtil.applyTimeout(stmt, timeout);
            stmt.setInt(1, client);
            try (ResultSet rs = stmt.executeQuery()) {
                ImmutableList.Builder<Parcel> result = ImmutableList.builder();
                while (rs.next()) {
                    StatusOr<Parcel> parcelOr = extractParcel(rs);
                    if (parcelOr.isNotOk()) {
                        return StatusOr.ofStatus(parcelOr.getStatus());
                    }
                    result.add(parcelOr.getValue());
                }
                return StatusOr.ofValue(result.build());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Select failed", e));
        }
    }

    /**
     * Loads only the stored status token of a parcel.
     *
     * @param conn an open JDBC connection
     * @param number the parcel number
     * @param timeout the statement timeout, or zero for none
     * @return StatusOr containing the stored token, empty if there is no such parcel, or an error
     */
    @Nonnull
    public static StatusOr<Optional<String>> loadStatus(Connection conn, int number, Duration timeout) {
        String sql = """
                SELECT status
                  FROM parcel
                 WHERE number = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            DbUtil.applyTimeout(stmt, timeout);
            stmt.setInt(1, number);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return DbUtil.getRequiredString(rs, "status").map(Optional::of);
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Select failed", e));
        }
    }

    /**
     * Sets a parcel's status, provided it still holds {@code expectedStatus}.
     *
     * @param conn an open JDBC connection
     * @param number the parcel number
     * @param expectedStatus the status the row must currently hold
     * @param newStatus the status to store
     * @param timeout the statement timeout, or zero for none
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> updateStatus(
            Connection conn, int number, String expectedStatus, String newStatus, Duration timeout) {
        String sql = """
                UPDATE parcel
                   SET status = ?
                 WHERE number = ?
                   AND status = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            DbUtil.applyTimeout(stmt, timeout);
            stmt.setString(1, newStatus);
            stmt.setInt(2, number);
            stmt.setString(3, expectedStatus);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Update failed", e));
        }
    }

    /**
     * Sets a parcel's address, provided it still holds {@code requiredStatus}.
     *
     * @param conn an open JDBC connection
     * @param number the parcel number
     * @param requiredStatus the status the row must currently hold
     * @param address the new address
     * @param timeout the statement timeout, or zero for none
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> updateAddress(
            Connection conn, int number, String requiredStatus, String address, Duration timeout) {
        String sql = """
                UPDATE parcel
                   SET address = ?
                 WHERE number = ?
                   AND status = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            DbUtil.applyTimeout(stmt, timeout);
            stmt.setString(1, address);
            stmt.setInt(2, number);
            stmt.setString(3, requiredStatus);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Update failed", e));
        }
    }

    /**
     * Deletes a parcel, provided it still holds {@code requiredStatus}.
     *
     * @param conn an open JDBC connection
     * @param number the parcel number
     * @param requiredStatus the status the row must currently hold
     * @param timeout the statement timeout, or zero for none
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> delete(Connection conn, int number, String requiredStatus, Duration timeout) {
        String sql = """
                DELETE FROM parcel
                 WHERE number = ?
                   AND status = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            DbUtil.applyTimeout(stmt, timeout);
            stmt.setInt(1, number);
            stmt.setString(2, requiredStatus);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Delete failed", e));
        }
    }

    /**
     * Counts all parcels.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing the row count or an error
     */
    @Nonnull
    public static StatusOr<Long> count(Connection conn) {
        String sql = "SELECT COUNT(*) FROM parcel";
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return StatusOr.ofValue(rs.getLong(1));
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.toStatus("Count failed", e));
        }
    }

    /**
     * Extracts a Parcel from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<Parcel> extractParcel(ResultSet rs) {
        StatusOr<Integer> numberOr = DbUtil.getRequiredInt(rs, "number");
        if (numberOr.isNotOk()) {
            return StatusOr.ofStatus(numberOr.getStatus());
        }
        StatusOr<Integer> clientOr = DbUtil.getRequiredInt(rs, "client");
        if (clientOr.isNotOk()) {
            return StatusOr.ofStatus(clientOr.getStatus());
        }
        StatusOr<String> statusOr = DbUtil.getRequiredString(rs, "status");
        if (statusOr.isNotOk()) {
            return StatusOr.ofStatus(statusOr.getStatus());
        }
        StatusOr<String> addressOr = DbUtil.getRequiredString(rs, "address");
        if (addressOr.isNotOk()) {
            return StatusOr.ofStatus(addressOr.getStatus());
        }
        StatusOr<String> createdAtOr = DbUtil.getRequiredString(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        return StatusOr.ofValue(new Parcel(
                numberOr.getValue(),
                clientOr.getValue(),
                statusOr.getValue(),
                addressOr.getValue(),
                createdAtOr.getValue()
        ));
    }
}
