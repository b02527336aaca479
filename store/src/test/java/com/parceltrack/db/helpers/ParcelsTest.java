package com.parceltrack.db.helpers;

import com.parceltrack.common.status.ErrorReason;
import com.parceltrack.common.status.StatusCode;
import com.parceltrack.common.status.StatusOr;
import com.parceltrack.db.Parcel;
import com.parceltrack.db.Parcels;
import com.parceltrack.db.util.PostgresTestHelper;
import com.parceltrack.db.util.PostgresTestHelper.PostgresContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Parcels helper class against a real PostgreSQL database.
 */
@Testcontainers(disabledWithoutDocker = true)
public class ParcelsTest {

    private static final Duration NO_TIMEOUT = Duration.ZERO;

    private static PostgresContext postgresContext;
    private static Connection connection;

    @BeforeAll
    static void setUp() throws SQLException {
        postgresContext = PostgresTestHelper.setupPostgres("parcels_dao_test");
        connection = postgresContext.getConnection();
    }

    @AfterAll
    static void tearDown() {
        if (postgresContext != null) {
            postgresContext.close();
        }
    }

    @BeforeEach
    void clearDatabase() throws SQLException {
        PostgresTestHelper.clearParcels(connection);
    }

    @Test
    void testInsert_ReturnsGeneratedNumber_AndRowIsLoadable() {
        // Given: A new parcel
        Parcel parcel = createTestParcel(1000, "registered");

        // When: We insert it
        StatusOr<Integer> result = Parcels.insert(connection, parcel, NO_TIMEOUT);

        // Then: A positive number is generated
        assertTrue(result.isOk(), () -> result.getStatus().toString());
        int number = result.getValue();
        assertTrue(number > 0);

        // And: The row reads back with every field intact
        StatusOr<Optional<Parcel>> loaded = Parcels.loadByNumber(connection, number, NO_TIMEOUT);
        assertTrue(loaded.isOk());
        assertEquals(Optional.of(parcel.withNumber(number)), loaded.getValue());
    }

    @Test
    void testInsert_AssignsDistinctNumbers() {
        int first = Parcels.insert(connection, createTestParcel(1, "registered"), NO_TIMEOUT).getValue();
        int second = Parcels.insert(connection, createTestParcel(1, "registered"), NO_TIMEOUT).getValue();

        assertNotEquals(first, second);
        assertEquals(2L, Parcels.count(connection).getValue());
    }

    @Test
    void testLoadByNumber_ReturnsEmpty_WhenParcelDoesNotExist() {
        StatusOr<Optional<Parcel>> result = Parcels.loadByNumber(connection, 424242, NO_TIMEOUT);

        assertTrue(result.isOk());
        assertFalse(result.getValue().isPresent());
    }

    @Test
    void testLoadByClient_ReturnsOnlyThatClientsParcels() {
        Parcels.insert(connection, createTestParcel(7, "registered"), NO_TIMEOUT);
        Parcels.insert(connection, createTestParcel(7, "sent"), NO_TIMEOUT);
        Parcels.insert(connection, createTestParcel(8, "registered"), NO_TIMEOUT);

        StatusOr<List<Parcel>> result = Parcels.loadByClient(connection, 7, NO_TIMEOUT);

        assertTrue(result.isOk());
        assertEquals(2, result.getValue().size());
        assertTrue(result.getValue().stream().allMatch(p -> p.client() == 7));
    }

    @Test
    void testLoadByClient_ReturnsEmptyList_WhenClientHasNoParcels() {
        StatusOr<List<Parcel>> result = Parcels.loadByClient(connection, 99, NO_TIMEOUT);

        assertTrue(result.isOk());
        assertTrue(result.getValue().isEmpty());
    }

    @Test
    void testLoadStatus_ReturnsStoredToken() {
        int number = Parcels.insert(connection, createTestParcel(1, "sent"), NO_TIMEOUT).getValue();

        StatusOr<Optional<String>> result = Parcels.loadStatus(connection, number, NO_TIMEOUT);

        assertTrue(result.isOk());
        assertEquals(Optional.of("sent"), result.getValue());
    }

    @Test
    void testUpdateStatus_AffectsNoRows_WhenExpectedStatusDiffers() {
        // Given: A parcel that has already been sent
        int number = Parcels.insert(connection, createTestParcel(1, "sent"), NO_TIMEOUT).getValue();

        // When: We update it expecting it to still be registered
        StatusOr<Integer> result =
                Parcels.updateStatus(connection, number, "registered", "sent", NO_TIMEOUT);

        // Then: Nothing is touched
        assertTrue(result.isOk());
        assertEquals(0, result.getValue());
    }

    @Test
    void testUpdateStatus_AffectsOneRow_WhenExpectedStatusMatches() {
        int number = Parcels.insert(connection, createTestParcel(1, "registered"), NO_TIMEOUT).getValue();

        StatusOr<Integer> result =
                Parcels.updateStatus(connection, number, "registered", "sent", NO_TIMEOUT);

        assertEquals(1, result.getValue());
        assertEquals(Optional.of("sent"), Parcels.loadStatus(connection, number, NO_TIMEOUT).getValue());
    }

    @Test
    void testUpdateAddress_OnlyWhileRequiredStatusHolds() {
        int registered = Parcels.insert(connection, createTestParcel(1, "registered"), NO_TIMEOUT).getValue();
        int delivered = Parcels.insert(connection, createTestParcel(1, "delivered"), NO_TIMEOUT).getValue();

        assertEquals(1, Parcels.updateAddress(connection, registered, "registered", "new", NO_TIMEOUT).getValue());
        assertEquals(0, Parcels.updateAddress(connection, delivered, "registered", "new", NO_TIMEOUT).getValue());

        assertEquals("new", Parcels.loadByNumber(connection, registered, NO_TIMEOUT).getValue().get().address());
        assertEquals("test", Parcels.loadByNumber(connection, delivered, NO_TIMEOUT).getValue().get().address());
    }

    @Test
    void testDelete_OnlyWhileRequiredStatusHolds() {
        int registered = Parcels.insert(connection, createTestParcel(1, "registered"), NO_TIMEOUT).getValue();
        int sent = Parcels.insert(connection, createTestParcel(1, "sent"), NO_TIMEOUT).getValue();

        assertEquals(1, Parcels.delete(connection, registered, "registered", NO_TIMEOUT).getValue());
        assertEquals(0, Parcels.delete(connection, sent, "registered", NO_TIMEOUT).getValue());

        assertEquals(1L, Parcels.count(connection).getValue());
    }

    @Test
    void testStatementTimeout_IsReportedAsStorageFailure() throws SQLException {
        // Given: The parcel table is locked by another connection
        try (Connection locker = PostgresTestHelper.createConnection(postgresContext.getContainer())) {
            locker.setAutoCommit(false);
            try (var stmt = locker.createStatement()) {
                stmt.execute("LOCK TABLE parcel IN ACCESS EXCLUSIVE MODE");
            }

            // When: We query with a one second timeout
            StatusOr<Optional<Parcel>> result =
                    Parcels.loadByNumber(connection, 1, Duration.ofSeconds(1));

            // Then: The statement is cancelled and reported as a deadline failure
            assertTrue(result.isNotOk());
            assertTrue(result.getStatus().is(ErrorReason.STORAGE_FAILURE));
            assertEquals(StatusCode.DEADLINE_EXCEEDED, result.getStatus().getCode());

            locker.rollback();
        }
    }

    private static Parcel createTestParcel(int client, String status) {
        return new Parcel(0, client, status, "test", Instant.now().toString());
    }
}
