package com.parceltrack.common.status;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Status and StatusOr classes.
 */
public class StatusTest {

    @Test
    void testStatusCreation() {
        Status ok = Status.ok();
        assertTrue(ok.isOk());
        assertFalse(ok.isError());
        assertEquals(StatusCode.OK, ok.getCode());
        assertNull(ok.getReason());
        assertEquals(200, ok.getHttpCode());

        Status notFound = Status.notFound("Parcel not found");
        assertTrue(notFound.isError());
        assertEquals(StatusCode.NOT_FOUND, notFound.getCode());
        assertEquals(ErrorReason.NOT_FOUND, notFound.getReason());
        assertEquals("Parcel not found", notFound.getMessage());
        assertEquals(404, notFound.getHttpCode());

        Exception exception = new RuntimeException("Test exception");
        Status internal = Status.internal("Internal error", exception);
        assertEquals(StatusCode.INTERNAL, internal.getCode());
        assertTrue(internal.is(ErrorReason.STORAGE_FAILURE));
        assertEquals(exception, internal.getCause());
    }

    @Test
    void testEveryReasonMapsToAnErrorCode() {
        for (ErrorReason reason : ErrorReason.values()) {
            Status status = Status.of(reason, "message");
            assertTrue(status.isError(), reason.name());
            assertEquals(reason.defaultCode(), status.getCode());
        }
        assertEquals(StatusCode.DATA_LOSS, ErrorReason.STORED_STATUS_UNRECOGNISED.defaultCode());
        assertEquals(StatusCode.ABORTED, ErrorReason.CONCURRENT_MODIFICATION.defaultCode());
    }

    @Test
    void testOkCodeRejectsReason() {
        assertThrows(IllegalArgumentException.class,
                () -> Status.of(StatusCode.OK, ErrorReason.NOT_FOUND, "nope", null));
    }

    @Test
    void testWithMetadata() {
        Status status = Status.of(ErrorReason.INVALID_STATUS_TRANSITION, "bad move")
                .withMetadata("number", 7)
                .withMetadata("stored_status", "sent")
                .withMetadata("stored_status", "delivered");

        assertEquals("7", status.getMetadata().get("number"));
        assertEquals("delivered", status.getMetadata().get("stored_status"));
        assertEquals(2, status.getMetadata().size());
        assertThrows(IllegalStateException.class, () -> Status.ok().withMetadata("number", 1));
    }

    @Test
    void testAnnotateKeepsReasonAndCause() {
        Exception cause = new RuntimeException("boom");
        Status status = Status.internal("Select failed", cause).withMetadata("number", 3);

        Status annotated = status.annotate("failed to get parcel 3");

        assertEquals("failed to get parcel 3: Select failed", annotated.getMessage());
        assertTrue(annotated.is(ErrorReason.STORAGE_FAILURE));
        assertSame(cause, annotated.getCause());
        assertEquals("3", annotated.getMetadata().get("number"));
        assertSame(Status.ok(), Status.ok().annotate("ignored"));
    }

    @Test
    void testToString() {
        Status status = Status.of(ErrorReason.NOT_FOUND, "parcel 4 not found").withMetadata("number", 4);
        assertEquals("NOT_FOUND[NOT_FOUND]: parcel 4 not found {number=4}", status.toString());
        assertEquals("OK", Status.ok().toString());
    }

    @Test
    void testStatusOrWithValue() {
        StatusOr<String> statusOr = StatusOr.ofValue("test");
        assertTrue(statusOr.isOk());
        assertFalse(statusOr.isNotOk());
        assertEquals("test", statusOr.getValue());
        assertTrue(statusOr.getStatus().isOk());
        assertEquals("test", statusOr.asOptional().orElseThrow());
    }

    @Test
    void testStatusOrWithError() {
        Status error = Status.of(ErrorReason.NEW_STATUS_UNRECOGNISED, "Invalid argument");
        StatusOr<String> statusOr = StatusOr.ofStatus(error);
        assertFalse(statusOr.isOk());
        assertTrue(statusOr.isNotOk());
        assertEquals(error, statusOr.getStatus());
        assertThrows(IllegalStateException.class, statusOr::getValue);
        assertTrue(statusOr.asOptional().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> StatusOr.ofStatus(Status.ok()));
    }

    @Test
    void testStatusOrFromException() {
        Exception exception = new RuntimeException("Test exception");
        StatusOr<String> statusOr = StatusOr.ofException(exception);
        assertTrue(statusOr.isNotOk());
        assertEquals(StatusCode.INTERNAL, statusOr.getStatus().getCode());
        assertTrue(statusOr.getStatus().is(ErrorReason.STORAGE_FAILURE));
        assertTrue(statusOr.getStatus().getMessage().contains("Test exception"));
        assertEquals(exception, statusOr.getStatus().getCause());
    }

    @Test
    void testStatusOrMap() {
        StatusOr<Integer> intStatusOr = StatusOr.ofValue(42);
        StatusOr<String> stringStatusOr = intStatusOr.map(i -> i.toString());
        assertTrue(stringStatusOr.isOk());
        assertEquals("42", stringStatusOr.getValue());

        Status error = Status.of(ErrorReason.NEW_STATUS_UNRECOGNISED, "Invalid argument");
        StatusOr<Integer> errorStatusOr = StatusOr.ofStatus(error);
        StatusOr<String> mappedErrorStatusOr = errorStatusOr.map(i -> i.toString());
        assertFalse(mappedErrorStatusOr.isOk());
        assertEquals(error, mappedErrorStatusOr.getStatus());
    }

    @Test
    void testStatusOrFlatMap() {
        StatusOr<Integer> value = StatusOr.ofValue(3);
        StatusOr<Integer> failed = value.flatMap(
                i -> StatusOr.ofStatus(Status.notFound("parcel " + i + " not found")));

        assertTrue(failed.getStatus().is(ErrorReason.NOT_FOUND));
        assertEquals("parcel 3 not found", failed.getStatus().getMessage());
    }
}
