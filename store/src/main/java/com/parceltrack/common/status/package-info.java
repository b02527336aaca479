/**
 * Contains classes for error handling and status reporting.
 *
 * <p>This package provides a consistent way to represent operation statuses and errors
 * without relying on exceptions for control flow. The central classes are:
 *
 * <ul>
 *   <li>{@link com.parceltrack.common.status.StatusCode} - Enum of possible status codes, aligned with gRPC and HTTP status codes</li>
 *   <li>{@link com.parceltrack.common.status.ErrorReason} - The closed set of parcel store failure kinds</li>
 *   <li>{@link com.parceltrack.common.status.Status} - A code and reason with an optional message, cause and metadata</li>
 *   <li>{@link com.parceltrack.common.status.StatusOr} - Container that holds either a successful value or an error status</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * Status result = store.setStatus(number, "sent");
 * if (result.is(ErrorReason.INVALID_STATUS_TRANSITION)) {
 *     logger.warn("Rejected: {} -&gt; {}",
 *         result.getMetadata().get("stored_status"),
 *         result.getMetadata().get("requested_status"));
 * } else if (result.isError()) {
 *     return response.status(result.getHttpCode());
 * }
 * </pre>
 */
package com.parceltrack.common.status;
