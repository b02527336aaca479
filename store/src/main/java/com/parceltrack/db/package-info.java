/**
 * The database layer for the parcel store.
 *
 * <p>This package contains the record class that represents a row of the {@code parcel} table
 * and the helper class that provides the SQL for it:
 *
 * <ul>
 *   <li>{@code Parcel} is the row record; its status stays a raw string so corrupt rows load
 *   <li>{@code ParcelStatus} is the ordered set of known statuses
 *   <li>{@code Parcels} provides static methods taking an open {@code Connection}
 *   <li>Database operations return {@code StatusOr<T>} to handle either success with a value or
 *       failure with a status
 * </ul>
 */
package com.parceltrack.db;
