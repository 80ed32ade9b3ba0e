/**
 * The database layer for the Roommates application.
 *
 * <p>Each table has a Java record ({@code Room}) and a helper class with the plural name
 * ({@code Rooms}) whose static methods run exactly one SQL statement against a connection owned by
 * the caller. Helper methods return {@code StatusOr<T>} instead of throwing.
 */
package com.roommates.db;
