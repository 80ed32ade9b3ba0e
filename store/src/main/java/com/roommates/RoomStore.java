package com.roommates;

import com.roommates.common.status.Status;
import com.roommates.common.status.StatusOr;
import com.roommates.db.Room;
import com.roommates.db.Rooms;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * Create, read, update and delete operations for rooms.
 *
 * <p>Every call borrows a fresh connection from the configured data source, runs exactly one
 * statement through {@link Rooms}, and gives the connection back before returning, whether the
 * statement succeeded or not. The store keeps no state between calls; the database is the only
 * source of truth.
 *
 * <p>Failures are reported through {@link StatusOr}. A connection that cannot be obtained is
 * reported as UNAVAILABLE; failures from the statement itself keep the driver's exception as the
 * status cause.
 */
public class RoomStore {
  private final Config config;

  /**
   * @param dataSource provides a new connection for every operation
   */
  public record Config(DataSource dataSource) {}

  public RoomStore(Config config) {
    this.config = config;
  }

  /**
   * Inserts a new room.
   *
   * @param room the room to insert; its id is ignored
   * @return the inserted room carrying the id assigned by the database
   */
  @Nonnull
  public StatusOr<Room> insert(Room room) {
    if (room == null) {
      return StatusOr.ofStatus(Status.invalidArgument("Room cannot be null"));
    }
    Logger.debug("Inserting room {}", room);
    return withConnection("insert", connection -> Rooms.insert(connection, room));
  }

  /**
   * Looks up a room by id.
   *
   * @return the room, or an empty Optional when no room has this id
   */
  @Nonnull
  public StatusOr<Optional<Room>> getById(int id) {
    Logger.debug("Looking up room by ID: {}", id);
    return withConnection("getById", connection -> Rooms.loadById(connection, id));
  }

  /** Returns every room, in no particular order. */
  @Nonnull
  public StatusOr<List<Room>> getAll() {
    Logger.debug("Loading all rooms");
    return withConnection("getAll", Rooms::loadAll);
  }

  /**
   * Replaces the name and capacity of an existing room.
   *
   * @return the number of rows changed; 0 when no room has the given id, which is not an error
   */
  @Nonnull
  public StatusOr<Integer> update(Room room) {
    if (room == null) {
      return StatusOr.ofStatus(Status.invalidArgument("Room cannot be null"));
    }
    Logger.debug("Updating room {}", room);
    StatusOr<Integer> result =
        withConnection("update", connection -> Rooms.update(connection, room));
    if (result.isOk() && result.getValue() == 0) {
      Logger.debug("Update matched no room with ID: {}", room.id());
    }
    return result;
  }

  /**
   * Deletes a room. Fails with FAILED_PRECONDITION while roommates still reference it.
   *
   * @return the number of rows deleted; 0 when no room has the given id, which is not an error
   */
  @Nonnull
  public StatusOr<Integer> delete(int id) {
    Logger.debug("Deleting room by ID: {}", id);
    StatusOr<Integer> result = withConnection("delete", connection -> Rooms.delete(connection, id));
    if (result.isOk() && result.getValue() == 0) {
      Logger.debug("Delete matched no room with ID: {}", id);
    }
    return result;
  }

  private <T> StatusOr<T> withConnection(
      String operation, Function<Connection, StatusOr<T>> action) {
    Connection connection;
    try {
      connection = config.dataSource().getConnection();
    } catch (SQLException e) {
      Logger.error(e, "Database connection error during room {}: {}", operation, e.getMessage());
      return StatusOr.ofStatus(Status.unavailable("Could not connect to the database", e));
    }

    StatusOr<T> result;
    try {
      result = action.apply(connection);
    } finally {
      release(connection, operation);
    }

    if (result.isNotOk()) {
      Logger.error(
          result.getStatus().getCause(), "Room {} failed: {}", operation, result.getStatus());
    }
    return result;
  }

  /**
   * Closes a borrowed connection. A failure here is only logged: the statement has already run and
   * its outcome is what the caller gets.
   */
  private static void release(Connection connection, String operation) {
    try {
      connection.close();
    } catch (SQLException e) {
      Logger.error(e, "Failed to release connection after room {}: {}", operation, e.getMessage());
    }
  }
}
