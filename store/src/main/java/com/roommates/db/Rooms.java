package com.roommates.db;

import com.google.common.collect.ImmutableList;
import com.roommates.common.status.Status;
import com.roommates.common.status.StatusOr;
import com.roommates.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * DAO helper class for the 'Room' table.
 *
 * <p>Every method runs a single statement on the supplied connection and closes the statement and
 * any result set before returning. The connection itself belongs to the caller.
 */
public final class Rooms {

  // Column position for "RETURNING Id"
  private static final int RETURNED_ID = 1;

  // Column positions for "SELECT Id, Name, MaxOccupancy"
  private static final int ALL_ID = 1;
  private static final int ALL_NAME = 2;
  private static final int ALL_MAX_OCCUPANCY = 3;

  // Column positions for "SELECT Name, MaxOccupancy"
  private static final int BY_ID_NAME = 1;
  private static final int BY_ID_MAX_OCCUPANCY = 2;

  private Rooms() {
    // Utility class
  }

  /**
   * Inserts a room and reads back the id generated by the database in the same round trip.
   *
   * @param conn an open JDBC connection
   * @param room the room to insert; its id is ignored
   * @return StatusOr containing a copy of the room carrying the generated id, or an error
   */
  @Nonnull
  public static StatusOr<Room> insert(Connection conn, Room room) {
    if (room == null) {
      return StatusOr.ofStatus(Status.invalidArgument("Room cannot be null"));
    }
    String sql = """
        INSERT INTO Room (Name, MaxOccupancy)
        VALUES (?, ?)
        RETURNING Id
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, room.name());
      stmt.setInt(2, room.maxOccupancy());
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofStatus(Status.internal("Insert returned no generated id", null));
        }
        return DbUtil.getInt(rs, "Id", RETURNED_ID).map(room::withId);
      }
    } catch (SQLException e) {
      return StatusOr.ofSqlException(e);
    }
  }

  /**
   * Loads a single room by id.
   *
   * <p>The id of the returned room is the {@code id} argument; the row's own Id column is not
   * selected. The two are equal because the row was matched on it.
   *
   * @param conn an open JDBC connection
   * @param id the id of the room to load
   * @return StatusOr containing an Optional Room, empty when no row matches, or an error
   */
  @Nonnull
  public static StatusOr<Optional<Room>> loadById(Connection conn, int id) {
    String sql = "SELECT Name, MaxOccupancy FROM Room WHERE Id = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setInt(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofValue(Optional.empty());
        }
        StatusOr<String> nameOr = DbUtil.getString(rs, "Name", BY_ID_NAME);
        if (nameOr.isNotOk()) {
          return StatusOr.ofStatus(nameOr.getStatus());
        }
        StatusOr<Integer> maxOccupancyOr =
            DbUtil.getInt(rs, "MaxOccupancy", BY_ID_MAX_OCCUPANCY);
        if (maxOccupancyOr.isNotOk()) {
          return StatusOr.ofStatus(maxOccupancyOr.getStatus());
        }
        return StatusOr.ofValue(
            Optional.of(new Room(id, nameOr.getValue(), maxOccupancyOr.getValue())));
      }
    } catch (SQLException e) {
      return StatusOr.ofSqlException(e);
    }
  }

  /**
   * Loads all rooms. No ordering is applied; rows come back in whatever order the database
   * chooses.
   *
   * @param conn an open JDBC connection
   * @return StatusOr containing an immutable list of rooms or an error
   */
  @Nonnull
  public static StatusOr<List<Room>> loadAll(Connection conn) {
    String sql = "SELECT Id, Name, MaxOccupancy FROM Room";
    try (PreparedStatement stmt = conn.prepareStatement(sql);
        ResultSet rs = stmt.executeQuery()) {
      List<Room> result = new ArrayList<>();
      while (rs.next()) {
        StatusOr<Room> roomOr = extractRoom(rs);
        if (roomOr.isNotOk()) {
          return StatusOr.ofStatus(roomOr.getStatus());
        }
        result.add(roomOr.getValue());
      }
      return StatusOr.ofValue(ImmutableList.copyOf(result));
    } catch (SQLException e) {
      return StatusOr.ofSqlException(e);
    }
  }

  /**
   * Replaces the name and capacity of the room with the same id.
   *
   * @param conn an open JDBC connection
   * @param room the room holding the id to match and the new values
   * @return StatusOr containing the number of affected rows (0 when the id matches nothing) or an
   *     error
   */
  @Nonnull
  public static StatusOr<Integer> update(Connection conn, Room room) {
    if (room == null) {
      return StatusOr.ofStatus(Status.invalidArgument("Room cannot be null"));
    }
    String sql = """
        UPDATE Room
           SET Name = ?,
               MaxOccupancy = ?
         WHERE Id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, room.name());
      stmt.setInt(2, room.maxOccupancy());
      stmt.setInt(3, room.id());
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofSqlException(e);
    }
  }

  /**
   * Deletes a room by id. Roommates referencing the room are not touched, so the database rejects
   * the delete while any exist.
   *
   * @param conn an open JDBC connection
   * @param id the id of the room to delete
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, int id) {
    String sql = "DELETE FROM Room WHERE Id = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setInt(1, id);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofSqlException(e);
    }
  }

  /**
   * Extracts a Room from the current row of a "SELECT Id, Name, MaxOccupancy" result.
   */
  @Nonnull
  private static StatusOr<Room> extractRoom(ResultSet rs) {
    StatusOr<Integer> idOr = DbUtil.getInt(rs, "Id", ALL_ID);
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }

    StatusOr<String> nameOr = DbUtil.getString(rs, "Name", ALL_NAME);
    if (nameOr.isNotOk()) {
      return StatusOr.ofStatus(nameOr.getStatus());
    }

    StatusOr<Integer> maxOccupancyOr = DbUtil.getInt(rs, "MaxOccupancy", ALL_MAX_OCCUPANCY);
    if (maxOccupancyOr.isNotOk()) {
      return StatusOr.ofStatus(maxOccupancyOr.getStatus());
    }

    return StatusOr.ofValue(
        new Room(idOr.getValue(), nameOr.getValue(), maxOccupancyOr.getValue()));
  }
}
