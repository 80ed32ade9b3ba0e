package com.roommates.db;

/**
 * Represents a row in the 'Room' table.
 *
 * @param id The identifier assigned by the database, {@link #UNSAVED_ID} before insertion
 * @param name The name of the room
 * @param maxOccupancy The number of roommates the room can hold
 */
public record Room(int id, String name, int maxOccupancy) {

  /** Id carried by a room that has not been inserted yet. */
  public static final int UNSAVED_ID = 0;

  /**
   * Creates a room that has not been persisted yet.
   *
   * @param name The name of the room
   * @param maxOccupancy The number of roommates the room can hold
   * @return A room with {@link #UNSAVED_ID}
   */
  public static Room unsaved(String name, int maxOccupancy) {
    return new Room(UNSAVED_ID, name, maxOccupancy);
  }

  /** Returns a copy of this room carrying the given database id. */
  public Room withId(int id) {
    return new Room(id, name, maxOccupancy);
  }
}
