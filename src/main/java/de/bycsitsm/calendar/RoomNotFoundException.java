package de.bycsitsm.calendar;

public class RoomNotFoundException extends CalendarException {

    public RoomNotFoundException(long roomId) {
        super("Room " + roomId + " not found.");
    }
}
