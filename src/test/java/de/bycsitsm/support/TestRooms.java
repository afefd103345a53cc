package de.bycsitsm.support;

import de.bycsitsm.calendar.CalendarProvider;
import de.bycsitsm.room.Room;
import org.jspecify.annotations.Nullable;
import org.springframework.test.util.ReflectionTestUtils;

public final class TestRooms {

    private TestRooms() {
    }

    public static Room room(long id, String name, @Nullable String calendarId, @Nullable CalendarProvider provider) {
        var room = new Room(name, calendarId, provider);
        ReflectionTestUtils.setField(room, "id", id);
        return room;
    }

    public static Room localRoom(long id) {
        return room(id, "Room " + id, null, null);
    }
}
