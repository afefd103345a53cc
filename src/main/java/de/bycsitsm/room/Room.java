package de.bycsitsm.room;

import de.bycsitsm.calendar.CalendarProvider;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A physical room shown on a display. Rooms are managed outside the calendar
 * engine, which only reads them.
 * <p>
 * A room without a calendar provider keeps its bookings in the local store.
 */
@Entity
@Table(name = "room")
public class Room {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "calendar_id")
    private @Nullable String calendarId;

    @Enumerated(EnumType.STRING)
    @Column(name = "calendar_provider", length = 16)
    private @Nullable CalendarProvider calendarProvider;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Room() {
    }

    public Room(String name, @Nullable String calendarId, @Nullable CalendarProvider calendarProvider) {
        this.name = name;
        this.calendarId = calendarId;
        this.calendarProvider = calendarProvider;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * The provider-side calendar id, or {@code null} for the account's primary calendar.
     */
    public @Nullable String getCalendarId() {
        return calendarId == null || calendarId.isBlank() ? null : calendarId;
    }

    public void setCalendarId(@Nullable String calendarId) {
        this.calendarId = calendarId;
    }

    /**
     * The backend serving this room, {@link CalendarProvider#LOCAL} if none is configured.
     */
    public CalendarProvider getProvider() {
        return calendarProvider == null ? CalendarProvider.LOCAL : calendarProvider;
    }

    public void setCalendarProvider(@Nullable CalendarProvider calendarProvider) {
        this.calendarProvider = calendarProvider;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
