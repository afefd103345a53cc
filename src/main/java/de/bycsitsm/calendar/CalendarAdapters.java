package de.bycsitsm.calendar;

import de.bycsitsm.room.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the available {@link CalendarAdapter}s, keyed by provider.
 */
@Component
public class CalendarAdapters {

    private static final Logger log = LoggerFactory.getLogger(CalendarAdapters.class);

    private final Map<CalendarProvider, CalendarAdapter> adapters = new EnumMap<>(CalendarProvider.class);

    public CalendarAdapters(List<CalendarAdapter> adapters) {
        for (var adapter : adapters) {
            var previous = this.adapters.put(adapter.provider(), adapter);
            if (previous != null) {
                throw new IllegalStateException("More than one calendar adapter registered for "
                        + adapter.provider() + ": " + previous.getClass().getName() + " and "
                        + adapter.getClass().getName());
            }
        }
        log.info("Registered calendar adapters for {}", this.adapters.keySet());
    }

    /**
     * Returns the adapter serving the given room.
     *
     * @throws ProviderUnavailableException if no adapter handles the room's provider
     */
    public CalendarAdapter forRoom(Room room) {
        var provider = room.getProvider();
        var adapter = adapters.get(provider);
        if (adapter == null) {
            throw new ProviderUnavailableException("No calendar adapter available for " + provider.displayName() + ".");
        }
        return adapter;
    }
}
