package de.bycsitsm.credential;

import de.bycsitsm.calendar.CalendarProvider;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CalendarCredentialRepository extends JpaRepository<CalendarCredential, Long> {

    Optional<CalendarCredential> findByProvider(CalendarProvider provider);
}
