package de.bycsitsm.calendar.local;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface LocalEventRepository extends JpaRepository<LocalEvent, Long> {

    @Query("""
            select e from LocalEvent e
            where e.roomId = :roomId and e.startTime >= :from and e.startTime < :to
            order by e.startTime asc, e.id asc
            """)
    List<LocalEvent> findStartingBetween(@Param("roomId") Long roomId,
                                         @Param("from") LocalDateTime from,
                                         @Param("to") LocalDateTime to);

    Optional<LocalEvent> findByIdAndRoomId(Long id, Long roomId);
}
