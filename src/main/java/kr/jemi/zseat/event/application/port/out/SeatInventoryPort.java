package kr.jemi.zseat.event.application.port.out;

import kr.jemi.zseat.event.domain.RosterEntry;

import java.time.LocalDate;
import java.util.List;

public interface SeatInventoryPort {

    int ensureSeats(long eventId, int capacity);

    void deleteSeats(long eventId);

    boolean hasBookings(long eventId);

    List<RosterEntry> findRoster(long eventId, LocalDate date);
}
