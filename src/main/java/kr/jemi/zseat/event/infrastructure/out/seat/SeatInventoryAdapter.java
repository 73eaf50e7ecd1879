package kr.jemi.zseat.event.infrastructure.out.seat;

import kr.jemi.zseat.event.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.event.domain.RosterEntry;
import kr.jemi.zseat.seat.api.SeatFacade;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@Component
public class SeatInventoryAdapter implements SeatInventoryPort {

    private final SeatFacade seatFacade;

    public SeatInventoryAdapter(SeatFacade seatFacade) {
        this.seatFacade = seatFacade;
    }

    @Override
    public int ensureSeats(long eventId, int capacity) {
        return seatFacade.ensureSeats(eventId, capacity);
    }

    @Override
    public void deleteSeats(long eventId) {
        seatFacade.deleteSeats(eventId);
    }

    @Override
    public boolean hasBookings(long eventId) {
        return seatFacade.hasBookings(eventId);
    }

    @Override
    public List<RosterEntry> findRoster(long eventId, LocalDate date) {
        return seatFacade.findBookings(eventId, date).stream()
                .map(booked -> new RosterEntry(booked.seatId(), booked.name(), booked.email(), booked.phone()))
                .toList();
    }
}
