package kr.jemi.zseat.booking.infrastructure.out.seat;

import kr.jemi.zseat.booking.application.port.out.SeatLedgerPort;
import kr.jemi.zseat.booking.domain.LedgerSeat;
import kr.jemi.zseat.booking.domain.SeatRequest;
import kr.jemi.zseat.seat.api.NewBooking;
import kr.jemi.zseat.seat.api.SeatFacade;
import kr.jemi.zseat.seat.api.SeatSnapshot;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@Component
public class SeatLedgerAdapter implements SeatLedgerPort {

    private final SeatFacade seatFacade;

    public SeatLedgerAdapter(SeatFacade seatFacade) {
        this.seatFacade = seatFacade;
    }

    @Override
    public List<LedgerSeat> findSeats(long eventId) {
        return seatFacade.findSeats(eventId).stream()
                .map(SeatLedgerAdapter::toLedgerSeat)
                .toList();
    }

    @Override
    public List<LedgerSeat> lockSeats(long eventId, List<String> seatIds) {
        return seatFacade.lockSeats(eventId, seatIds).stream()
                .map(SeatLedgerAdapter::toLedgerSeat)
                .toList();
    }

    @Override
    public void appendBookings(long eventId, LocalDate date, List<SeatRequest> requests) {
        List<NewBooking> bookings = requests.stream()
                .map(request -> new NewBooking(request.seatId(), request.name(), request.email(), request.phone()))
                .toList();
        seatFacade.appendBookings(eventId, date, bookings);
    }

    private static LedgerSeat toLedgerSeat(SeatSnapshot snapshot) {
        return new LedgerSeat(snapshot.seatId(), snapshot.price(), snapshot.bookedDates());
    }
}
