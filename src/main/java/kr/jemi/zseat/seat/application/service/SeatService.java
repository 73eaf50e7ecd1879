package kr.jemi.zseat.seat.application.service;

import kr.jemi.zseat.seat.api.BookedSeat;
import kr.jemi.zseat.seat.api.NewBooking;
import kr.jemi.zseat.seat.api.SeatFacade;
import kr.jemi.zseat.seat.api.SeatSnapshot;
import kr.jemi.zseat.seat.application.port.in.EnsureSeatsUseCase;
import kr.jemi.zseat.seat.application.port.out.SeatPort;
import kr.jemi.zseat.seat.domain.BookingEntry;
import kr.jemi.zseat.seat.domain.Occupant;
import kr.jemi.zseat.seat.domain.Seat;
import kr.jemi.zseat.seat.domain.SeatId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class SeatService implements SeatFacade {

    private static final Logger log = LoggerFactory.getLogger(SeatService.class);

    private final EnsureSeatsUseCase ensureSeatsUseCase;
    private final SeatPort seatPort;

    public SeatService(EnsureSeatsUseCase ensureSeatsUseCase, SeatPort seatPort) {
        this.ensureSeatsUseCase = ensureSeatsUseCase;
        this.seatPort = seatPort;
    }

    @Override
    public int ensureSeats(long eventId, int capacity) {
        return ensureSeatsUseCase.ensureSeats(eventId, capacity);
    }

    @Override
    @Transactional
    public void deleteSeats(long eventId) {
        seatPort.deleteByEventId(eventId);
        log.info("좌석 삭제 완료: eventId={}", eventId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasBookings(long eventId) {
        return seatPort.existsBooking(eventId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatSnapshot> findSeats(long eventId) {
        return seatPort.findByEventId(eventId).stream()
                .map(SeatService::toSnapshot)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<BookedSeat> findBookings(long eventId, LocalDate date) {
        return seatPort.findByEventId(eventId).stream()
                .flatMap(seat -> seat.bookingOn(date)
                        .map(entry -> toBookedSeat(seat, entry))
                        .stream())
                .toList();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public List<SeatSnapshot> lockSeats(long eventId, Collection<String> seatIds) {
        List<SeatId> ids = seatIds.stream().map(SeatId::parse).toList();
        return seatPort.findForUpdate(eventId, ids).stream()
                .map(SeatService::toSnapshot)
                .toList();
    }

    /**
     * 호출자 트랜잭션 안에서 좌석별로 예약을 하나씩 추가한다.
     * 같은 트랜잭션에서 {@link #lockSeats}로 잠근 좌석이어야 한다.
     */
    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void appendBookings(long eventId, LocalDate date, List<NewBooking> bookings) {
        List<SeatId> ids = bookings.stream().map(booking -> SeatId.parse(booking.seatId())).toList();
        Map<SeatId, Seat> seats = seatPort.findForUpdate(eventId, ids).stream()
                .collect(Collectors.toMap(Seat::getSeatId, Function.identity()));

        for (NewBooking booking : bookings) {
            SeatId seatId = SeatId.parse(booking.seatId());
            Seat seat = Optional.ofNullable(seats.get(seatId))
                    .orElseThrow(() -> new IllegalStateException(
                            "잠긴 좌석이 아닙니다: eventId=" + eventId + ", seatId=" + seatId));
            seat.book(date, new Occupant(booking.name(), booking.email(), booking.phone()));
        }
        seatPort.updateAll(List.copyOf(seats.values()));
    }

    private static SeatSnapshot toSnapshot(Seat seat) {
        return new SeatSnapshot(
                seat.getSeatId().value(),
                seat.getPrice(),
                seat.getBookings().stream()
                        .map(BookingEntry::date)
                        .collect(Collectors.toUnmodifiableSet())
        );
    }

    private static BookedSeat toBookedSeat(Seat seat, BookingEntry entry) {
        return new BookedSeat(
                seat.getSeatId().value(),
                entry.occupant().name(),
                entry.occupant().email(),
                entry.occupant().phone()
        );
    }
}
