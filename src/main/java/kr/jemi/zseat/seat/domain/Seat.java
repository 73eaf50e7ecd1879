package kr.jemi.zseat.seat.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 이벤트에 속한 좌석 하나와 날짜별 예약 장부.
 * 장부는 추가만 가능하고, 같은 날짜의 예약은 하나뿐이다.
 */
public class Seat implements SelfValidating {

    private final long eventId;
    @NotNull
    private final SeatId seatId;
    @Min(0)
    private final int price;
    private final List<BookingEntry> bookings;

    public Seat(long eventId, SeatId seatId, int price, List<BookingEntry> bookings) {
        this.eventId = eventId;
        this.seatId = seatId;
        this.price = price;
        this.bookings = new ArrayList<>(bookings);
        this.bookings.sort(Comparator.comparing(BookingEntry::date));
        validateSelf();
    }

    public static Seat create(long eventId, SeatId seatId, int price) {
        return new Seat(eventId, seatId, price, List.of());
    }

    public boolean isBookedOn(LocalDate date) {
        return bookingOn(date).isPresent();
    }

    public Optional<BookingEntry> bookingOn(LocalDate date) {
        return bookings.stream()
                .filter(entry -> entry.date().equals(date))
                .findFirst();
    }

    public BookingEntry book(LocalDate date, Occupant occupant) {
        if (isBookedOn(date)) {
            throw new IllegalStateException(
                    "이미 예약된 좌석입니다: " + seatId + " @ " + date);
        }
        BookingEntry entry = BookingEntry.booked(date, occupant);
        bookings.add(entry);
        return entry;
    }

    public long getEventId() {
        return eventId;
    }

    public SeatId getSeatId() {
        return seatId;
    }

    public int getPrice() {
        return price;
    }

    public List<BookingEntry> getBookings() {
        return Collections.unmodifiableList(bookings);
    }
}
