package kr.jemi.zseat.seat.domain;

import java.time.LocalDate;
import java.util.Objects;

public record BookingEntry(LocalDate date, Occupant occupant, BookingStatus status) {

    public BookingEntry {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(occupant, "occupant");
        Objects.requireNonNull(status, "status");
    }

    public static BookingEntry booked(LocalDate date, Occupant occupant) {
        return new BookingEntry(date, occupant, BookingStatus.BOOKED);
    }
}
