package kr.jemi.zseat.seat.api;

import java.time.LocalDate;
import java.util.Set;

public record SeatSnapshot(String seatId, int price, Set<LocalDate> bookedDates) {

    public boolean isBookedOn(LocalDate date) {
        return bookedDates.contains(date);
    }
}
