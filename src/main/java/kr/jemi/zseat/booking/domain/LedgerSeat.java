package kr.jemi.zseat.booking.domain;

import java.time.LocalDate;
import java.util.Set;

public record LedgerSeat(String seatId, int price, Set<LocalDate> bookedDates) {

    public LedgerSeat {
        bookedDates = Set.copyOf(bookedDates);
    }

    public boolean isBookedOn(LocalDate date) {
        return bookedDates.contains(date);
    }
}
