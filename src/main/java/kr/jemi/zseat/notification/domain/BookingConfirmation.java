package kr.jemi.zseat.notification.domain;

import java.time.LocalDate;
import java.util.List;

public record BookingConfirmation(String email, String name, List<String> seatIds, LocalDate date) {

    public BookingConfirmation {
        seatIds = List.copyOf(seatIds);
    }
}
