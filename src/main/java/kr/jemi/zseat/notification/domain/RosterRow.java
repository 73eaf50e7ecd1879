package kr.jemi.zseat.notification.domain;

import java.time.LocalDate;
import java.util.List;

public record RosterRow(String seatId, String name, String email, String phone) {

    public BookingConfirmation toConfirmation(LocalDate date) {
        return new BookingConfirmation(email, name, List.of(seatId), date);
    }
}
