package kr.jemi.zseat.booking.domain;

import java.time.LocalDate;

public record ConfirmedBooking(String seatId, LocalDate date, String name, String email, String phone) {

    public static ConfirmedBooking of(SeatRequest request, LocalDate date) {
        return new ConfirmedBooking(request.seatId(), date, request.name(), request.email(), request.phone());
    }
}
