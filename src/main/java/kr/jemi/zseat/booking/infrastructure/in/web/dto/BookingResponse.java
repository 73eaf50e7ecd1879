package kr.jemi.zseat.booking.infrastructure.in.web.dto;

import kr.jemi.zseat.booking.domain.ConfirmedBooking;

import java.time.LocalDate;
import java.util.List;

public record BookingResponse(String eventId, LocalDate date, List<String> seatIds) {

    public static BookingResponse from(long eventId, List<ConfirmedBooking> bookings) {
        LocalDate date = bookings.isEmpty() ? null : bookings.get(0).date();
        List<String> seatIds = bookings.stream().map(ConfirmedBooking::seatId).toList();
        return new BookingResponse(String.valueOf(eventId), date, seatIds);
    }
}
