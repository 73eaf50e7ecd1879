package kr.jemi.zseat.booking.infrastructure.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import kr.jemi.zseat.booking.domain.SeatRequest;

import java.util.List;

public record BookSeatsRequest(@NotEmpty List<@Valid BookingItem> bookings) {

    public List<SeatRequest> toSeatRequests() {
        return bookings.stream()
                .map(BookingItem::toSeatRequest)
                .toList();
    }
}
