package kr.jemi.zseat.booking.infrastructure.in.web.dto;

import kr.jemi.zseat.booking.domain.SeatAvailability;

public record SeatStatusResponse(String seatId, int price, String status) {

    public static SeatStatusResponse from(SeatAvailability availability) {
        String displayStatus = availability.booked() ? "booked" : "available";
        return new SeatStatusResponse(availability.seatId(), availability.price(), displayStatus);
    }
}
