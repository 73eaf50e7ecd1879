package kr.jemi.zseat.booking.domain;

public record SeatAvailability(String seatId, int price, boolean booked) {
}
