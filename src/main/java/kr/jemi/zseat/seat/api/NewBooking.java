package kr.jemi.zseat.seat.api;

public record NewBooking(String seatId, String name, String email, String phone) {
}
