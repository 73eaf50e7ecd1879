package kr.jemi.zseat.seat.api;

public record BookedSeat(String seatId, String name, String email, String phone) {
}
