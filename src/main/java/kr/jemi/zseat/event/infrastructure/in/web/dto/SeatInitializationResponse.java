package kr.jemi.zseat.event.infrastructure.in.web.dto;

public record SeatInitializationResponse(String eventId, int seatCount) {
}
