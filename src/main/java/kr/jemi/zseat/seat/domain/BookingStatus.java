package kr.jemi.zseat.seat.domain;

public enum BookingStatus {
    BOOKED
}
