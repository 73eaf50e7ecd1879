package kr.jemi.zseat.booking.application.port.in;

import kr.jemi.zseat.booking.domain.SeatAvailability;

import java.util.List;

public interface GetSeatAvailabilityUseCase {

    List<SeatAvailability> getSeats(long eventId);

    /**
     * 요청한 좌석만 요청 순서대로 반환한다. 하나라도 없으면 SEAT_NOT_FOUND.
     */
    List<SeatAvailability> getSeats(long eventId, List<String> seatIds);
}
