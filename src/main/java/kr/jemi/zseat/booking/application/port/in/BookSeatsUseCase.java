package kr.jemi.zseat.booking.application.port.in;

import kr.jemi.zseat.booking.domain.ConfirmedBooking;
import kr.jemi.zseat.booking.domain.SeatRequest;
import kr.jemi.zseat.common.auth.Requester;

import java.util.List;

public interface BookSeatsUseCase {

    /**
     * 배치 전체를 예약하거나, 하나도 예약하지 않고 실패한다.
     */
    List<ConfirmedBooking> book(long eventId, List<SeatRequest> requests, Requester requester);
}
