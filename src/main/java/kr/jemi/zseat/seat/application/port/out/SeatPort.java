package kr.jemi.zseat.seat.application.port.out;

import kr.jemi.zseat.seat.domain.Seat;
import kr.jemi.zseat.seat.domain.SeatId;

import java.util.Collection;
import java.util.List;

public interface SeatPort {

    long countByEventId(long eventId);

    void deleteByEventId(long eventId);

    void insertAll(List<Seat> seats);

    List<Seat> findByEventId(long eventId);

    /**
     * 요청한 좌석 행을 쓰기 잠금으로 읽는다. 존재하지 않는 좌석은 결과에서 빠진다.
     */
    List<Seat> findForUpdate(long eventId, Collection<SeatId> seatIds);

    void updateAll(List<Seat> seats);

    boolean existsBooking(long eventId);
}
