package kr.jemi.zseat.booking.application.port.out;

import kr.jemi.zseat.booking.domain.LedgerSeat;
import kr.jemi.zseat.booking.domain.SeatRequest;

import java.time.LocalDate;
import java.util.List;

public interface SeatLedgerPort {

    List<LedgerSeat> findSeats(long eventId);

    /**
     * 요청 좌석을 쓰기 잠금으로 읽는다. 없는 좌석은 결과에서 빠진다.
     */
    List<LedgerSeat> lockSeats(long eventId, List<String> seatIds);

    void appendBookings(long eventId, LocalDate date, List<SeatRequest> requests);
}
