package kr.jemi.zseat.seat.api;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface SeatFacade {

    int ensureSeats(long eventId, int capacity);

    void deleteSeats(long eventId);

    boolean hasBookings(long eventId);

    /**
     * 이벤트의 모든 좌석, 행 우선 순서.
     */
    List<SeatSnapshot> findSeats(long eventId);

    /**
     * 해당 날짜에 예약된 좌석과 예약자, 행 우선 순서.
     */
    List<BookedSeat> findBookings(long eventId, LocalDate date);

    /**
     * 호출자의 트랜잭션이 끝날 때까지 좌석 행을 잠근다. 없는 좌석은 결과에 포함되지 않는다.
     */
    List<SeatSnapshot> lockSeats(long eventId, Collection<String> seatIds);

    void appendBookings(long eventId, LocalDate date, List<NewBooking> bookings);
}
