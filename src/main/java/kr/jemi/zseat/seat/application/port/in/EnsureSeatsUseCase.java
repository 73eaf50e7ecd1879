package kr.jemi.zseat.seat.application.port.in;

public interface EnsureSeatsUseCase {

    /**
     * @return 호출 후 이벤트에 존재하는 좌석 수
     */
    int ensureSeats(long eventId, int capacity);
}
