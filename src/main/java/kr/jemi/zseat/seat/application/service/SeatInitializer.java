package kr.jemi.zseat.seat.application.service;

import kr.jemi.zseat.seat.application.port.in.EnsureSeatsUseCase;
import kr.jemi.zseat.seat.application.port.out.SeatPort;
import kr.jemi.zseat.seat.domain.Seat;
import kr.jemi.zseat.seat.domain.SeatLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class SeatInitializer implements EnsureSeatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(SeatInitializer.class);

    private final SeatPort seatPort;
    private final int seatPrice;

    public SeatInitializer(SeatPort seatPort,
                           @Value("${zseat.seat.price}") int seatPrice) {
        this.seatPort = seatPort;
        this.seatPrice = seatPrice;
    }

    /**
     * 좌석이 이미 충분하면 아무것도 하지 않는다.
     * 부족하면 기존 좌석을 모두 지우고 처음부터 다시 만든다. 기존 예약도 함께 사라지므로
     * 예약이 생길 수 있는 시점 이후에는 호출하면 안 된다.
     * 호출자의 트랜잭션이 있으면 그 안에서 실행된다.
     */
    @Override
    @Transactional
    public int ensureSeats(long eventId, int capacity) {
        int target = SeatLayout.seatCount(capacity);
        long existing = seatPort.countByEventId(eventId);
        if (existing >= target) {
            log.debug("좌석 초기화 생략: eventId={}, existing={}, target={}", eventId, existing, target);
            return (int) existing;
        }

        if (existing > 0) {
            log.warn("좌석 수 부족, 전체 재생성: eventId={}, existing={}, target={}", eventId, existing, target);
            seatPort.deleteByEventId(eventId);
        }

        List<Seat> seats = SeatLayout.generate(capacity).stream()
                .map(seatId -> Seat.create(eventId, seatId, seatPrice))
                .toList();
        seatPort.insertAll(seats);

        log.info("좌석 초기화 완료: eventId={}, count={}", eventId, seats.size());
        return seats.size();
    }
}
