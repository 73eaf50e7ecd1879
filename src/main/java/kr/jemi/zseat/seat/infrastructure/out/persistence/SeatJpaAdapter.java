package kr.jemi.zseat.seat.infrastructure.out.persistence;

import kr.jemi.zseat.seat.application.port.out.SeatPort;
import kr.jemi.zseat.seat.domain.Seat;
import kr.jemi.zseat.seat.domain.SeatId;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class SeatJpaAdapter implements SeatPort {

    private final SeatJpaRepository repository;

    public SeatJpaAdapter(SeatJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public long countByEventId(long eventId) {
        return repository.countByEventId(eventId);
    }

    /**
     * 엔티티 단위로 지워야 seat_bookings도 함께 지워진다.
     * 이어지는 재생성 insert보다 먼저 반영되도록 바로 flush한다.
     */
    @Override
    public void deleteByEventId(long eventId) {
        List<SeatJpaEntity> seats = repository.findByEventIdOrderByRowLetterAscColumnNumberAsc(eventId);
        repository.deleteAll(seats);
        repository.flush();
    }

    @Override
    public void insertAll(List<Seat> seats) {
        List<SeatJpaEntity> entities = seats.stream()
                .map(SeatJpaEntity::fromDomain)
                .toList();
        repository.saveAll(entities);
    }

    @Override
    public List<Seat> findByEventId(long eventId) {
        return repository.findByEventIdOrderByRowLetterAscColumnNumberAsc(eventId).stream()
                .map(SeatJpaEntity::toDomain)
                .toList();
    }

    @Override
    public List<Seat> findForUpdate(long eventId, Collection<SeatId> seatIds) {
        List<String> seatCodes = seatIds.stream().map(SeatId::value).toList();
        return repository.findForUpdate(eventId, seatCodes).stream()
                .map(SeatJpaEntity::toDomain)
                .toList();
    }

    /**
     * 유니크 제약 위반이 커밋 시점이 아니라 이 호출에서 드러나도록 flush까지 한다.
     */
    @Override
    public void updateAll(List<Seat> seats) {
        if (seats.isEmpty()) {
            return;
        }
        long eventId = seats.get(0).getEventId();
        List<String> seatCodes = seats.stream().map(seat -> seat.getSeatId().value()).toList();
        Map<String, SeatJpaEntity> entities = repository.findForUpdate(eventId, seatCodes).stream()
                .collect(Collectors.toMap(SeatJpaEntity::getSeatCode, Function.identity()));

        for (Seat seat : seats) {
            SeatJpaEntity entity = entities.get(seat.getSeatId().value());
            if (entity == null) {
                throw new IllegalStateException(
                        "좌석을 찾을 수 없습니다: eventId=" + eventId + ", seatId=" + seat.getSeatId());
            }
            entity.update(seat);
        }
        repository.flush();
    }

    @Override
    public boolean existsBooking(long eventId) {
        return repository.existsBookedSeat(eventId);
    }
}
