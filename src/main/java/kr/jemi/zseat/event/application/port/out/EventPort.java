package kr.jemi.zseat.event.application.port.out;

import kr.jemi.zseat.event.domain.Event;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface EventPort {

    Event insert(Event event);

    Event update(Event event);

    Optional<Event> findById(long eventId);

    /**
     * 트랜잭션이 끝날 때까지 이벤트 행에 배타 잠금을 건다.
     * 진행 중인 예약 트랜잭션(공유 잠금)이 모두 끝나야 반환된다.
     */
    Optional<Event> findByIdForUpdate(long eventId);

    /**
     * 공유 잠금. 예약끼리는 서로 막지 않고, 마감/삭제/좌석 초기화와는 직렬화된다.
     */
    Optional<Event> findByIdForShare(long eventId);

    boolean existsByDate(LocalDate date);

    void delete(long eventId);

    List<Event> findUpcoming(LocalDate today);

    List<Event> findPast(LocalDate today);

    List<Event> findRecent(LocalDate today, LocalDateTime createdSince);
}
