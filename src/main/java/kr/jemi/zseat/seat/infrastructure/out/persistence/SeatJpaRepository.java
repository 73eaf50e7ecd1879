package kr.jemi.zseat.seat.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface SeatJpaRepository extends JpaRepository<SeatJpaEntity, Long> {

    long countByEventId(long eventId);

    @EntityGraph(attributePaths = "bookings")
    List<SeatJpaEntity> findByEventIdOrderByRowLetterAscColumnNumberAsc(long eventId);

    // 행 우선 순서로 잠가서 겹치는 배치끼리 데드락 없이 대기하게 한다
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SeatJpaEntity s " +
            "where s.eventId = :eventId and s.seatCode in :seatCodes " +
            "order by s.rowLetter asc, s.columnNumber asc")
    List<SeatJpaEntity> findForUpdate(@Param("eventId") long eventId,
                                      @Param("seatCodes") Collection<String> seatCodes);

    @Query("select case when count(s) > 0 then true else false end " +
            "from SeatJpaEntity s where s.eventId = :eventId and s.bookings is not empty")
    boolean existsBookedSeat(@Param("eventId") long eventId);
}
