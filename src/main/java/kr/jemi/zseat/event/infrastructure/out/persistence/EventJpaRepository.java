package kr.jemi.zseat.event.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface EventJpaRepository extends JpaRepository<EventJpaEntity, Long> {

    boolean existsByDate(LocalDate date);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM EventJpaEntity e WHERE e.id = :id")
    Optional<EventJpaEntity> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT e FROM EventJpaEntity e WHERE e.id = :id")
    Optional<EventJpaEntity> findByIdForShare(@Param("id") Long id);

    List<EventJpaEntity> findByDateAfterAndRegistrationClosedFalseOrderByDateAsc(LocalDate today);

    @Query("SELECT e FROM EventJpaEntity e " +
            "WHERE e.date < :today OR e.registrationClosed = true " +
            "ORDER BY e.date DESC")
    List<EventJpaEntity> findPast(@Param("today") LocalDate today);

    List<EventJpaEntity> findByCreatedAtGreaterThanEqualAndDateAfterAndRegistrationClosedFalseOrderByCreatedAtDesc(
            LocalDateTime createdSince, LocalDate today);
}
