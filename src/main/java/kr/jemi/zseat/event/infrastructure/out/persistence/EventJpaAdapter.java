package kr.jemi.zseat.event.infrastructure.out.persistence;

import kr.jemi.zseat.event.application.port.out.EventPort;
import kr.jemi.zseat.event.domain.Event;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
public class EventJpaAdapter implements EventPort {

    private final EventJpaRepository repository;

    public EventJpaAdapter(EventJpaRepository repository) {
        this.repository = repository;
    }

    /**
     * 날짜 유니크 제약 위반이 호출 시점에 드러나도록 flush 한다.
     */
    @Override
    public Event insert(Event event) {
        return repository.saveAndFlush(EventJpaEntity.fromDomain(event)).toDomain();
    }

    @Override
    public Event update(Event event) {
        EventJpaEntity entity = repository.findById(event.getId())
                .orElseThrow(() -> new IllegalStateException(
                        "이벤트를 찾을 수 없습니다: id=" + event.getId()));
        entity.update(event);
        return repository.save(entity).toDomain();
    }

    @Override
    public Optional<Event> findById(long eventId) {
        return repository.findById(eventId).map(EventJpaEntity::toDomain);
    }

    @Override
    public Optional<Event> findByIdForUpdate(long eventId) {
        return repository.findByIdForUpdate(eventId).map(EventJpaEntity::toDomain);
    }

    @Override
    public Optional<Event> findByIdForShare(long eventId) {
        return repository.findByIdForShare(eventId).map(EventJpaEntity::toDomain);
    }

    @Override
    public boolean existsByDate(LocalDate date) {
        return repository.existsByDate(date);
    }

    @Override
    public void delete(long eventId) {
        repository.deleteById(eventId);
    }

    @Override
    public List<Event> findUpcoming(LocalDate today) {
        return repository.findByDateAfterAndRegistrationClosedFalseOrderByDateAsc(today).stream()
                .map(EventJpaEntity::toDomain)
                .toList();
    }

    @Override
    public List<Event> findPast(LocalDate today) {
        return repository.findPast(today).stream()
                .map(EventJpaEntity::toDomain)
                .toList();
    }

    @Override
    public List<Event> findRecent(LocalDate today, LocalDateTime createdSince) {
        return repository.findByCreatedAtGreaterThanEqualAndDateAfterAndRegistrationClosedFalseOrderByCreatedAtDesc(
                        createdSince, today).stream()
                .map(EventJpaEntity::toDomain)
                .toList();
    }
}
