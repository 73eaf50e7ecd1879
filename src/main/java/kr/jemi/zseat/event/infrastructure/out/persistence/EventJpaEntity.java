package kr.jemi.zseat.event.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zseat.event.domain.Event;
import org.springframework.data.domain.Persistable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "events",
        uniqueConstraints = @UniqueConstraint(name = "uk_event_date", columnNames = "event_date"),
        indexes = @Index(name = "idx_event_created_at", columnList = "created_at"))
public class EventJpaEntity implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "event_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime time;

    @Column(nullable = false, length = 2000)
    private String description;

    @Column(nullable = false)
    private String venue;

    @Column(nullable = false)
    private int capacity;

    @Column(name = "registration_closed", nullable = false)
    private boolean registrationClosed;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    // TSID를 직접 할당하므로 save 시 merge(SELECT) 대신 persist 되도록
    @Transient
    private boolean isNew = true;

    protected EventJpaEntity() {}

    public static EventJpaEntity fromDomain(Event event) {
        EventJpaEntity entity = new EventJpaEntity();
        entity.id = event.getId();
        entity.update(event);
        return entity;
    }

    public Event toDomain() {
        return new Event(id, name, date, time, description, venue, capacity, registrationClosed, createdAt);
    }

    public void update(Event event) {
        this.name = event.getName();
        this.date = event.getDate();
        this.time = event.getTime();
        this.description = event.getDescription();
        this.venue = event.getVenue();
        this.capacity = event.getCapacity();
        this.registrationClosed = event.isRegistrationClosed();
        this.createdAt = event.getCreatedAt();
    }

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PrePersist
    void markNotNew() {
        this.isNew = false;
    }

    public boolean isRegistrationClosed() {
        return registrationClosed;
    }
}
