package kr.jemi.zseat.seat.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zseat.seat.domain.BookingEntry;
import kr.jemi.zseat.seat.domain.Seat;
import kr.jemi.zseat.seat.domain.SeatId;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "seats",
        uniqueConstraints = @UniqueConstraint(name = "uk_seat_event_code", columnNames = {"event_id", "seat_code"}),
        indexes = @Index(name = "idx_seat_event_position", columnList = "event_id, row_letter, column_number"))
public class SeatJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false)
    private long eventId;

    @Column(name = "seat_code", nullable = false, length = 3)
    private String seatCode;

    @Column(name = "row_letter", nullable = false, length = 1)
    private String rowLetter;

    @Column(name = "column_number", nullable = false)
    private int columnNumber;

    @Column(nullable = false)
    private int price;

    // (seat_id, booking_date) 유니크 제약이 저장소 수준의 중복 예약 방지선
    @ElementCollection
    @CollectionTable(name = "seat_bookings",
            joinColumns = @JoinColumn(name = "seat_id"),
            uniqueConstraints = @UniqueConstraint(name = "uk_seat_booking_date", columnNames = {"seat_id", "booking_date"}))
    @OrderBy("bookingDate ASC")
    private Set<BookingEntryEmbeddable> bookings = new LinkedHashSet<>();

    protected SeatJpaEntity() {}

    public static SeatJpaEntity fromDomain(Seat seat) {
        SeatJpaEntity entity = new SeatJpaEntity();
        entity.eventId = seat.getEventId();
        entity.seatCode = seat.getSeatId().value();
        entity.rowLetter = String.valueOf(seat.getSeatId().row());
        entity.columnNumber = seat.getSeatId().column();
        entity.price = seat.getPrice();
        seat.getBookings().forEach(entry -> entity.bookings.add(BookingEntryEmbeddable.fromDomain(entry)));
        return entity;
    }

    public Seat toDomain() {
        List<BookingEntry> entries = bookings.stream()
                .map(BookingEntryEmbeddable::toDomain)
                .toList();
        return new Seat(eventId, new SeatId(rowLetter.charAt(0), columnNumber), price, entries);
    }

    /**
     * 장부는 추가만 되므로 도메인에 있고 엔티티에 없는 예약만 반영한다.
     */
    public void update(Seat seat) {
        this.price = seat.getPrice();
        seat.getBookings().forEach(entry -> bookings.add(BookingEntryEmbeddable.fromDomain(entry)));
    }

    public Long getId() { return id; }
    public long getEventId() { return eventId; }
    public String getSeatCode() { return seatCode; }
    public Set<BookingEntryEmbeddable> getBookings() { return bookings; }
}
