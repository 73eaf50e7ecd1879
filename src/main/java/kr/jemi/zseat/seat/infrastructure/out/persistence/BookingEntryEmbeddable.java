package kr.jemi.zseat.seat.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import kr.jemi.zseat.seat.domain.BookingEntry;
import kr.jemi.zseat.seat.domain.BookingStatus;
import kr.jemi.zseat.seat.domain.Occupant;

import java.time.LocalDate;
import java.util.Objects;

@Embeddable
public class BookingEntryEmbeddable {

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "occupant_name", nullable = false)
    private String occupantName;

    @Column(name = "occupant_email", nullable = false)
    private String occupantEmail;

    @Column(name = "occupant_phone")
    private String occupantPhone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    protected BookingEntryEmbeddable() {}

    public static BookingEntryEmbeddable fromDomain(BookingEntry entry) {
        BookingEntryEmbeddable embeddable = new BookingEntryEmbeddable();
        embeddable.bookingDate = entry.date();
        embeddable.occupantName = entry.occupant().name();
        embeddable.occupantEmail = entry.occupant().email();
        embeddable.occupantPhone = entry.occupant().phone();
        embeddable.status = entry.status();
        return embeddable;
    }

    public BookingEntry toDomain() {
        return new BookingEntry(bookingDate,
                new Occupant(occupantName, occupantEmail, occupantPhone), status);
    }

    public LocalDate getBookingDate() {
        return bookingDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BookingEntryEmbeddable that)) return false;
        return Objects.equals(bookingDate, that.bookingDate)
                && Objects.equals(occupantName, that.occupantName)
                && Objects.equals(occupantEmail, that.occupantEmail)
                && Objects.equals(occupantPhone, that.occupantPhone)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookingDate, occupantName, occupantEmail, occupantPhone, status);
    }
}
