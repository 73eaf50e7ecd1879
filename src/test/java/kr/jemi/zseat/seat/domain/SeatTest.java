package kr.jemi.zseat.seat.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SeatTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 1);
    private static final Occupant ASHA = new Occupant("Asha", "a@x.com", null);

    @Nested
    @DisplayName("book() - 날짜별 예약 추가")
    class Book {

        @Test
        @DisplayName("빈 좌석을 예약하면 해당 날짜의 BOOKED 예약이 하나 생긴다")
        void shouldAppendEntry() {
            Seat seat = Seat.create(1L, SeatId.parse("A1"), 200);

            BookingEntry entry = seat.book(DATE, ASHA);

            assertThat(entry.status()).isEqualTo(BookingStatus.BOOKED);
            assertThat(seat.isBookedOn(DATE)).isTrue();
            assertThat(seat.getBookings()).containsExactly(entry);
        }

        @Test
        @DisplayName("같은 날짜에 두 번 예약하면 IllegalStateException이 발생하고 장부는 그대로다")
        void shouldRejectSecondBookingOnSameDate() {
            Seat seat = Seat.create(1L, SeatId.parse("A1"), 200);
            seat.book(DATE, ASHA);

            assertThatThrownBy(() -> seat.book(DATE, new Occupant("Ravi", "r@x.com", "9999999999")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("A1");
            assertThat(seat.getBookings()).hasSize(1);
        }

        @Test
        @DisplayName("다른 날짜라면 같은 좌석도 예약할 수 있다")
        void shouldAllowDifferentDate() {
            Seat seat = Seat.create(1L, SeatId.parse("A1"), 200);
            seat.book(DATE, ASHA);

            seat.book(DATE.plusDays(1), ASHA);

            assertThat(seat.getBookings()).extracting(BookingEntry::date)
                    .containsExactly(DATE, DATE.plusDays(1));
        }
    }

    @Test
    @DisplayName("예약 장부는 외부에서 수정할 수 없다")
    void bookingsAreReadOnly() {
        Seat seat = new Seat(1L, SeatId.parse("A1"), 200, List.of(BookingEntry.booked(DATE, ASHA)));

        assertThatThrownBy(() -> seat.getBookings().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("음수 가격은 검증에 실패한다")
    void negativePrice() {
        assertThatThrownBy(() -> Seat.create(1L, SeatId.parse("A1"), -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("price");
    }

    @Test
    @DisplayName("예약자 이름이나 이메일이 비어 있으면 검증에 실패한다")
    void occupantRequiresNameAndEmail() {
        assertThatThrownBy(() -> new Occupant("", "a@x.com", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");
        assertThatThrownBy(() -> new Occupant("Asha", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("email");
    }
}
