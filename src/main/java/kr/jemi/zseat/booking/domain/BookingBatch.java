package kr.jemi.zseat.booking.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 전부 성공하거나 전부 실패해야 하는 한 이벤트 대상의 예약 요청 묶음.
 */
public record BookingBatch(long eventId, List<SeatRequest> requests) {

    public BookingBatch {
        // null 요소는 검증 단계에서 거절하므로 그대로 보존한다
        requests = requests == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(requests));
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    public List<String> seatIds() {
        return requests.stream().map(SeatRequest::seatId).toList();
    }

    /**
     * 요청 순서상 처음으로 두 번째 등장한 좌석 번호.
     */
    public Optional<String> duplicatedSeatId() {
        Set<String> seen = new HashSet<>();
        return seatIds().stream()
                .filter(seatId -> !seen.add(seatId))
                .findFirst();
    }
}
