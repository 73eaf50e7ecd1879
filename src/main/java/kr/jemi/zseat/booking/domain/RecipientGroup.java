package kr.jemi.zseat.booking.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 같은 이메일로 예약된 좌석 묶음. 이름은 해당 이메일로 처음 들어온 요청의 이름을 쓴다.
 */
public record RecipientGroup(String email, String name, List<String> seatIds) {

    public RecipientGroup {
        seatIds = List.copyOf(seatIds);
    }

    public static List<RecipientGroup> groupByEmail(List<ConfirmedBooking> bookings) {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, List<String>> seats = new LinkedHashMap<>();
        for (ConfirmedBooking booking : bookings) {
            names.putIfAbsent(booking.email(), booking.name());
            seats.computeIfAbsent(booking.email(), email -> new ArrayList<>()).add(booking.seatId());
        }
        return names.entrySet().stream()
                .map(entry -> new RecipientGroup(entry.getKey(), entry.getValue(), seats.get(entry.getKey())))
                .toList();
    }
}
