package kr.jemi.zseat.seat.domain;

import java.util.ArrayList;
import java.util.List;

public final class SeatLayout {

    public static final int ROWS = 26;
    public static final int COLUMNS_PER_ROW = 10;
    public static final int MAX_CAPACITY = ROWS * COLUMNS_PER_ROW;

    private SeatLayout() {}

    public static int seatCount(int capacity) {
        return Math.max(0, Math.min(capacity, MAX_CAPACITY));
    }

    /**
     * A1..A10, B1..B10 순서로 capacity개(최대 260개)까지 좌석 번호를 만든다.
     */
    public static List<SeatId> generate(int capacity) {
        int count = seatCount(capacity);
        List<SeatId> seatIds = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            char row = (char) ('A' + i / COLUMNS_PER_ROW);
            int column = i % COLUMNS_PER_ROW + 1;
            seatIds.add(new SeatId(row, column));
        }
        return seatIds;
    }
}
