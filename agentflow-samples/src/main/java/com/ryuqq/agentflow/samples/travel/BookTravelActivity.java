package com.ryuqq.agentflow.samples.travel;

import com.ryuqq.agentflow.core.orchestration.Activity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 승인된 여행 계획 예약 Activity.
 *
 * <p>예약 ID는 입력에서 결정적으로 만들어집니다 ({@code TRV-0000} 형식).</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class BookTravelActivity implements Activity {

    public static final String NAME = "book_travel_activity";

    private static final Logger log = LoggerFactory.getLogger(BookTravelActivity.class);

    @Override
    public Object run(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("booking input cannot be null or blank");
        }
        String bookingId = String.format("TRV-%04d", Math.floorMod(input.hashCode(), 10_000));

        Map<String, Object> booking = new LinkedHashMap<>();
        booking.put("booked", true);
        booking.put("booking_id", bookingId);
        booking.put("status", "confirmed");
        booking.put("message", "Travel booking confirmed successfully");

        log.info("Travel booking confirmed: {}", bookingId);
        return booking;
    }
}
