package com.travelcrm.domain.booking.repository;

import com.travelcrm.domain.booking.dto.BookingSearchCondition;
import com.travelcrm.domain.booking.entity.Booking;
import com.travelcrm.domain.booking.entity.BookingStatus;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 조건이 선택적인 예약 목록 검색은 파생 쿼리로 표현하기 어려워 DatabaseClient로 직접 작성
 */
@Repository
@RequiredArgsConstructor
public class BookingQueryRepository {

    private final DatabaseClient databaseClient;

    public Flux<Booking> search(BookingSearchCondition condition) {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = buildWhere(condition, params);

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                "SELECT * FROM bookings" + where + " ORDER BY created_at DESC LIMIT :limit OFFSET :offset");
        for (Map.Entry<String, Object> param : params.entrySet()) {
            spec = spec.bind(param.getKey(), param.getValue());
        }
        return spec.bind("limit", condition.getSize())
                .bind("offset", condition.offset())
                .map(BookingQueryRepository::toBooking)
                .all();
    }

    public Mono<Long> count(BookingSearchCondition condition) {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = buildWhere(condition, params);

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("SELECT COUNT(*) AS total FROM bookings" + where);
        for (Map.Entry<String, Object> param : params.entrySet()) {
            spec = spec.bind(param.getKey(), param.getValue());
        }
        return spec.map(row -> row.get("total", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    private static String buildWhere(BookingSearchCondition condition, Map<String, Object> params) {
        StringBuilder where = new StringBuilder();
        if (condition.getStatus() != null) {
            append(where, "status = :status");
            params.put("status", condition.getStatus().name());
        }
        if (condition.getCustomerId() != null) {
            append(where, "customer_id = :customerId");
            params.put("customerId", condition.getCustomerId());
        }
        if (condition.getPackageId() != null) {
            append(where, "package_id = :packageId");
            params.put("packageId", condition.getPackageId());
        }
        if (condition.getKeyword() != null && !condition.getKeyword().isBlank()) {
            append(where, "booking_code LIKE :keyword");
            params.put("keyword", "%" + condition.getKeyword().trim() + "%");
        }
        return where.toString();
    }

    private static void append(StringBuilder where, String clause) {
        where.append(where.length() == 0 ? " WHERE " : " AND ").append(clause);
    }

    private static Booking toBooking(Readable row) {
        return Booking.builder()
                .id(row.get("id", Long.class))
                .bookingCode(row.get("booking_code", String.class))
                .customerId(row.get("customer_id", Long.class))
                .packageId(row.get("package_id", Long.class))
                .participants(row.get("participants", Integer.class))
                .totalAmount(row.get("total_amount", BigDecimal.class))
                .departureDate(row.get("departure_date", LocalDateTime.class))
                .status(BookingStatus.valueOf(row.get("status", String.class)))
                .notes(row.get("notes", String.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
