package com.dating.discovery.processors;

import com.dating.discovery.models.RateLimitCounter;
import com.dating.discovery.utils.db.QueryUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

@Component
@RequiredArgsConstructor
public class JdbcRateLimitStore implements RateLimitStore {
    private final JdbcTemplate jdbcTemplate;

    @Override
    public OptionalInt tryConsume(long userId, String quotaName, int limit, LocalDateTime now, LocalDateTime windowExpiredAt) {
        List<Integer> counts = jdbcTemplate.query(QueryUtils.getConsumeQuotaSql(),
                (rs, rowNum) -> rs.getInt("count"),
                userId, quotaName, now, windowExpiredAt, windowExpiredAt, windowExpiredAt, limit);
        return counts.isEmpty() ? OptionalInt.empty() : OptionalInt.of(counts.get(0));
    }

    @Override
    public Optional<RateLimitCounter> find(long userId, String quotaName) {
        return jdbcTemplate.query(QueryUtils.getFindCounterSql(), (rs, rowNum) -> RateLimitCounter.builder()
                        .userId(rs.getLong("user_id"))
                        .quotaName(rs.getString("quota_name"))
                        .windowStart(rs.getObject("window_start", LocalDateTime.class))
                        .count(rs.getInt("count"))
                        .build(),
                userId, quotaName).stream().findFirst();
    }

    @Override
    public int deleteExpired(String quotaName, LocalDateTime windowExpiredAt) {
        return jdbcTemplate.update(QueryUtils.getDeleteExpiredCountersSql(), quotaName, windowExpiredAt);
    }
}
