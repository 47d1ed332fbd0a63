package com.dating.discovery.processors;

import com.dating.discovery.dto.MatchCreation;
import com.dating.discovery.models.Match;
import com.dating.discovery.utils.db.QueryUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcMatchStore implements MatchStore {
    static final RowMapper<Match> MATCH_MAPPER = (rs, rowNum) -> Match.builder()
            .id(rs.getLong("id"))
            .userLowId(rs.getLong("user_low_id"))
            .userHighId(rs.getLong("user_high_id"))
            .createdAt(rs.getObject("created_at", LocalDateTime.class))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public MatchCreation insertIfAbsent(long userLowId, long userHighId, LocalDateTime at) {
        if (userLowId >= userHighId) {
            throw new IllegalArgumentException("Match pair must be ordered: " + userLowId + " >= " + userHighId);
        }

        try {
            List<Match> inserted = jdbcTemplate.query(QueryUtils.getInsertMatchSql(), MATCH_MAPPER,
                    userLowId, userHighId, at);
            if (!inserted.isEmpty()) {
                return new MatchCreation(inserted.get(0), true);
            }
        } catch (DuplicateKeyException e) {
            log.debug("Unique violation on match {}-{}, treating as existing", userLowId, userHighId);
        }

        return find(userLowId, userHighId)
                .map(existing -> new MatchCreation(existing, false))
                .orElseThrow(() -> new TransientDataAccessResourceException(
                        "Match " + userLowId + "-" + userHighId + " conflicted but is not visible yet"));
    }

    @Override
    public Optional<Match> find(long userLowId, long userHighId) {
        return jdbcTemplate.query(QueryUtils.getFindMatchSql(), MATCH_MAPPER, userLowId, userHighId)
                .stream().findFirst();
    }

    @Override
    public List<Match> findByUser(long userId, int offset, int limit) {
        return jdbcTemplate.query(QueryUtils.getFindMatchesByUserSql(), MATCH_MAPPER, userId, userId, limit, offset);
    }
}
