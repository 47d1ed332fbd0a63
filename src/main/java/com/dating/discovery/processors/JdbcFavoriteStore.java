package com.dating.discovery.processors;

import com.dating.discovery.exceptions.InternalServerErrorException;
import com.dating.discovery.models.Favorite;
import com.dating.discovery.utils.db.QueryUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcFavoriteStore implements FavoriteStore {
    static final RowMapper<Favorite> FAVORITE_MAPPER = (rs, rowNum) -> Favorite.builder()
            .userId(rs.getLong("user_id"))
            .targetId(rs.getLong("target_id"))
            .createdAt(rs.getObject("created_at", LocalDateTime.class))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Favorite addIfAbsent(long userId, long targetId, LocalDateTime at) {
        List<Favorite> inserted = jdbcTemplate.query(QueryUtils.getInsertFavoriteSql(), FAVORITE_MAPPER,
                userId, targetId, at);
        if (!inserted.isEmpty()) {
            return inserted.get(0);
        }
        log.debug("Favorite {}->{} already present", userId, targetId);
        return find(userId, targetId).orElseThrow(() -> new InternalServerErrorException(
                "Favorite " + userId + "->" + targetId + " neither inserted nor found"));
    }

    @Override
    public boolean remove(long userId, long targetId) {
        return jdbcTemplate.update(QueryUtils.getDeleteFavoriteSql(), userId, targetId) > 0;
    }

    @Override
    public Optional<Favorite> find(long userId, long targetId) {
        return jdbcTemplate.query(QueryUtils.getFindFavoriteSql(), FAVORITE_MAPPER, userId, targetId)
                .stream().findFirst();
    }

    @Override
    public List<Favorite> findByUser(long userId, int offset, int limit) {
        return jdbcTemplate.query(QueryUtils.getFindFavoritesByUserSql(), FAVORITE_MAPPER, userId, limit, offset);
    }
}
