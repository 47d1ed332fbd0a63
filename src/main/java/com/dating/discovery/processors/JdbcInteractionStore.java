package com.dating.discovery.processors;

import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.exceptions.InternalServerErrorException;
import com.dating.discovery.models.Interaction;
import com.dating.discovery.utils.db.QueryUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcInteractionStore implements InteractionStore {
    private static final RowMapper<Interaction> INTERACTION_MAPPER = (rs, rowNum) -> Interaction.builder()
            .actorId(rs.getLong("actor_id"))
            .targetId(rs.getLong("target_id"))
            .type(InteractionType.valueOf(rs.getString("type")))
            .createdAt(rs.getObject("created_at", LocalDateTime.class))
            .updatedAt(rs.getObject("updated_at", LocalDateTime.class))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public InteractionType upsert(long actorId, long targetId, InteractionType type, LocalDateTime at) {
        List<String> written = jdbcTemplate.query(QueryUtils.getUpsertInteractionSql(),
                (rs, rowNum) -> rs.getString("type"),
                actorId, targetId, type.name(), at, at);
        if (!written.isEmpty()) {
            return InteractionType.valueOf(written.get(0));
        }

        InteractionType stored = find(actorId, targetId)
                .map(Interaction::getType)
                .orElseThrow(() -> new InternalServerErrorException(
                        "Interaction " + actorId + "->" + targetId + " neither written nor found"));
        log.debug("Kept terminal interaction {}->{} as {} (requested {})", actorId, targetId, stored, type);
        return stored;
    }

    @Override
    public Optional<Interaction> find(long actorId, long targetId) {
        return jdbcTemplate.query(QueryUtils.getFindInteractionSql(), INTERACTION_MAPPER, actorId, targetId)
                .stream().findFirst();
    }

    @Override
    public Set<Long> findTargetIds(long actorId) {
        return new HashSet<>(jdbcTemplate.queryForList(QueryUtils.getFindTargetIdsSql(), Long.class, actorId));
    }

    @Override
    public Set<Long> findTerminalActorIds(long targetId) {
        return new HashSet<>(jdbcTemplate.queryForList(QueryUtils.getFindTerminalActorIdsSql(), Long.class, targetId));
    }

    @Override
    public List<Interaction> findUnansweredPositive(long targetId, int limit) {
        return jdbcTemplate.query(QueryUtils.getFindUnansweredPositiveSql(), INTERACTION_MAPPER, targetId, limit);
    }
}
