package com.dating.discovery.processors;

import com.dating.discovery.dto.MatchCreation;
import com.dating.discovery.models.Match;
import com.dating.discovery.utils.db.QueryUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class JdbcMatchStoreTest {
    private static final LocalDateTime AT = LocalDateTime.of(2025, 6, 1, 12, 0);

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcMatchStore matchStore;

    private final Match existing = Match.builder().id(7L).userLowId(1L).userHighId(2L).createdAt(AT).build();

    @Test
    @SuppressWarnings("unchecked")
    void insertIfAbsent_ReturnsCreatedRow() {
        given(jdbcTemplate.query(eq(QueryUtils.getInsertMatchSql()), any(RowMapper.class), eq(1L), eq(2L), eq(AT)))
                .willReturn(List.of(existing));

        MatchCreation creation = matchStore.insertIfAbsent(1, 2, AT);

        assertThat(creation.created()).isTrue();
        assertThat(creation.match().getId()).isEqualTo(7L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void insertIfAbsent_ConflictReadsExistingRow() {
        given(jdbcTemplate.query(eq(QueryUtils.getInsertMatchSql()), any(RowMapper.class), eq(1L), eq(2L), eq(AT)))
                .willReturn(List.of());
        given(jdbcTemplate.query(eq(QueryUtils.getFindMatchSql()), any(RowMapper.class), eq(1L), eq(2L)))
                .willReturn(List.of(existing));

        MatchCreation creation = matchStore.insertIfAbsent(1, 2, AT);

        assertThat(creation.created()).isFalse();
        assertThat(creation.match()).isEqualTo(existing);
    }

    @Test
    @SuppressWarnings("unchecked")
    void insertIfAbsent_UniqueViolationReadsExistingRow() {
        given(jdbcTemplate.query(eq(QueryUtils.getInsertMatchSql()), any(RowMapper.class), eq(1L), eq(2L), eq(AT)))
                .willThrow(new DuplicateKeyException("uq_matches_pair"));
        given(jdbcTemplate.query(eq(QueryUtils.getFindMatchSql()), any(RowMapper.class), eq(1L), eq(2L)))
                .willReturn(List.of(existing));

        assertThat(matchStore.insertIfAbsent(1, 2, AT).created()).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void insertIfAbsent_InvisibleConflictIsTransient() {
        given(jdbcTemplate.query(eq(QueryUtils.getInsertMatchSql()), any(RowMapper.class), eq(1L), eq(2L), eq(AT)))
                .willReturn(List.of());
        given(jdbcTemplate.query(eq(QueryUtils.getFindMatchSql()), any(RowMapper.class), eq(1L), eq(2L)))
                .willReturn(List.of());

        assertThatThrownBy(() -> matchStore.insertIfAbsent(1, 2, AT))
                .isInstanceOf(TransientDataAccessResourceException.class);
    }

    @Test
    void insertIfAbsent_RejectsUnorderedPair() {
        assertThatThrownBy(() -> matchStore.insertIfAbsent(2, 1, AT)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> matchStore.insertIfAbsent(3, 3, AT)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(jdbcTemplate);
    }
}
