package com.dating.discovery.repo;

import com.dating.discovery.models.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProfileRepository extends JpaRepository<Profile, Long> {

    @Query("SELECT p FROM Profile p LEFT JOIN FETCH p.interests WHERE p.userId = :userId")
    Optional<Profile> findWithInterestsByUserId(@Param("userId") Long userId);

    @Query("SELECT DISTINCT p FROM Profile p LEFT JOIN FETCH p.interests WHERE p.userId IN :ids")
    List<Profile> findAllWithInterestsByUserIdIn(@Param("ids") Collection<Long> ids);

    /*
     * One keyset page of the coarse pool. Visibility, gender, birth-date range, the candidate's side of the
     * gender preference and both interaction exclusions are pushed down; distance is not.
     */
    @Query(value = """
        SELECT p.user_id AS userId, p.created_at AS createdAt
        FROM profiles p
        LEFT JOIN discovery_settings ds ON ds.user_id = p.user_id
        WHERE p.user_id <> :viewerId
          AND p.is_visible = true
          AND p.is_banned = false
          AND p.gender IN (:genders)
          AND p.birth_date BETWEEN :bornOnOrAfter AND :bornOnOrBefore
          AND COALESCE(ds.preferred_gender, p.orientation, 'ANY') IN ('ANY', :viewerGender)
          AND NOT EXISTS (
                SELECT 1 FROM interactions i
                WHERE i.actor_id = :viewerId AND i.target_id = p.user_id
              )
          AND NOT EXISTS (
                SELECT 1 FROM interactions b
                WHERE b.actor_id = p.user_id AND b.target_id = :viewerId
                  AND b.type IN ('BLOCK', 'REPORT')
              )
          AND (
                CAST(:cursorCreatedAt AS timestamp) IS NULL
                OR (p.created_at, p.user_id) < (CAST(:cursorCreatedAt AS timestamp), CAST(:cursorUserId AS bigint))
              )
        ORDER BY p.created_at DESC, p.user_id DESC
        LIMIT :limit
        """, nativeQuery = true)
    List<CandidateCursorProjection> findCandidatePage(
            @Param("viewerId") long viewerId,
            @Param("viewerGender") String viewerGender,
            @Param("genders") Collection<String> genders,
            @Param("bornOnOrAfter") LocalDate bornOnOrAfter,
            @Param("bornOnOrBefore") LocalDate bornOnOrBefore,
            @Param("cursorCreatedAt") LocalDateTime cursorCreatedAt,
            @Param("cursorUserId") Long cursorUserId,
            @Param("limit") int limit
    );
}
