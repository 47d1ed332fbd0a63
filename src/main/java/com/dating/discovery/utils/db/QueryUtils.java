package com.dating.discovery.utils.db;

import lombok.experimental.UtilityClass;

@UtilityClass
public final class QueryUtils {

    /*
     * Terminal rows (BLOCK, REPORT) are never overwritten, except that a BLOCK may escalate to REPORT.
     * When the WHERE clause rejects the update no row is returned and the caller re-reads the stored one.
     */
    private static final String UPSERT_INTERACTION_SQL = """
            INSERT INTO interactions (actor_id, target_id, type, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (actor_id, target_id) DO UPDATE SET
                type = EXCLUDED.type,
                updated_at = EXCLUDED.updated_at
            WHERE interactions.type NOT IN ('BLOCK', 'REPORT')
               OR (interactions.type = 'BLOCK' AND EXCLUDED.type = 'REPORT')
            RETURNING type
            """;

    private static final String FIND_INTERACTION_SQL = """
            SELECT actor_id, target_id, type, created_at, updated_at
            FROM interactions
            WHERE actor_id = ? AND target_id = ?
            """;

    private static final String FIND_TARGET_IDS_SQL =
            "SELECT target_id FROM interactions WHERE actor_id = ?";

    private static final String FIND_TERMINAL_ACTOR_IDS_SQL =
            "SELECT actor_id FROM interactions WHERE target_id = ? AND type IN ('BLOCK', 'REPORT')";

    private static final String FIND_UNANSWERED_POSITIVE_SQL = """
            SELECT i.actor_id, i.target_id, i.type, i.created_at, i.updated_at
            FROM interactions i
            WHERE i.target_id = ?
              AND i.type IN ('LIKE', 'SUPERLIKE')
              AND NOT EXISTS (
                  SELECT 1 FROM interactions r
                  WHERE r.actor_id = i.target_id AND r.target_id = i.actor_id
              )
            ORDER BY (i.type = 'SUPERLIKE') DESC, i.updated_at DESC, i.actor_id ASC
            LIMIT ?
            """;

    private static final String INSERT_MATCH_SQL = """
            INSERT INTO matches (user_low_id, user_high_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_low_id, user_high_id) DO NOTHING
            RETURNING id, user_low_id, user_high_id, created_at
            """;

    private static final String FIND_MATCH_SQL = """
            SELECT id, user_low_id, user_high_id, created_at
            FROM matches
            WHERE user_low_id = ? AND user_high_id = ?
            """;

    private static final String FIND_MATCHES_BY_USER_SQL = """
            SELECT id, user_low_id, user_high_id, created_at
            FROM matches
            WHERE user_low_id = ? OR user_high_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ? OFFSET ?
            """;

    /*
     * Rolling window: an elapsed window restarts at count 1, otherwise the count grows while below the
     * limit. An exhausted window matches neither branch of the WHERE clause, so nothing is returned.
     */
    private static final String CONSUME_QUOTA_SQL = """
            INSERT INTO rate_limit_counters (user_id, quota_name, window_start, count)
            VALUES (?, ?, ?, 1)
            ON CONFLICT (user_id, quota_name) DO UPDATE SET
                window_start = CASE WHEN rate_limit_counters.window_start <= ?
                                    THEN EXCLUDED.window_start
                                    ELSE rate_limit_counters.window_start END,
                count = CASE WHEN rate_limit_counters.window_start <= ?
                             THEN 1
                             ELSE rate_limit_counters.count + 1 END
            WHERE rate_limit_counters.window_start <= ?
               OR rate_limit_counters.count < ?
            RETURNING count
            """;

    private static final String FIND_COUNTER_SQL = """
            SELECT user_id, quota_name, window_start, count
            FROM rate_limit_counters
            WHERE user_id = ? AND quota_name = ?
            """;

    private static final String DELETE_EXPIRED_COUNTERS_SQL =
            "DELETE FROM rate_limit_counters WHERE quota_name = ? AND window_start <= ?";

    private static final String INSERT_FAVORITE_SQL = """
            INSERT INTO favorites (user_id, target_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id, target_id) DO NOTHING
            RETURNING user_id, target_id, created_at
            """;

    private static final String FIND_FAVORITE_SQL =
            "SELECT user_id, target_id, created_at FROM favorites WHERE user_id = ? AND target_id = ?";

    private static final String DELETE_FAVORITE_SQL =
            "DELETE FROM favorites WHERE user_id = ? AND target_id = ?";

    private static final String FIND_FAVORITES_BY_USER_SQL = """
            SELECT user_id, target_id, created_at
            FROM favorites
            WHERE user_id = ?
            ORDER BY created_at DESC, target_id DESC
            LIMIT ? OFFSET ?
            """;

    public static String getUpsertInteractionSql() {
        return UPSERT_INTERACTION_SQL;
    }

    public static String getFindInteractionSql() {
        return FIND_INTERACTION_SQL;
    }

    public static String getFindTargetIdsSql() {
        return FIND_TARGET_IDS_SQL;
    }

    public static String getFindTerminalActorIdsSql() {
        return FIND_TERMINAL_ACTOR_IDS_SQL;
    }

    public static String getFindUnansweredPositiveSql() {
        return FIND_UNANSWERED_POSITIVE_SQL;
    }

    public static String getInsertMatchSql() {
        return INSERT_MATCH_SQL;
    }

    public static String getFindMatchSql() {
        return FIND_MATCH_SQL;
    }

    public static String getFindMatchesByUserSql() {
        return FIND_MATCHES_BY_USER_SQL;
    }

    public static String getConsumeQuotaSql() {
        return CONSUME_QUOTA_SQL;
    }

    public static String getFindCounterSql() {
        return FIND_COUNTER_SQL;
    }

    public static String getDeleteExpiredCountersSql() {
        return DELETE_EXPIRED_COUNTERS_SQL;
    }

    public static String getInsertFavoriteSql() {
        return INSERT_FAVORITE_SQL;
    }

    public static String getFindFavoriteSql() {
        return FIND_FAVORITE_SQL;
    }

    public static String getDeleteFavoriteSql() {
        return DELETE_FAVORITE_SQL;
    }

    public static String getFindFavoritesByUserSql() {
        return FIND_FAVORITES_BY_USER_SQL;
    }
}
