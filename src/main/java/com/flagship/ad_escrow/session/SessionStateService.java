package com.flagship.ad_escrow.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-user dialogue bookkeeping. Holds no campaign or balance state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStateService {

    private static final TypeReference<Map<String, String>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * The user's session, or IDLE with no attributes when none is stored.
     */
    @Transactional(readOnly = true)
    public SessionState current(UUID userId) {
        List<SessionState> found = jdbcTemplate.query(
            "SELECT user_id, step, attributes::text AS attributes, updated_at FROM conversation_sessions WHERE user_id = ?",
            (rs, rowNum) -> new SessionState(
                rs.getObject("user_id", UUID.class),
                ConversationStep.valueOf(rs.getString("step")),
                readAttributes(rs.getString("attributes")),
                rs.getTimestamp("updated_at").toInstant()
            ),
            userId
        );
        return found.isEmpty() ? SessionState.idle(userId) : found.get(0);
    }

    /**
     * Moves the user to {@code step}, merging {@code attributes} into the stored ones.
     */
    @Transactional
    public SessionState advance(UUID userId, ConversationStep step, Map<String, String> attributes) {
        Map<String, String> merged = new HashMap<>(current(userId).getAttributes());
        merged.putAll(attributes);
        Instant now = clock.instant();

        jdbcTemplate.update(
            "INSERT INTO conversation_sessions (user_id, step, attributes, updated_at) VALUES (?, ?, ?::jsonb, ?) " +
            "ON CONFLICT (user_id) DO UPDATE SET step = EXCLUDED.step, attributes = EXCLUDED.attributes, " +
            "updated_at = EXCLUDED.updated_at",
            userId, step.name(), writeAttributes(merged), Timestamp.from(now)
        );
        log.debug("Session advanced: userId={}, step={}", userId, step);
        return new SessionState(userId, step, Map.copyOf(merged), now);
    }

    @Transactional
    public void clear(UUID userId) {
        int deleted = jdbcTemplate.update("DELETE FROM conversation_sessions WHERE user_id = ?", userId);
        log.debug("Session cleared: userId={}, existed={}", userId, deleted > 0);
    }

    private Map<String, String> readAttributes(String json) {
        try {
            return json == null ? Map.of() : Map.copyOf(objectMapper.readValue(json, ATTRIBUTES_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt session attributes: " + e.getMessage(), e);
        }
    }

    private String writeAttributes(Map<String, String> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Session attributes are not serializable", e);
        }
    }
}
