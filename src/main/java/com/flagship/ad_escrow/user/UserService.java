package com.flagship.ad_escrow.user;

import com.flagship.ad_escrow.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registration and lookup of users.
 *
 * Users are created on first contact and never deleted. A deactivated user keeps
 * its balance and history but is treated as unknown by every command.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private static final String SELECT_USER =
        "SELECT id, external_id, username, role, active, balance, created_at, updated_at FROM users ";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Registers a user, or returns the existing one for the same external id.
     * The role of an existing user is left untouched.
     */
    @Transactional
    public User register(long externalId, String username, UserRole role) {
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        Timestamp now = Timestamp.from(clock.instant());
        int inserted = jdbcTemplate.update(
            "INSERT INTO users (id, external_id, username, role, active, balance, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, TRUE, 0, ?, ?) ON CONFLICT (external_id) DO NOTHING",
            UUID.randomUUID(), externalId, username, role.name(), now, now
        );

        User user = findByExternalId(externalId)
            .orElseThrow(() -> new IllegalStateException("User vanished after registration: " + externalId));

        if (inserted == 1) {
            log.info("Registered user: userId={}, externalId={}, role={}", user.getId(), externalId, role);
        } else {
            log.debug("User already registered: userId={}, externalId={}", user.getId(), externalId);
        }
        return user;
    }

    @Transactional
    public User deactivate(UUID userId) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET active = FALSE, updated_at = ? WHERE id = ?",
            Timestamp.from(clock.instant()), userId
        );
        if (updated == 0) {
            throw new NotFoundException("User not found: " + userId);
        }
        log.info("Deactivated user: userId={}", userId);
        return findById(userId).orElseThrow();
    }

    public Optional<User> findById(UUID userId) {
        List<User> users = jdbcTemplate.query(SELECT_USER + "WHERE id = ?", userRowMapper(), userId);
        return users.stream().findFirst();
    }

    public Optional<User> findByExternalId(long externalId) {
        List<User> users = jdbcTemplate.query(SELECT_USER + "WHERE external_id = ?", userRowMapper(), externalId);
        return users.stream().findFirst();
    }

    /**
     * Resolves the acting user of a command. Unknown and deactivated users look the same to callers.
     */
    public User requireActive(UUID userId) {
        return findById(userId)
            .filter(User::isActive)
            .orElseThrow(() -> new NotFoundException("Active user not found: " + userId));
    }

    private RowMapper<User> userRowMapper() {
        return (rs, rowNum) -> new User(
            rs.getObject("id", UUID.class),
            rs.getLong("external_id"),
            rs.getString("username"),
            UserRole.valueOf(rs.getString("role")),
            rs.getBoolean("active"),
            rs.getLong("balance"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
