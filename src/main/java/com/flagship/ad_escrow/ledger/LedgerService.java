package com.flagship.ad_escrow.ledger;

import com.flagship.ad_escrow.error.InsufficientFundsException;
import com.flagship.ad_escrow.error.NotFoundException;
import com.flagship.ad_escrow.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only balance store.
 *
 * Invariants:
 * 1. Every mutation writes exactly one transaction row and moves the cached
 *    balance by the same signed amount, in one database transaction.
 * 2. Calls for one actor serialize on the actor's row lock; different actors never block each other.
 * 3. A balance never goes negative (guarded update plus CHECK constraint).
 * 4. (reference, kind) is unique: repeating it returns the original transaction
 *    and leaves the balance untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final EngineMetrics metrics;
    private final Clock clock;

    /**
     * Removes {@code amount} from the actor's balance.
     *
     * @throws InsufficientFundsException if the balance is lower than {@code amount}; nothing is written
     * @throws NotFoundException if the actor does not exist
     */
    @Transactional
    public LedgerTransaction debit(UUID actorId, long amount, String reference, TransactionKind kind) {
        if (!kind.isDebit()) {
            throw new IllegalArgumentException("Kind " + kind + " cannot be used for a debit");
        }
        return post(actorId, amount, reference, kind);
    }

    /**
     * Adds {@code amount} to the actor's balance.
     *
     * @throws NotFoundException if the actor does not exist
     */
    @Transactional
    public LedgerTransaction credit(UUID actorId, long amount, String reference, TransactionKind kind) {
        if (!kind.isCredit()) {
            throw new IllegalArgumentException("Kind " + kind + " cannot be used for a credit");
        }
        return post(actorId, amount, reference, kind);
    }

    private LedgerTransaction post(UUID actorId, long amount, String reference, TransactionKind kind) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Reference is required");
        }

        long balance = lockBalance(actorId);

        Optional<LedgerTransaction> existing = findByReference(reference, kind);
        if (existing.isPresent()) {
            LedgerTransaction original = existing.get();
            if (!original.getActorId().equals(actorId)) {
                throw new IllegalStateException(String.format(
                    "Reference %s/%s already posted for another actor %s", reference, kind, original.getActorId()));
            }
            log.debug("Ledger reference already posted, returning original: reference={}, kind={}, txId={}",
                    reference, kind, original.getId());
            metrics.recordLedgerTransaction(kind.name(), "duplicate");
            return original;
        }

        long signedAmount = kind.isDebit() ? -amount : amount;
        if (balance + signedAmount < 0) {
            metrics.recordLedgerTransaction(kind.name(), "insufficient_funds");
            throw new InsufficientFundsException(actorId, amount, balance);
        }

        Instant now = clock.instant();
        int updated = jdbcTemplate.update(
            "UPDATE users SET balance = balance + ?, updated_at = ? WHERE id = ? AND balance + ? >= 0",
            signedAmount, Timestamp.from(now), actorId, signedAmount
        );
        if (updated != 1) {
            // row is locked by us, so only a concurrent writer bypassing the ledger gets here
            throw new IllegalStateException("Balance guard rejected update for actor " + actorId);
        }

        UUID transactionId = UUID.randomUUID();
        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_transactions (id, actor_id, amount, kind, reference, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            transactionId, actorId, signedAmount, kind.name(), reference, Timestamp.from(now)
        );

        metrics.recordLedgerTransaction(kind.name(), "success");
        log.info("Ledger transaction posted: txId={}, actorId={}, amount={}, kind={}, reference={}, balance={}",
                transactionId, actorId, signedAmount, kind, reference, balance + signedAmount);

        return new LedgerTransaction(transactionId, actorId, signedAmount, kind, reference, now, sequenceNumber);
    }

    /**
     * Current cached balance of the actor.
     */
    @Transactional(readOnly = true)
    public long balance(UUID actorId) {
        List<Long> balances = jdbcTemplate.queryForList("SELECT balance FROM users WHERE id = ?", Long.class, actorId);
        if (balances.isEmpty()) {
            throw new NotFoundException("Ledger actor not found: " + actorId);
        }
        return balances.get(0);
    }

    /**
     * All transactions of the actor, oldest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> transactions(UUID actorId) {
        return jdbcTemplate.query(
            "SELECT id, actor_id, amount, kind, reference, created_at, sequence_number " +
            "FROM ledger_transactions WHERE actor_id = ? ORDER BY sequence_number",
            transactionRowMapper(),
            actorId
        );
    }

    public Optional<LedgerTransaction> findByReference(String reference, TransactionKind kind) {
        List<LedgerTransaction> found = jdbcTemplate.query(
            "SELECT id, actor_id, amount, kind, reference, created_at, sequence_number " +
            "FROM ledger_transactions WHERE reference = ? AND kind = ?",
            transactionRowMapper(),
            reference, kind.name()
        );
        return found.stream().findFirst();
    }

    /**
     * Checks that the cached balance equals the sum of the actor's transactions.
     */
    @Transactional(readOnly = true)
    public boolean reconcile(UUID actorId) {
        long cached = balance(actorId);
        Long derived = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions WHERE actor_id = ?",
            Long.class,
            actorId
        );
        boolean consistent = derived != null && derived == cached;
        if (!consistent) {
            log.error("Ledger drift detected: actorId={}, cachedBalance={}, derivedBalance={}",
                    actorId, cached, derived);
        }
        return consistent;
    }

    private long lockBalance(UUID actorId) {
        List<Long> balances = jdbcTemplate.queryForList(
            "SELECT balance FROM users WHERE id = ? FOR UPDATE", Long.class, actorId);
        if (balances.isEmpty()) {
            throw new NotFoundException("Ledger actor not found: " + actorId);
        }
        return balances.get(0);
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getObject("id", UUID.class),
            rs.getObject("actor_id", UUID.class),
            rs.getLong("amount"),
            TransactionKind.valueOf(rs.getString("kind")),
            rs.getString("reference"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
