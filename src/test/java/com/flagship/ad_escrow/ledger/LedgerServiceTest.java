package com.flagship.ad_escrow.ledger;

import com.flagship.ad_escrow.error.InsufficientFundsException;
import com.flagship.ad_escrow.error.NotFoundException;
import com.flagship.ad_escrow.support.IntegrationTestBase;
import com.flagship.ad_escrow.user.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger: overdrafts, replays, concurrent debits and direct mutation.
 */
class LedgerServiceTest extends IntegrationTestBase {

    private UUID actorId;

    @BeforeEach
    void setUp() {
        actorId = newUser(UserRole.ADVERTISER).getId();
    }

    @Test
    @DisplayName("Credits and debits move the cached balance and stay reconciled")
    void creditAndDebit() {
        ledgerService.credit(actorId, 1000, "ref-credit-" + actorId, TransactionKind.TOPUP);
        LedgerTransaction debit = ledgerService.debit(actorId, 400, "ref-debit-" + actorId, TransactionKind.DEBIT_ESCROW);

        assertEquals(-400, debit.getAmount());
        assertEquals(600, ledgerService.balance(actorId));
        assertTrue(ledgerService.reconcile(actorId));

        List<LedgerTransaction> history = ledgerService.transactions(actorId);
        assertEquals(2, history.size());
        assertTrue(history.get(0).getSequenceNumber() < history.get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("Overdraft is rejected and writes nothing")
    void insufficientFunds() {
        topUp(actorId, 100);

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> ledgerService.debit(actorId, 101, "overdraft-" + actorId, TransactionKind.DEBIT_ESCROW));

        assertEquals(101, e.getRequired());
        assertEquals(100, e.getAvailable());
        assertEquals(100, ledgerService.balance(actorId));
        assertEquals(1, ledgerService.transactions(actorId).size());
    }

    @Test
    @DisplayName("Debiting the exact balance leaves zero")
    void exactBalance() {
        topUp(actorId, 250);

        ledgerService.debit(actorId, 250, "exact-" + actorId, TransactionKind.DEBIT_ESCROW);

        assertEquals(0, ledgerService.balance(actorId));
    }

    @Test
    @DisplayName("Replaying a reference returns the original transaction")
    void duplicateReference() {
        String reference = "replay-" + actorId;
        LedgerTransaction first = ledgerService.credit(actorId, 300, reference, TransactionKind.TOPUP);
        LedgerTransaction second = ledgerService.credit(actorId, 300, reference, TransactionKind.TOPUP);

        assertEquals(first.getId(), second.getId());
        assertEquals(300, ledgerService.balance(actorId));
    }

    @Test
    @DisplayName("A reference cannot be reused by another actor")
    void referenceOwnedByOneActor() {
        UUID other = newUser(UserRole.ADVERTISER).getId();
        String reference = "shared-" + actorId;
        ledgerService.credit(actorId, 10, reference, TransactionKind.TOPUP);

        assertThrows(IllegalStateException.class,
                () -> ledgerService.credit(other, 10, reference, TransactionKind.TOPUP));
        assertEquals(0, ledgerService.balance(other));
    }

    @Test
    @DisplayName("Kind must match the direction and amounts must be positive")
    void argumentValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.credit(actorId, 10, "x-" + actorId, TransactionKind.DEBIT_ESCROW));
        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.debit(actorId, 10, "y-" + actorId, TransactionKind.REFUND));
        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.credit(actorId, 0, "z-" + actorId, TransactionKind.TOPUP));
        assertThrows(NotFoundException.class,
                () -> ledgerService.credit(UUID.randomUUID(), 10, "w-" + actorId, TransactionKind.TOPUP));
    }

    @Test
    @DisplayName("Concurrent debits never overdraw the balance")
    void concurrentDebits() throws InterruptedException {
        topUp(actorId, 500);
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            String reference = "concurrent-" + actorId + "-" + i;
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.debit(actorId, 100, reference, TransactionKind.DEBIT_ESCROW);
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(5, succeeded.get());
        assertEquals(5, rejected.get());
        assertEquals(0, ledgerService.balance(actorId));
        assertTrue(ledgerService.reconcile(actorId));
    }

    @Test
    @DisplayName("Ledger rows cannot be updated or deleted")
    void appendOnly() {
        LedgerTransaction tx = ledgerService.credit(actorId, 50, "immutable-" + actorId, TransactionKind.TOPUP);

        assertThrows(DataAccessException.class,
                () -> jdbcTemplate.update("UPDATE ledger_transactions SET amount = 5000 WHERE id = ?", tx.getId()));
        assertThrows(DataAccessException.class,
                () -> jdbcTemplate.update("DELETE FROM ledger_transactions WHERE id = ?", tx.getId()));
    }

    @Test
    @DisplayName("Reconcile detects a balance written around the ledger")
    void reconcileDetectsDrift() {
        topUp(actorId, 100);
        jdbcTemplate.update("UPDATE users SET balance = balance + 1 WHERE id = ?", actorId);

        assertFalse(ledgerService.reconcile(actorId));
    }
}
