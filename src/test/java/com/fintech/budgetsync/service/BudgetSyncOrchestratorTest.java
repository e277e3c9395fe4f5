package com.fintech.budgetsync.service;

import com.fintech.budgetsync.config.BudgetSyncProperties;
import com.fintech.budgetsync.dto.CycleReport;
import com.fintech.budgetsync.dto.LedgerAccount;
import com.fintech.budgetsync.exception.CycleAlreadyRunningException;
import com.fintech.budgetsync.exception.DataDirectoryException;
import com.fintech.budgetsync.exception.SyncCycleException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.FileSystemUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BudgetSyncOrchestrator.
 *
 * Tests cover:
 * - Per-budget isolation and retry with session reset
 * - Download vs. cached load, with and without encryption passwords
 * - Session lifecycle counts for a full cycle
 * - Concurrent cycle guard
 */
@ExtendWith(MockitoExtension.class)
class BudgetSyncOrchestratorTest {

    private static final String SERVER_URL = "http://ledger.local:5006";

    @Mock
    private LedgerClient ledgerClient;

    @Mock
    private BudgetCacheIndex cacheIndex;

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry meterRegistry;
    private SessionManager sessionManager;
    private BalanceReconciler balanceReconciler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sessionManager = new SessionManager(ledgerClient);
        balanceReconciler = new BalanceReconciler(meterRegistry);
        balanceReconciler.initMetrics();
    }

    @Nested
    @DisplayName("Retry and Isolation Tests")
    class RetryTests {

        @Test
        @DisplayName("Should still sync later budgets when an earlier one always fails")
        void shouldContinueAfterFailingBudget() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1", "b2"), List.of());
            doThrow(new IllegalStateException("network down")).when(ledgerClient).downloadBudget("b1");

            // When / Then
            assertThatThrownBy(orchestrator::runCycle)
                .isInstanceOf(SyncCycleException.class)
                .hasMessageContaining("b1")
                .hasMessageNotContaining("b2");

            verify(ledgerClient, times(2)).downloadBudget("b1");
            verify(ledgerClient).downloadBudget("b2");
            verify(ledgerClient, times(1)).runBankSync();
            verify(ledgerClient, times(1)).sync();
        }

        @Test
        @DisplayName("Should succeed on second attempt with exactly one bank sync")
        void shouldSucceedOnSecondAttempt() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            doThrow(new IllegalStateException("timeout"))
                .doNothing()
                .when(ledgerClient).downloadBudget("b1");

            // When
            CycleReport report = orchestrator.runCycle();

            // Then
            verify(ledgerClient, times(2)).downloadBudget("b1");
            verify(ledgerClient, times(1)).runBankSync();
            assertThat(report.getFailedSyncIds()).isEmpty();
            assertThat(report.getSucceededTargets()).isEqualTo(1);
            assertThat(report.getTotalAttempts()).isEqualTo(2);
            assertThat(meterRegistry.counter("budget.sync.retries").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should report a budget failing both attempts once and reset the session once")
        void shouldReportExhaustedBudgetOnce() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            doThrow(new IllegalStateException("corrupt budget")).when(ledgerClient).downloadBudget("b1");

            // When
            SyncCycleException thrown = catchSyncCycleException(orchestrator);

            // Then
            assertThat(thrown.getFailedSyncIds()).containsExactly("b1");
            // initial open + one reset
            verify(ledgerClient, times(2)).init(any(), anyString(), anyString());
            verify(ledgerClient, times(2)).shutdown();
            verify(cacheIndex, times(1)).invalidate(tempDir, "b1");
            assertThat(meterRegistry.counter("budget.sync.budgets.failure").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reset session and evict cache before the retry, not before the first attempt")
        void shouldResetBeforeRetryOnly() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            doThrow(new IllegalStateException("boom"))
                .doNothing()
                .when(ledgerClient).downloadBudget("b1");

            // When
            orchestrator.runCycle();

            // Then
            InOrder inOrder = inOrder(ledgerClient, cacheIndex);
            inOrder.verify(ledgerClient).init(tempDir, SERVER_URL, "server-secret");
            inOrder.verify(ledgerClient).downloadBudget("b1");
            inOrder.verify(ledgerClient).shutdown();
            inOrder.verify(ledgerClient).init(tempDir, SERVER_URL, "server-secret");
            inOrder.verify(cacheIndex).invalidate(tempDir, "b1");
            inOrder.verify(ledgerClient).downloadBudget("b1");
            inOrder.verify(ledgerClient).runBankSync();
            inOrder.verify(ledgerClient).sync();
            inOrder.verify(ledgerClient).shutdown();
        }
    }

    @Nested
    @DisplayName("End-to-End Cycle Tests")
    class EndToEndTests {

        @Test
        @DisplayName("Two budgets, first download rejected once: 3 downloads, 2 bank syncs, 2 pushes")
        void shouldMatchExpectedCallCounts() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1", "b2"), List.of());
            doThrow(new IllegalStateException("rejected"))
                .doNothing()
                .when(ledgerClient).downloadBudget("b1");

            // When
            CycleReport report = orchestrator.runCycle();

            // Then
            verify(ledgerClient, times(3)).downloadBudget(anyString());
            verify(ledgerClient, times(2)).runBankSync();
            verify(ledgerClient, times(2)).sync();
            verify(ledgerClient, times(2)).init(any(), anyString(), anyString());
            verify(ledgerClient, times(2)).shutdown();
            assertThat(report.hasFailures()).isFalse();
            assertThat(report.getSucceededTargets()).isEqualTo(2);
            assertThat(sessionManager.getActiveSession()).isNull();
        }

        @Test
        @DisplayName("Should re-apply every non-null balance before pushing")
        void shouldReconcileBalancesBeforePush() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            when(ledgerClient.getAccounts()).thenReturn(Arrays.asList(
                account("acc-1", 1500L),
                account("acc-2", null)));

            // When
            orchestrator.runCycle();

            // Then
            InOrder inOrder = inOrder(ledgerClient);
            inOrder.verify(ledgerClient).runBankSync();
            inOrder.verify(ledgerClient).updateAccountBalance("acc-1", 1500L);
            inOrder.verify(ledgerClient).sync();
            verify(ledgerClient, times(1)).updateAccountBalance(anyString(), anyLong());
        }

        @Test
        @DisplayName("Should push even when a balance update fails")
        void shouldPushDespiteBalanceFailure() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            when(ledgerClient.getAccounts()).thenReturn(List.of(account("acc-1", 10L)));
            doThrow(new IllegalStateException("locked")).when(ledgerClient).updateAccountBalance("acc-1", 10L);

            // When
            CycleReport report = orchestrator.runCycle();

            // Then
            verify(ledgerClient).sync();
            assertThat(report.hasFailures()).isFalse();
        }
    }

    @Nested
    @DisplayName("Budget Loading Tests")
    class LoadingTests {

        @Test
        @DisplayName("Should pass the encryption password only for encrypted budgets")
        void shouldUsePasswordOverloadWhenConfigured() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1", "b2"), List.of("", "pw-2"));

            // When
            orchestrator.runCycle();

            // Then
            verify(ledgerClient).downloadBudget("b1");
            verify(ledgerClient, never()).downloadBudget(eq("b1"), anyString());
            verify(ledgerClient).downloadBudget("b2", "pw-2");
            verify(ledgerClient, never()).downloadBudget("b2");
        }

        @Test
        @DisplayName("Should load a cached budget instead of downloading it")
        void shouldLoadCachedBudget() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            when(cacheIndex.findLocalBudgetId(tempDir, "b1")).thenReturn(Optional.of("My-Budget-1a2b"));

            // When
            orchestrator.runCycle();

            // Then
            verify(ledgerClient).loadBudget("My-Budget-1a2b");
            verify(ledgerClient, never()).downloadBudget(anyString());
            verify(ledgerClient).runBankSync();
        }
    }

    @Nested
    @DisplayName("Session Failure Tests")
    class SessionFailureTests {

        @Test
        @DisplayName("Should retry per budget when the initial connection fails")
        void shouldRecoverFromInitialConnectionFailure() {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            doThrow(new IllegalStateException("connection refused"))
                .doNothing()
                .when(ledgerClient).init(any(), anyString(), anyString());

            // When
            CycleReport report = orchestrator.runCycle();

            // Then
            verify(ledgerClient, times(2)).init(any(), anyString(), anyString());
            verify(ledgerClient).downloadBudget("b1");
            assertThat(report.hasFailures()).isFalse();
        }

        @Test
        @DisplayName("Should fail the cycle without contacting the server when the data directory is unusable")
        void shouldFailOnUnusableDataDirectory() throws Exception {
            // Given
            Path notADirectory = Files.createFile(tempDir.resolve("data"));
            BudgetSyncOrchestrator orchestrator = orchestrator(notADirectory, List.of("b1"), List.of());

            // When / Then
            assertThatThrownBy(orchestrator::runCycle)
                .isInstanceOf(DataDirectoryException.class);
            verify(ledgerClient, never()).init(any(), anyString(), anyString());
            assertThat(orchestrator.isCycleRunning()).isFalse();
        }

        @Test
        @DisplayName("Should stop the cycle when the data directory becomes unusable before a retry")
        void shouldAbortCycleWhenDataDirectoryLostMidCycle() throws Exception {
            // Given
            Path dataDir = Files.createDirectories(tempDir.resolve("data"));
            BudgetSyncOrchestrator orchestrator = orchestrator(dataDir, List.of("b1", "b2"), List.of());
            doAnswer(invocation -> {
                FileSystemUtils.deleteRecursively(dataDir);
                Files.createFile(dataDir);
                throw new IllegalStateException("disk gone");
            }).when(ledgerClient).downloadBudget("b1");

            // When / Then
            assertThatThrownBy(orchestrator::runCycle)
                .isInstanceOf(DataDirectoryException.class);
            verify(ledgerClient, times(1)).downloadBudget("b1");
            verify(ledgerClient, never()).downloadBudget("b2");
            verify(ledgerClient, times(1)).init(any(), anyString(), anyString());
            assertThat(sessionManager.getActiveSession()).isNull();
            assertThat(orchestrator.isCycleRunning()).isFalse();
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should reject a cycle while another is running")
        void shouldRejectConcurrentCycle() throws Exception {
            // Given
            BudgetSyncOrchestrator orchestrator = orchestrator(List.of("b1"), List.of());
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            doAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return null;
            }).when(ledgerClient).init(any(), anyString(), anyString());

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<CycleReport> first = executor.submit(orchestrator::runCycle);
                assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

                // When / Then
                assertThat(orchestrator.isCycleRunning()).isTrue();
                assertThatThrownBy(orchestrator::runCycle)
                    .isInstanceOf(CycleAlreadyRunningException.class);

                release.countDown();
                assertThat(first.get(5, TimeUnit.SECONDS).hasFailures()).isFalse();
                assertThat(orchestrator.isCycleRunning()).isFalse();
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
        }
    }

    // Helper methods

    private BudgetSyncOrchestrator orchestrator(List<String> syncIds, List<String> passwords) {
        return orchestrator(tempDir, syncIds, passwords);
    }

    private BudgetSyncOrchestrator orchestrator(Path dataDir, List<String> syncIds, List<String> passwords) {
        BudgetSyncProperties properties = new BudgetSyncProperties();
        properties.setServerUrl(SERVER_URL);
        properties.setServerPassword("server-secret");
        properties.setSyncIds(syncIds);
        properties.setEncryptionPasswords(passwords);
        properties.setDataDir(dataDir.toString());
        properties.setMaxAttempts(2);

        BudgetSyncOrchestrator orchestrator = new BudgetSyncOrchestrator(
            sessionManager, cacheIndex, balanceReconciler, properties, meterRegistry);
        orchestrator.initMetrics();
        return orchestrator;
    }

    private static SyncCycleException catchSyncCycleException(BudgetSyncOrchestrator orchestrator) {
        try {
            orchestrator.runCycle();
        } catch (SyncCycleException e) {
            return e;
        }
        throw new AssertionError("Expected SyncCycleException");
    }

    private static LedgerAccount account(String id, Long balance) {
        return LedgerAccount.builder()
            .id(id)
            .name("Account " + id)
            .balanceCurrent(balance)
            .build();
    }
}
