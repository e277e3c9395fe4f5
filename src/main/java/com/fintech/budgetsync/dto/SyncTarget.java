package com.fintech.budgetsync.dto;

import lombok.ToString;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One configured remote budget to sync.
 * <p>
 * Built once at configuration-load time from the ordered list of sync IDs and
 * the list of encryption passwords matched to them by position.
 */
@Value
@Slf4j
public class SyncTarget {

    /**
     * Server-assigned identifier used to download the budget.
     */
    String syncId;

    /**
     * Null when the budget is not end-to-end encrypted.
     */
    @ToString.Exclude
    String encryptionPassword;

    /**
     * Position of the sync ID in the configured list.
     */
    int ordinalIndex;

    public Optional<String> getEncryptionPassword() {
        return Optional.ofNullable(encryptionPassword);
    }

    public boolean hasEncryptionPassword() {
        return encryptionPassword != null;
    }

    /**
     * Pairs sync IDs with passwords by list position.
     * <p>
     * An empty or missing password slot means "no password" for that index.
     * Blank sync IDs are skipped but still consume their index, so the
     * passwords behind them stay aligned.
     */
    public static List<SyncTarget> fromPositionalLists(List<String> syncIds, List<String> encryptionPasswords) {
        List<String> ids = syncIds == null ? Collections.emptyList() : syncIds;
        List<String> passwords = encryptionPasswords == null ? Collections.emptyList() : encryptionPasswords;

        if (passwords.size() > ids.size()) {
            log.warn("{} encryption passwords configured for {} sync ids, ignoring the surplus",
                    passwords.size(), ids.size());
        }

        List<SyncTarget> targets = new ArrayList<>();
        for (int index = 0; index < ids.size(); index++) {
            String syncId = ids.get(index);
            if (syncId == null || syncId.isBlank()) {
                log.warn("Skipping blank sync id at position {}", index);
                continue;
            }
            String password = index < passwords.size() ? passwords.get(index) : null;
            if (password != null && password.isEmpty()) {
                password = null;
            }
            targets.add(new SyncTarget(syncId, password, index));
        }
        return Collections.unmodifiableList(targets);
    }
}
