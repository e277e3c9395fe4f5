package com.fintech.budgetsync.config;

import com.fintech.budgetsync.dto.SyncTarget;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Budget sync configuration, bound from the {@code budget-sync} prefix.
 * <p>
 * {@code application.yml} maps the service's environment variables
 * (ACTUAL_SERVER_URL, ACTUAL_BUDGET_SYNC_IDS, CRON_SCHEDULE, ...) onto these
 * properties.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "budget-sync")
public class BudgetSyncProperties {

    @NotBlank
    private String serverUrl;

    @NotBlank
    @ToString.Exclude
    private String serverPassword;

    /**
     * Sync IDs of the budgets to keep in sync, in processing order.
     */
    @NotEmpty
    private List<String> syncIds = new ArrayList<>();

    /**
     * Encryption passwords matched to {@link #syncIds} by position.
     */
    @ToString.Exclude
    private List<String> encryptionPasswords = new ArrayList<>();

    /**
     * Five-field (minute resolution) or six-field cron expression.
     */
    @NotBlank
    private String cronSchedule = "0 1 * * *";

    @NotBlank
    private String timezone = "Etc/UTC";

    private boolean runOnStart = false;

    @NotBlank
    private String dataDir = "./data";

    @Min(1)
    private int maxAttempts = 2;

    @Valid
    private Scheduler scheduler = new Scheduler();

    public Path dataDirectory() {
        return Path.of(dataDir);
    }

    public List<SyncTarget> toSyncTargets() {
        return SyncTarget.fromPositionalLists(syncIds, encryptionPasswords);
    }

    @Data
    public static class Scheduler {

        private boolean enabled = true;

        /**
         * How long shutdown waits for a running cycle to finish.
         */
        @Min(0)
        private int shutdownAwaitSeconds = 60;
    }
}
