package com.fintech.budgetsync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contents of the {@code metadata.json} file the ledger library writes into
 * every cached budget directory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BudgetMetadata {

    /**
     * Local budget identifier, also the directory name.
     */
    private String id;

    /**
     * Sync ID of the budget on the server.
     */
    private String groupId;

    private String budgetName;
}
