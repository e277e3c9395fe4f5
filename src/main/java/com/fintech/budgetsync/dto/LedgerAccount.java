package com.fintech.budgetsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw account row from the loaded budget's local store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerAccount {

    private String id;
    private String name;

    /**
     * Current balance in minor units as last written by bank sync.
     * Null for accounts that are not linked to a bank.
     */
    private Long balanceCurrent;
}
