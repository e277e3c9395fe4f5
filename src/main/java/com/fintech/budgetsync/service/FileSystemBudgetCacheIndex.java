package com.fintech.budgetsync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.budgetsync.dto.BudgetMetadata;
import com.fintech.budgetsync.dto.LocalCacheEntry;
import com.fintech.budgetsync.exception.BudgetCacheException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link BudgetCacheIndex} backed by the {@code metadata.json} file the ledger
 * library writes into every cached budget directory.
 * <p>
 * Directories are visited in name order. If two directories carry the same
 * {@code groupId} the first one wins, both for lookups and for invalidation.
 */
@Service
@Slf4j
public class FileSystemBudgetCacheIndex implements BudgetCacheIndex {

    static final String METADATA_FILE = "metadata.json";

    private final ObjectMapper objectMapper;

    // Last scan per data directory
    private final Map<Path, Map<String, String>> snapshots = new ConcurrentHashMap<>();

    public FileSystemBudgetCacheIndex(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, String> resolve(Path dataDir) {
        log.info("Getting sync id to budget id map...");

        Map<String, String> syncIdToBudgetId = new LinkedHashMap<>();
        for (LocalCacheEntry entry : scan(dataDir)) {
            String existing = syncIdToBudgetId.putIfAbsent(entry.getSyncId(), entry.getLocalBudgetId());
            if (existing != null) {
                log.warn("Sync id {} is cached twice ({} and {}), using {}",
                        entry.getSyncId(), existing, entry.getLocalBudgetId(), existing);
            } else {
                log.debug("Found mapping: syncId={} -> budgetId={}", entry.getSyncId(), entry.getLocalBudgetId());
            }
        }

        Map<String, String> snapshot = Collections.unmodifiableMap(syncIdToBudgetId);
        snapshots.put(key(dataDir), snapshot);
        log.info("Sync id to budget id map created: {} entries", snapshot.size());
        return snapshot;
    }

    @Override
    public Optional<String> findLocalBudgetId(Path dataDir, String syncId) {
        Map<String, String> snapshot = snapshots.get(key(dataDir));
        if (snapshot != null && snapshot.containsKey(syncId)) {
            return Optional.of(snapshot.get(syncId));
        }
        return Optional.ofNullable(resolve(dataDir).get(syncId));
    }

    @Override
    public boolean invalidate(Path dataDir, String syncId) {
        forget(dataDir, syncId);

        List<String> directories;
        try {
            directories = listSubDirectories(dataDir);
        } catch (IOException e) {
            log.warn("Unable to list {} while resetting cache for budget {}: {}", dataDir, syncId, e.getMessage());
            return false;
        }

        for (String directory : directories) {
            Optional<BudgetMetadata> metadata = readMetadata(dataDir, directory);
            if (metadata.isEmpty() || !syncId.equals(metadata.get().getGroupId())) {
                log.debug("Leaving {} in place, it does not hold budget {}", directory, syncId);
                continue;
            }

            Path budgetDir = dataDir.resolve(directory);
            try {
                FileSystemUtils.deleteRecursively(budgetDir);
            } catch (IOException e) {
                log.warn("Unable to delete cached budget {} for sync id {}: {}", budgetDir, syncId, e.getMessage());
                return false;
            }
            log.info("Deleted cached budget {} for sync id {}", budgetDir, syncId);
            return true;
        }

        log.warn("No cached budget found for sync id {}, nothing to delete", syncId);
        return false;
    }

    /**
     * Reads every first-level directory's metadata, skipping the ones that
     * cannot be read or parsed.
     */
    List<LocalCacheEntry> scan(Path dataDir) {
        List<String> directories;
        try {
            directories = listSubDirectories(dataDir);
        } catch (IOException e) {
            log.error("Error creating map from sync id to budget id", e);
            throw new BudgetCacheException("Unable to list data directory " + dataDir, e);
        }

        List<LocalCacheEntry> entries = new ArrayList<>();
        for (String directory : directories) {
            readMetadata(dataDir, directory)
                    .map(metadata -> new LocalCacheEntry(directory, metadata.getId(), metadata.getGroupId()))
                    .ifPresent(entries::add);
        }
        return entries;
    }

    private Optional<BudgetMetadata> readMetadata(Path dataDir, String directory) {
        Path metadataPath = dataDir.resolve(directory).resolve(METADATA_FILE);
        BudgetMetadata metadata;
        try {
            metadata = objectMapper.readValue(metadataPath.toFile(), BudgetMetadata.class);
        } catch (IOException e) {
            log.warn("Skipping {}: unable to read {} ({})", directory, metadataPath, e.getMessage());
            return Optional.empty();
        }

        if (metadata == null || isBlank(metadata.getId()) || isBlank(metadata.getGroupId())) {
            log.warn("Skipping {}: {} has no id or groupId", directory, metadataPath);
            return Optional.empty();
        }
        return Optional.of(metadata);
    }

    private static List<String> listSubDirectories(Path dataDir) throws IOException {
        try (Stream<Path> children = Files.list(dataDir)) {
            return children
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private void forget(Path dataDir, String syncId) {
        snapshots.computeIfPresent(key(dataDir), (dir, snapshot) -> {
            Map<String, String> remaining = new LinkedHashMap<>(snapshot);
            remaining.remove(syncId);
            return Collections.unmodifiableMap(remaining);
        });
    }

    private static Path key(Path dataDir) {
        return dataDir.toAbsolutePath().normalize();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
