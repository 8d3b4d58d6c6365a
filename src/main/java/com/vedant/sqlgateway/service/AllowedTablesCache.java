package com.vedant.sqlgateway.service;

import com.vedant.sqlgateway.entity.ExplorerTableMetadata;
import com.vedant.sqlgateway.repository.ExplorerTableMetadataRepository;
import com.vedant.sqlgateway.sql.TableAllowList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-bounded snapshot of the tables generated queries may read.
 *
 * Readers take the current snapshot reference without locking; a refresh builds a new immutable
 * snapshot and swaps the reference. Refreshes themselves are serialized.
 *
 * Failure policy: a failed reload keeps serving the previous snapshot if there is one; with no
 * snapshot at all the allow-list is empty, so nothing is allowed.
 */
@Service
public class AllowedTablesCache {

    private static final Logger log = LoggerFactory.getLogger(AllowedTablesCache.class);

    public static final int DEFAULT_TIER = 3;

    private final ExplorerTableMetadataRepository metadataRepository;
    private final Clock clock;
    private final Duration ttl;

    private final AtomicReference<AllowListSnapshot> snapshot = new AtomicReference<>();
    private final ReentrantLock refreshLock = new ReentrantLock();

    public record AllowedTable(String schema, String table, int tier) {}

    public record AllowListSnapshot(List<AllowedTable> tables, Set<String> keys, Instant capturedAt) {}

    public AllowedTablesCache(
            ExplorerTableMetadataRepository metadataRepository,
            Clock clock,
            @Value("${explorer.allowlist.ttl:5m}") Duration ttl
    ) {
        this.metadataRepository = metadataRepository;
        this.clock = clock;
        this.ttl = ttl;
    }

    public Set<String> getAllowedTables() {
        return getAllowedTables(false);
    }

    public Set<String> getAllowedTables(boolean forceRefresh) {
        AllowListSnapshot current = currentSnapshot(forceRefresh);
        return current == null ? Set.of() : current.keys();
    }

    /** Keys of allowed tables whose tier is at or below {@code maxTier}. */
    public Set<String> getAllowedTablesForTier(int maxTier) {
        AllowListSnapshot current = currentSnapshot(false);
        if (current == null) return Set.of();

        Set<String> keys = new LinkedHashSet<>();
        for (AllowedTable t : current.tables()) {
            if (t.tier() <= maxTier) {
                keys.addAll(TableAllowList.keysFor(t.schema(), t.table()));
            }
        }
        return Collections.unmodifiableSet(keys);
    }

    public void invalidate() {
        snapshot.set(null);
        log.info("Allow-list cache invalidated; next lookup reloads from the registry");
    }

    public Optional<AllowListSnapshot> snapshotInfo() {
        return Optional.ofNullable(snapshot.get());
    }

    private AllowListSnapshot currentSnapshot(boolean forceRefresh) {
        AllowListSnapshot current = snapshot.get();
        if (!forceRefresh && isFresh(current)) {
            return current;
        }

        refreshLock.lock();
        try {
            AllowListSnapshot latest = snapshot.get();
            // another caller may have refreshed while we waited
            if (!forceRefresh && isFresh(latest)) {
                return latest;
            }
            return reload(latest);
        } finally {
            refreshLock.unlock();
        }
    }

    private boolean isFresh(AllowListSnapshot s) {
        return s != null && clock.instant().isBefore(s.capturedAt().plus(ttl));
    }

    private AllowListSnapshot reload(AllowListSnapshot previous) {
        List<ExplorerTableMetadata> rows;
        try {
            rows = metadataRepository.findByActiveTrue();
        } catch (RuntimeException ex) {
            if (previous != null) {
                Duration age = Duration.between(previous.capturedAt(), clock.instant());
                log.warn("Allow-list refresh failed; serving stale snapshot ({} tables, age {}s)",
                        previous.tables().size(), age.toSeconds(), ex);
                return previous;
            }
            log.error("Allow-list refresh failed and no snapshot exists; no tables are allowed", ex);
            return null;
        }

        List<AllowedTable> tables = new ArrayList<>();
        Set<String> keys = new LinkedHashSet<>();
        for (ExplorerTableMetadata row : Optional.ofNullable(rows).orElse(List.of())) {
            if (row.getTableName() == null || row.getTableName().isBlank()) continue;
            int tier = Optional.ofNullable(row.getTier()).orElse(DEFAULT_TIER);
            tables.add(new AllowedTable(row.getSchemaName(), row.getTableName(), tier));
            keys.addAll(TableAllowList.keysFor(row.getSchemaName(), row.getTableName()));
        }

        AllowListSnapshot fresh = new AllowListSnapshot(
                List.copyOf(tables), Collections.unmodifiableSet(keys), clock.instant());
        snapshot.set(fresh);
        log.info("Allow-list refreshed: {} active tables, {} lookup keys", tables.size(), keys.size());
        return fresh;
    }
}
