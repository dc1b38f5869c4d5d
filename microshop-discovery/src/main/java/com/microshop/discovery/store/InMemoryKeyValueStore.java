package com.microshop.discovery.store;

import com.microshop.discovery.RegistryException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 进程内租约键值存储（无外部中间件）
 * 过期租约及其绑定的键在每次操作前清理
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Clock clock;

    private final AtomicLong leaseSequence = new AtomicLong();

    // leaseId -> expiresAt
    private final ConcurrentMap<Long, LeaseEntry> leases = new ConcurrentHashMap<>();

    // key -> entry
    private final ConcurrentMap<String, KeyEntry> entries = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Lease grant(Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new RegistryException("lease ttl must be positive: " + ttl);
        }
        long id = leaseSequence.incrementAndGet();
        leases.put(id, new LeaseEntry(ttl, clock.instant().plus(ttl)));
        log.debug("Lease granted: id={}, ttl={}", id, ttl);
        return new Lease(id, ttl);
    }

    @Override
    public void keepAlive(Lease lease) {
        cleanupExpired();
        LeaseEntry entry = leases.computeIfPresent(lease.id(),
            (id, current) -> new LeaseEntry(current.getTtl(), clock.instant().plus(current.getTtl())));
        if (entry == null) {
            throw new RegistryException("lease not found: " + lease.id());
        }
    }

    @Override
    public void put(String key, String value, Lease lease) {
        cleanupExpired();
        if (!leases.containsKey(lease.id())) {
            throw new RegistryException("requested lease not found: " + lease.id());
        }
        entries.put(key, new KeyEntry(value, lease.id()));
    }

    @Override
    public List<String> getPrefix(String prefix, Duration timeout) {
        cleanupExpired();
        return entries.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix))
            .sorted(Map.Entry.comparingByKey())
            .map(e -> e.getValue().getValue())
            .collect(Collectors.toList());
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    /**
     * 清理过期租约及其绑定的键
     */
    public void cleanupExpired() {
        Instant now = clock.instant();
        leases.entrySet().removeIf(e -> !e.getValue().getExpiresAt().isAfter(now));
        entries.values().removeIf(entry -> !leases.containsKey(entry.getLeaseId()));
    }

    @Override
    public void close() {
        // 进程内状态，无连接需要释放
    }

    @Data
    @AllArgsConstructor
    private static class LeaseEntry {
        private Duration ttl;
        private Instant expiresAt;
    }

    @Data
    @AllArgsConstructor
    private static class KeyEntry {
        private String value;
        private long leaseId;
    }
}
