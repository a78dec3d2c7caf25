package com.medidesk.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongSupplier;

/**
 * Issues date-embedded business identifiers.
 *
 * <p>Every (prefix, stamp) pair is a bucket with its own counter. Increments on a
 * bucket run under that bucket's monitor, so concurrent callers receive 1, 2, 3...
 * with no repeats and no gaps. A bucket is seeded once, on first use, with the
 * highest sequence already stored for it, so a restart continues where the
 * previous process stopped.
 *
 * <p>Idle buckets are retired after a retention window. A caller that races a
 * retirement simply picks up a fresh, re-seeded bucket.
 */
@Component
@Slf4j
public class IdGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter SECOND = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;
    private final IdSequenceSeed sequenceSeed;
    private final Duration dayRetention;
    private final Duration secondRetention;

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private volatile Instant nextPruneAt;

    public IdGenerator(Clock clock,
                       IdSequenceSeed sequenceSeed,
                       @Value("${medidesk.ids.day-bucket-retention:P2D}") Duration dayRetention,
                       @Value("${medidesk.ids.second-bucket-retention:PT10M}") Duration secondRetention) {
        this.clock = clock;
        this.sequenceSeed = sequenceSeed;
        this.dayRetention = dayRetention;
        this.secondRetention = secondRetention;
        this.nextPruneAt = clock.instant().plus(secondRetention);
    }

    /**
     * Next identifier for one of the known entity kinds.
     */
    public String next(IdKind kind) {
        return issue(kind.prefix(), kind.granularity(), kind.width());
    }

    /**
     * Next generic identifier: {@code prefix + yyyyMMddHHmmss + 3-digit sequence}.
     */
    public String next(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Identifier prefix is required");
        }
        return issue(prefix.trim(), Granularity.SECOND, 3);
    }

    /**
     * Serialized increment of an arbitrary named sequence. {@code seed} supplies the
     * highest value already issued and is consulted once, when the bucket is created.
     */
    public long nextSequence(String bucketKey, LongSupplier seed) {
        return nextSequence(bucketKey, seed, dayRetention);
    }

    private String issue(String prefix, Granularity granularity, int width) {
        LocalDateTime now = LocalDateTime.now(clock);
        String stamp = granularity == Granularity.DAY ? now.format(DAY) : now.format(SECOND);
        Duration retention = granularity == Granularity.DAY ? dayRetention : secondRetention;

        long sequence = nextSequence(prefix + ":" + stamp,
            () -> sequenceSeed.highestIssued(prefix, stamp), retention);
        return prefix + stamp + pad(sequence, width);
    }

    private long nextSequence(String bucketKey, LongSupplier seed, Duration retention) {
        pruneIfDue();
        while (true) {
            Counter counter = counters.computeIfAbsent(bucketKey, key -> new Counter(retention));
            synchronized (counter) {
                if (counter.retired) {
                    continue;
                }
                if (!counter.seeded) {
                    counter.value = seed.getAsLong();
                    counter.seeded = true;
                    log.debug("Seeded id bucket {} at {}", bucketKey, counter.value);
                }
                counter.value++;
                counter.lastUsed = clock.instant();
                return counter.value;
            }
        }
    }

    private void pruneIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(nextPruneAt)) {
            return;
        }
        nextPruneAt = now.plus(secondRetention);
        for (Map.Entry<String, Counter> entry : counters.entrySet()) {
            Counter counter = entry.getValue();
            synchronized (counter) {
                if (counter.lastUsed != null && counter.lastUsed.plus(counter.retention).isBefore(now)) {
                    counter.retired = true;
                    counters.remove(entry.getKey(), counter);
                }
            }
        }
    }

    int bucketCount() {
        return counters.size();
    }

    private static String pad(long sequence, int width) {
        String digits = Long.toString(sequence);
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    private static final class Counter {
        private final Duration retention;
        private long value;
        private boolean seeded;
        private boolean retired;
        private Instant lastUsed;

        private Counter(Duration retention) {
            this.retention = retention;
        }
    }

    enum Granularity {
        DAY,
        SECOND
    }

    /**
     * Identifier layouts for the entities the engine creates.
     */
    public enum IdKind {
        PATIENT("P", Granularity.DAY, 4),
        VISIT("V", Granularity.SECOND, 3),
        ADMISSION("IPD", Granularity.DAY, 4),
        CHARGE("CHG", Granularity.SECOND, 3),
        PAYMENT("PAY", Granularity.SECOND, 3),
        AUDIT_LOG("LOG", Granularity.SECOND, 3),
        OT_PROCEDURE("OT", Granularity.SECOND, 3),
        BED("BED", Granularity.SECOND, 3),
        DOCTOR("DOC", Granularity.SECOND, 3);

        private final String prefix;
        private final Granularity granularity;
        private final int width;

        IdKind(String prefix, Granularity granularity, int width) {
            this.prefix = prefix;
            this.granularity = granularity;
            this.width = width;
        }

        public String prefix() {
            return prefix;
        }

        Granularity granularity() {
            return granularity;
        }

        int width() {
            return width;
        }
    }
}
