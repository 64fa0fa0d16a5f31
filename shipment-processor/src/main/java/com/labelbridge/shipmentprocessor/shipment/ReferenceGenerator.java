package com.labelbridge.shipmentprocessor.shipment;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues "Bda" references for rows that carry none: {@code {runStamp}-{ordinal}}.
 *
 * <p>The stamp is fixed once per run. A monotonic counter keeps references unique when ordinals
 * repeat or are missing, so uniqueness never depends on the wall clock advancing between rows.
 * Thread-safe; one instance per run.
 */
public class ReferenceGenerator {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    private final String runStamp;
    private final AtomicLong counter = new AtomicLong();
    private final Set<String> issued = ConcurrentHashMap.newKeySet();

    public ReferenceGenerator(LocalDateTime runStart) {
        this.runStamp = STAMP.format(runStart);
    }

    public String runStamp() {
        return runStamp;
    }

    public String next(String ordinal) {
        String base = ordinal == null || ordinal.isBlank()
                ? runStamp + "-n" + counter.incrementAndGet()
                : runStamp + "-" + ordinal.trim();
        if (issued.add(base)) {
            return base;
        }
        String candidate;
        do {
            candidate = base + "-" + counter.incrementAndGet();
        } while (!issued.add(candidate));
        return candidate;
    }
}
