package com.clinicalguard.snapshot;

import java.util.concurrent.atomic.AtomicReference;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the current {@link SafetySnapshot} and swaps it as a whole on refresh.
 *
 * The first load happens while the application context starts; if it fails the
 * context fails with it. A failed refresh later on keeps the previous snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotRegistry {

    private final SnapshotLoader loader;

    private final AtomicReference<SafetySnapshot> current = new AtomicReference<>();

    @PostConstruct
    public void initialize() {
        SafetySnapshot snapshot = loader.load(1);
        current.set(snapshot);
        log.info("Safety snapshot #{} active", snapshot.getGeneration());
    }

    public SafetySnapshot current() {
        SafetySnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new KnowledgeUnavailableException("No safety snapshot has been loaded");
        }
        return snapshot;
    }

    @Scheduled(fixedDelayString = "${guard.snapshot.refresh-interval-ms:60000}",
               initialDelayString = "${guard.snapshot.refresh-interval-ms:60000}")
    public void scheduledRefresh() {
        refresh();
    }

    /**
     * Reload knowledge and rules. Returns the snapshot that is active afterwards.
     */
    public synchronized SafetySnapshot refresh() {
        SafetySnapshot previous = current.get();
        long generation = previous != null ? previous.getGeneration() + 1 : 1;
        try {
            SafetySnapshot next = loader.load(generation);
            current.set(next);
            log.info("Safety snapshot #{} active", generation);
            return next;
        } catch (RuntimeException e) {
            if (previous == null) {
                throw e;
            }
            log.error("Snapshot refresh failed, keeping snapshot #{}: {}", previous.getGeneration(), e.getMessage(), e);
            return previous;
        }
    }
}
