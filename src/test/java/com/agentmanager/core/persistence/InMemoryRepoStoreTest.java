package com.agentmanager.core.persistence;

import com.agentmanager.core.model.Repo;
import com.agentmanager.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRepoStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final InMemoryRepoStore store = new InMemoryRepoStore(clock);

    @Test
    @DisplayName("registering the same owner/name twice returns the same repo")
    void registerIsIdempotent() {
        Repo first = store.register("acme", "widgets", "main");
        Repo second = store.register("acme", "widgets", "develop");

        assertEquals(first.id(), second.id());
        assertEquals("main", second.defaultBranch());
        assertEquals("acme/widgets", first.fullName());
        assertEquals(1, store.findAll().size());
    }

    @Test
    @DisplayName("touchActivity stamps lastActivityAt")
    void touchActivity() {
        Repo repo = store.register("acme", "widgets", "main");
        assertNull(repo.lastActivityAt());

        clock.advance(Duration.ofMinutes(1));
        store.touchActivity(repo.id());

        assertEquals(clock.instant(), store.findById(repo.id()).orElseThrow().lastActivityAt());
    }
}
