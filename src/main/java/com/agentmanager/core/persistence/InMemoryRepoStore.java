package com.agentmanager.core.persistence;

import com.agentmanager.core.model.Repo;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRepoStore implements RepoStore {

    private final ConcurrentHashMap<String, Repo> repos = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRepoStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Repo register(String owner, String name, String defaultBranch) {
        Optional<Repo> existing = repos.values().stream()
                .filter(r -> r.owner().equals(owner) && r.name().equals(name))
                .findFirst();
        if (existing.isPresent()) {
            return existing.get();
        }
        Instant now = clock.instant();
        Repo repo = new Repo(UUID.randomUUID().toString(), owner, name, defaultBranch, now, now, null);
        repos.put(repo.id(), repo);
        return repo;
    }

    @Override
    public Optional<Repo> findById(String id) {
        return Optional.ofNullable(repos.get(id));
    }

    @Override
    public List<Repo> findAll() {
        return repos.values().stream()
                .sorted(Comparator.comparing(Repo::owner).thenComparing(Repo::name))
                .toList();
    }

    @Override
    public void touchActivity(String id) {
        Instant now = clock.instant();
        repos.computeIfPresent(id, (k, r) ->
                new Repo(r.id(), r.owner(), r.name(), r.defaultBranch(), r.createdAt(), now, now));
    }
}
