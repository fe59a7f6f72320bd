package com.agentmanager.core.persistence;

import com.agentmanager.core.model.Repo;

import java.util.List;
import java.util.Optional;

public interface RepoStore {

    /** Registers {@code owner/name}, returning the existing row if it is already known. */
    Repo register(String owner, String name, String defaultBranch);

    Optional<Repo> findById(String id);

    List<Repo> findAll();

    void touchActivity(String id);
}
