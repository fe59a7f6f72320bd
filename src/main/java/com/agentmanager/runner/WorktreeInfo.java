package com.agentmanager.runner;

import java.nio.file.Path;

/**
 * A session worktree on the host.
 *
 * @param worktreePath checkout the container mounts as /workspace
 * @param branchName   branch created for the session
 * @param mirrorPath   bare mirror the worktree belongs to
 */
public record WorktreeInfo(Path worktreePath, String branchName, Path mirrorPath) {}
