package com.agentmanager.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * {@link WorktreeProvisioner} that shells out to the {@code git} CLI.
 *
 * <p>Layout under the workspace root:
 * <pre>
 *   repos/&lt;owner&gt;/&lt;repo&gt;.git   bare mirror, fetched before every new worktree
 *   worktrees/&lt;sessionId&gt;          one worktree per session
 * </pre>
 * The mirror keeps remote branches under {@code refs/remotes/origin/*} so that fetching never
 * collides with branches checked out by live worktrees.
 */
public class GitWorktreeProvisioner implements WorktreeProvisioner {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeProvisioner.class);

    private static final String ORIGIN_FETCH_REFSPEC = "+refs/heads/*:refs/remotes/origin/*";

    private final Path reposRoot;
    private final Path worktreesRoot;
    private final String gitBaseUrl;
    private final ProcessRunner processRunner;

    public GitWorktreeProvisioner(Path workspaceRoot, String gitBaseUrl, ProcessRunner processRunner) {
        this.reposRoot = workspaceRoot.resolve("repos");
        this.worktreesRoot = workspaceRoot.resolve("worktrees");
        this.gitBaseUrl = gitBaseUrl.endsWith("/") ? gitBaseUrl.substring(0, gitBaseUrl.length() - 1) : gitBaseUrl;
        this.processRunner = processRunner;
    }

    @Override
    public WorktreeInfo createWorktree(String owner, String repo, String sessionId, String baseBranch,
                                       String branchName) {
        Path mirror = ensureMirror(owner, repo);
        Path worktree = worktreePath(sessionId);
        createDirectories(worktreesRoot);

        log.info("Adding worktree for session {} at {} (branch: {} from {})", sessionId, worktree, branchName, baseBranch);

        var result = git(mirror, "worktree", "add", "-b", branchName, worktree.toString(), "origin/" + baseBranch);
        if (!result.succeeded()) {
            // Mirror cloned before the refspec was set only has refs/heads
            log.debug("origin/{} not usable, retrying from local {}", baseBranch, baseBranch);
            result = git(mirror, "worktree", "add", "-b", branchName, worktree.toString(), baseBranch);
        }
        if (!result.succeeded()) {
            // Branch may already exist from an earlier session
            log.debug("Branch {} may already exist, trying to check it out", branchName);
            result = git(mirror, "worktree", "add", worktree.toString(), branchName);
        }
        if (!result.succeeded()) {
            throw new IllegalStateException("Failed to create worktree for session %s (exit code %d): %s"
                    .formatted(sessionId, result.exitCode(), ProcessRunner.maskSensitiveData(result.output())));
        }

        git(worktree, "config", "user.name", "Agent Manager");
        git(worktree, "config", "user.email", "agent-manager@localhost");

        log.info("Worktree created for session {} at {}", sessionId, worktree);
        return new WorktreeInfo(worktree, branchName, mirror);
    }

    @Override
    public void destroyWorktree(String sessionId) {
        Path worktree = worktreePath(sessionId);
        if (!Files.exists(worktree)) {
            log.debug("No worktree for session {}", sessionId);
            return;
        }
        log.info("Removing worktree for session {} at {}", sessionId, worktree);

        Path mirror = findMirror(worktree);
        if (mirror != null && git(mirror, "worktree", "remove", "--force", worktree.toString()).succeeded()) {
            return;
        }
        log.warn("git worktree remove failed for session {}, attempting manual cleanup", sessionId);
        deleteDirectory(worktree);
        if (mirror != null) {
            git(mirror, "worktree", "prune");
        }
    }

    Path worktreePath(String sessionId) {
        return worktreesRoot.resolve(sessionId);
    }

    Path mirrorPath(String owner, String repo) {
        return reposRoot.resolve(owner).resolve(repo + ".git");
    }

    String remoteUrl(String owner, String repo) {
        return gitBaseUrl + "/" + owner + "/" + repo + ".git";
    }

    private Path ensureMirror(String owner, String repo) {
        Path mirror = mirrorPath(owner, repo);
        if (!Files.exists(mirror)) {
            createDirectories(mirror.getParent());
            log.info("Cloning bare mirror of {}/{} into {}", owner, repo, mirror);
            var clone = git(mirror.getParent(), "clone", "--bare", remoteUrl(owner, repo), mirror.toString());
            if (!clone.succeeded()) {
                throw new IllegalStateException("Failed to clone %s/%s (exit code %d): %s"
                        .formatted(owner, repo, clone.exitCode(), ProcessRunner.maskSensitiveData(clone.output())));
            }
            git(mirror, "config", "remote.origin.fetch", ORIGIN_FETCH_REFSPEC);
        }
        var fetch = git(mirror, "fetch", "origin", "--prune");
        if (!fetch.succeeded()) {
            log.warn("Fetch of {}/{} failed (exit code {}), using existing refs", owner, repo, fetch.exitCode());
        }
        return mirror;
    }

    /**
     * A linked worktree's {@code .git} is a file: {@code gitdir: <mirror>/worktrees/<name>}.
     */
    private static Path findMirror(Path worktree) {
        Path gitFile = worktree.resolve(".git");
        if (!Files.isRegularFile(gitFile)) {
            return null;
        }
        try {
            String content = Files.readString(gitFile).trim();
            if (!content.startsWith("gitdir:")) {
                return null;
            }
            Path gitDir = Path.of(content.substring("gitdir:".length()).trim());
            return gitDir.getParent() != null ? gitDir.getParent().getParent() : null;
        } catch (IOException e) {
            log.debug("Could not read {}: {}", gitFile, e.getMessage());
            return null;
        }
    }

    private ProcessRunner.Result git(Path workDir, String... args) {
        String[] command = new String[args.length + 1];
        command[0] = "git";
        System.arraycopy(args, 0, command, 1, args.length);
        return processRunner.run(workDir, command);
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + dir, e);
        }
    }

    private static void deleteDirectory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", dir, e.getMessage());
        }
    }
}
