package com.agentmanager.gateway;

import java.util.Locale;
import java.util.Optional;

/**
 * What a {@code subscribe} frame asks for. Each target has a subscription id, which is what an
 * {@code unsubscribe} command names.
 */
public enum SubscribeTarget {
    /** Replay and live events of one session: {@code session:<id>}. */
    SESSION,
    /** Every repo with its session stats: {@code repo_list}. */
    REPO_LIST,
    /** One repo's sessions: {@code repo:<id>}. */
    REPO;

    public static final String REPO_LIST_SUBSCRIPTION = "repo_list";

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SubscribeTarget> fromWire(String value) {
        for (SubscribeTarget target : values()) {
            if (target.wireName().equals(value)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    public static String sessionSubscription(String sessionId) {
        return "session:" + sessionId;
    }

    public static String repoSubscription(String repoId) {
        return "repo:" + repoId;
    }
}
