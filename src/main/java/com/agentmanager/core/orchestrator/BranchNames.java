package com.agentmanager.core.orchestrator;

import com.agentmanager.core.errors.ValidationException;

import java.util.regex.Pattern;

/**
 * Session branch naming: {@code agent/<repo>/<suffix>}, where the suffix defaults to the first
 * eight characters of the session id.
 */
public final class BranchNames {

    private static final String PREFIX = "agent/";
    private static final int DEFAULT_SUFFIX_LENGTH = 8;

    /** Characters git refuses in ref names, plus whitespace. */
    private static final Pattern INVALID_REF_CHARS = Pattern.compile("[\\s~^:?*\\[\\\\]+|\\.\\.|@\\{");

    private BranchNames() {}

    /**
     * @throws ValidationException if the suffix has nothing left once unusable characters are removed
     */
    public static String forSession(String repoName, String branchSuffix, String sessionId) {
        if (branchSuffix == null || branchSuffix.isBlank()) {
            return PREFIX + repoName + "/" + sessionId.substring(0, Math.min(DEFAULT_SUFFIX_LENGTH, sessionId.length()));
        }
        String suffix = sanitize(branchSuffix.trim());
        if (suffix.isEmpty() || suffix.chars().allMatch(c -> c == '-' || c == '/')) {
            throw new ValidationException("Invalid branch suffix '" + branchSuffix + "'");
        }
        return PREFIX + repoName + "/" + suffix;
    }

    static String sanitize(String segment) {
        String cleaned = INVALID_REF_CHARS.matcher(segment).replaceAll("-");
        while (cleaned.endsWith(".") || cleaned.endsWith("/") || cleaned.endsWith(".lock")) {
            cleaned = cleaned.endsWith(".lock")
                    ? cleaned.substring(0, cleaned.length() - ".lock".length())
                    : cleaned.substring(0, cleaned.length() - 1);
        }
        return cleaned;
    }
}
