package com.lsemantica.core.pipeline;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Workspace-relative path handling. Globs support {@code *} (one segment) and {@code **}
 * (any depth); a {@code dir/**} pattern also matches {@code dir} itself.
 */
public final class PathGlobs {

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();
    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:/.*");

    private PathGlobs() {}

    public static boolean matches(String pattern, String path) {
        if (pattern.endsWith("/**") && path.equals(pattern.substring(0, pattern.length() - 3))) {
            return true;
        }
        return CACHE.computeIfAbsent(pattern, PathGlobs::compile).matcher(path).matches();
    }

    /** Paths matched by at least one pattern, sorted and deduplicated. */
    public static List<String> matching(Collection<String> paths, Collection<String> patterns) {
        TreeSet<String> matched = new TreeSet<>();
        for (String path : paths) {
            if (patterns.stream().anyMatch(pattern -> matches(pattern, path))) {
                matched.add(path);
            }
        }
        return List.copyOf(matched);
    }

    /**
     * Ignore-filter semantics used by the workspace walk: {@code dir/**} excludes the
     * directory and everything below it, any other pattern is an exact path.
     */
    public static boolean isIgnored(String relativePath, Collection<String> ignoredPaths) {
        for (String pattern : ignoredPaths) {
            if (pattern.endsWith("/**")) {
                String prefix = pattern.substring(0, pattern.length() - 3);
                if (relativePath.equals(prefix) || relativePath.startsWith(prefix + "/")) {
                    return true;
                }
            } else if (relativePath.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isOutsideWorkspace(String path) {
        return path.startsWith("/") || DRIVE_LETTER.matcher(path).matches()
                || path.equals("..") || path.startsWith("../");
    }

    /**
     * Converts backslashes, resolves {@code .} and {@code ..} segments lexically and strips a
     * leading {@code ./}. Returns {@code "."} for an empty result.
     */
    public static String normalize(String raw) {
        String path = raw.replace('\\', '/');
        boolean absolute = path.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }
        String joined = String.join("/", segments);
        if (absolute) {
            return "/" + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }

    /**
     * Trims, deduplicates, sorts and converts backslashes in a pattern list. A blank entry is
     * rejected through {@code error}.
     */
    public static <E extends RuntimeException> List<String> normalizePatterns(Collection<String> patterns,
                                                                             Function<String, E> error,
                                                                             String blankMessage) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw error.apply(blankMessage);
            }
            normalized.add(pattern.trim().replace('\\', '/'));
        }
        return List.copyOf(normalized);
    }

    private static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if ("\\^$.|?+()[]{}".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }
}
