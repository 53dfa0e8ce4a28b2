package io.github.hongjungwan.actionlog.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Position of an action inside its task's action tree.
 *
 * A level is an ordered sequence of positive integers rendered as a path:
 * the root is {@code "/"}, its second child is {@code "/2/"}, and that child's
 * first child is {@code "/2/1/"}.
 */
public final class TaskLevel {

    private static final TaskLevel ROOT = new TaskLevel(new int[0]);

    private final int[] segments;

    private TaskLevel(int[] segments) {
        this.segments = segments;
    }

    /** 루트 레벨 ("/") */
    public static TaskLevel root() {
        return ROOT;
    }

    /**
     * Parse a rendered path such as {@code "/3/2/"}.
     *
     * @throws IllegalArgumentException if the path is not a valid level
     */
    public static TaskLevel parse(String path) {
        if (path == null || !path.startsWith("/") || !path.endsWith("/")) {
            throw new IllegalArgumentException("Invalid task level: " + path);
        }
        if (path.equals("/")) {
            return ROOT;
        }

        String[] parts = path.substring(1, path.length() - 1).split("/", -1);
        int[] parsed = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                parsed[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid task level: " + path, e);
            }
            if (parsed[i] < 1) {
                throw new IllegalArgumentException("Invalid task level: " + path);
            }
        }
        return new TaskLevel(parsed);
    }

    /**
     * Level of the {@code index}-th child (1-based) of this level.
     */
    public TaskLevel child(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Child index must be positive: " + index);
        }
        int[] childSegments = Arrays.copyOf(segments, segments.length + 1);
        childSegments[segments.length] = index;
        return new TaskLevel(childSegments);
    }

    /** 부모 레벨. 루트는 부모가 없음. */
    public Optional<TaskLevel> parent() {
        if (isRoot()) {
            return Optional.empty();
        }
        if (segments.length == 1) {
            return Optional.of(ROOT);
        }
        return Optional.of(new TaskLevel(Arrays.copyOf(segments, segments.length - 1)));
    }

    public boolean isRoot() {
        return segments.length == 0;
    }

    public int depth() {
        return segments.length;
    }

    public List<Integer> segments() {
        List<Integer> result = new ArrayList<>(segments.length);
        for (int segment : segments) {
            result.add(segment);
        }
        return Collections.unmodifiableList(result);
    }

    public String toPath() {
        StringBuilder sb = new StringBuilder("/");
        for (int segment : segments) {
            sb.append(segment).append('/');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskLevel)) return false;
        return Arrays.equals(segments, ((TaskLevel) o).segments);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(segments);
    }

    @Override
    public String toString() {
        return toPath();
    }
}
