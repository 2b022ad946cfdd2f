package com.questrail.testtree.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * TestPath
 * -----------------------------------------------------------------------------
 * Ordered sequence of node names, root first.
 *
 * <p>A path identifies a node by the names of the suites that enclose it plus,
 * for a node's own id, its own name. Paths are value objects: two paths with the
 * same segments are equal regardless of how they were built.</p>
 *
 * <p>The string form joins segments with {@code '/'}. Segment names may not
 * contain {@code '/'} so that the string form stays unambiguous.</p>
 */
public final class TestPath implements Comparable<TestPath>
{
    public static final char SEPARATOR = '/';

    private static final TestPath ROOT = new TestPath(List.of());

    private final List<String> segments;

    private TestPath(List<String> segments)
    {
        this.segments = segments;
    }

    /** The empty path (ancestor path of the root suite). */
    public static TestPath root()
    {
        return ROOT;
    }

    public static TestPath of(String... segments)
    {
        return of(Arrays.asList(segments));
    }

    public static TestPath of(List<String> segments)
    {
        Objects.requireNonNull(segments, "segments");
        List<String> copy = new ArrayList<>(segments.size());
        for (String s : segments) {
            copy.add(validate(s));
        }
        return copy.isEmpty() ? ROOT : new TestPath(Collections.unmodifiableList(copy));
    }

    /**
     * Parses the {@code '/'}-joined string form. Empty segments are ignored, so
     * {@code "a//b/"} and {@code "a/b"} denote the same path.
     */
    public static TestPath parse(String text)
    {
        Objects.requireNonNull(text, "text");
        List<String> parts = new ArrayList<>();
        for (String part : text.split(String.valueOf(SEPARATOR))) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return of(parts);
    }

    public TestPath child(String name)
    {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(validate(name));
        return new TestPath(Collections.unmodifiableList(next));
    }

    /** Path of the enclosing node; the root path is its own parent. */
    public TestPath parent()
    {
        if (segments.isEmpty()) {
            return this;
        }
        return of(segments.subList(0, segments.size() - 1));
    }

    public boolean startsWith(TestPath prefix)
    {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.segments.size() > segments.size()) {
            return false;
        }
        return segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    public List<String> segments()
    {
        return segments;
    }

    public int depth()
    {
        return segments.size();
    }

    public boolean isRoot()
    {
        return segments.isEmpty();
    }

    public String lastSegment()
    {
        if (segments.isEmpty()) {
            throw new IllegalStateException("root path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    /** Segments joined with the given delimiter (the JUnit XML classname uses '.'). */
    public String join(CharSequence delimiter)
    {
        return String.join(delimiter, segments);
    }

    @Override
    public int compareTo(TestPath other)
    {
        int n = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < n; i++) {
            int c = segments.get(i).compareTo(other.segments.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof TestPath)) return false;
        return segments.equals(((TestPath) o).segments);
    }

    @Override
    public int hashCode()
    {
        return segments.hashCode();
    }

    @Override
    public String toString()
    {
        return join(String.valueOf(SEPARATOR));
    }

    private static String validate(String segment)
    {
        Objects.requireNonNull(segment, "segment");
        if (segment.isEmpty()) {
            throw new IllegalArgumentException("path segment must not be empty");
        }
        if (segment.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("path segment must not contain '" + SEPARATOR + "': " + segment);
        }
        return segment;
    }
}
