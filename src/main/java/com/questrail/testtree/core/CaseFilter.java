package com.questrail.testtree.core;

import com.questrail.testtree.model.TestPath;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Predicate over case paths used by {@link Scheduler#select}.
 *
 * <p>Filters are matched against the full case id. A filter written without the
 * root suite's name also matches, so {@code math/add} selects
 * {@code Calculator/math/add} as well as {@code math/add/...}.</p>
 */
@FunctionalInterface
public interface CaseFilter
{
    boolean matches(TestPath caseId);

    static CaseFilter all()
    {
        return id -> true;
    }

    /** Selects every case at or below {@code prefix}. */
    static CaseFilter prefix(TestPath prefix)
    {
        Objects.requireNonNull(prefix, "prefix");
        return id -> id.startsWith(prefix) || relativeToRoot(id).startsWith(prefix);
    }

    /**
     * Selects cases whose {@code '/'}-joined id matches a glob: {@code **} spans
     * segments, {@code *} and {@code ?} stay within one segment.
     */
    static CaseFilter glob(String glob)
    {
        Pattern p = Pattern.compile(globToRegex(Objects.requireNonNull(glob, "glob")));
        return id -> p.matcher(id.toString()).matches() || p.matcher(relativeToRoot(id).toString()).matches();
    }

    /** A glob when {@code text} contains a wildcard, a path prefix otherwise. */
    static CaseFilter parse(String text)
    {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('*') >= 0 || text.indexOf('?') >= 0) {
            return glob(text);
        }
        return prefix(TestPath.parse(text));
    }

    private static TestPath relativeToRoot(TestPath id)
    {
        return id.depth() <= 1 ? TestPath.root() : TestPath.of(id.segments().subList(1, id.depth()));
    }

    private static String globToRegex(String glob)
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    sb.append(".*");
                    i++;
                } else {
                    sb.append("[^/]*");
                }
            } else if (c == '?') {
                sb.append("[^/]");
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }
}
