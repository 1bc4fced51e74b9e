package json.notation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Algebra over sets of glob patterns: ordering, normalization, intersection and union.
///
/// A pattern set selects what its positive patterns match minus what its negated patterns
/// match, applied in [#compare] order. Normalization removes every pattern that does not
/// change the selection.
///
/// Usage examples:
/// ```java
/// Globs.normalize(List.of("*", "!id", "name", "car.model", "!car.*", "id", "name", "age"));
/// // ["*", "!car.*", "!id"]
/// Globs.intersect("a.*.c", "!a.b"); // "!a.b.c"
/// Globs.union(List.of("a"), List.of("b")); // ["a", "b"]
/// ```
public final class Globs {

    private static final Logger LOG = Logger.getLogger(Globs.class.getName());

    /// Priority order: shallower first, then more wildcards first, then positive before
    /// negated, then by text.
    public static final Comparator<NotationGlob> ORDER = Globs::compare;

    private Globs() {}

    /// Compares two globs by priority.
    /// @return negative when `a` sorts (and applies) before `b`
    public static int compare(NotationGlob a, NotationGlob b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        final int depth = Integer.compare(a.reducedNotes().size(), b.reducedNotes().size());
        if (depth != 0) {
            return depth;
        }
        final int wildcards = Integer.compare(
                NotationGlob.wildcardCount(b.notes()), NotationGlob.wildcardCount(a.notes()));
        if (wildcards != 0) {
            return wildcards;
        }
        if (a.isNegated() != b.isNegated()) {
            return a.isNegated() ? 1 : -1;
        }
        return a.absGlob().compareTo(b.absGlob());
    }

    /// String form of [#compare(NotationGlob, NotationGlob)].
    /// @throws NotationException if either glob is invalid
    public static int compare(String a, String b) {
        return compare(NotationGlob.create(a), NotationGlob.create(b));
    }

    /// Returns the globs, normalized individually, as a new list sorted by [#compare].
    /// @throws NotationException if any glob is invalid
    public static List<String> sort(Collection<String> globs) {
        Objects.requireNonNull(globs, "globs must not be null");
        return parseAll(globs).stream().sorted(ORDER).map(NotationGlob::glob).toList();
    }

    /// Normalizes a pattern set: removes duplicates and redundant patterns, resolves negated
    /// patterns against the positives they apply to, and sorts the result. A set without
    /// positive patterns selects nothing and normalizes to an empty list.
    /// @throws NotationException if any glob is invalid
    public static List<String> normalize(Collection<String> globs) {
        Objects.requireNonNull(globs, "globs must not be null");
        final var normalized = normalizeGlobs(parseAll(globs));
        LOG.fine(() -> "Normalized " + globs + " to " + normalized);
        return normalized.stream().map(NotationGlob::glob).toList();
    }

    static List<NotationGlob> normalizeGlobs(Collection<NotationGlob> globs) {
        var current = dedupe(globs);
        while (true) {
            final var next = reduce(current);
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        if (current.stream().noneMatch(g -> !g.isNegated())) {
            return List.of();
        }
        final var sorted = new ArrayList<>(current);
        sorted.sort(ORDER);
        return List.copyOf(sorted);
    }

    /// One reduction round over a duplicate-free set.
    private static Set<NotationGlob> reduce(Set<NotationGlob> globs) {
        final var positives = globs.stream().filter(g -> !g.isNegated()).toList();
        final var negatives = globs.stream().filter(NotationGlob::isNegated).toList();

        final var keptPositives = new ArrayList<NotationGlob>();
        for (final var p : positives) {
            if (negatives.stream().anyMatch(n -> n.notes().equals(p.notes()))) {
                LOG.finer(() -> "Dropping " + p + ": has an exact negated counterpart");
                continue;
            }
            if (positives.stream().anyMatch(q -> q != p && redundantUnder(p, q))) {
                LOG.finer(() -> "Dropping " + p + ": covered by another positive");
                continue;
            }
            if (negatives.stream().anyMatch(n -> n.covers(p))) {
                LOG.finer(() -> "Dropping " + p + ": covered by a negative");
                continue;
            }
            keptPositives.add(p);
        }

        final var result = new LinkedHashSet<NotationGlob>(keptPositives);
        for (final var n : negatives) {
            if (negatives.stream().anyMatch(m -> m != n && redundantUnder(n, m))) {
                LOG.finer(() -> "Dropping " + n + ": covered by another negative");
                continue;
            }
            if (keptPositives.stream().anyMatch(p -> p.covers(n))) {
                result.add(n);
                continue;
            }
            for (final var p : keptPositives) {
                final var intersection = intersect(n, p);
                if (intersection != null) {
                    LOG.finer(() -> "Narrowing " + n + " to " + intersection);
                    result.add(intersection);
                }
            }
        }
        return dedupe(result);
    }

    /// Whether `glob` is made redundant by `other`. Of two globs covering each other the
    /// one sorting later is the redundant one.
    private static boolean redundantUnder(NotationGlob glob, NotationGlob other) {
        if (!other.covers(glob)) {
            return false;
        }
        return !glob.covers(other) || compare(other, glob) < 0;
    }

    /// Collapses globs with equal notes and polarity, keeping the smallest text.
    private static Set<NotationGlob> dedupe(Collection<NotationGlob> globs) {
        final var unique = new LinkedHashMap<NotationGlob, NotationGlob>();
        for (final var glob : globs) {
            unique.merge(glob, glob, (a, b) -> a.glob().compareTo(b.glob()) <= 0 ? a : b);
        }
        return new LinkedHashSet<>(unique.values());
    }

    /// Returns the glob matching what both globs match, positionally: equal notes stay, a
    /// wildcard yields to the concrete note, and the longer tail is appended. The result is
    /// negated when either input is.
    /// @return the intersection, or null when the globs are disjoint
    /// @throws NotationException if either glob is invalid
    public static String intersect(String a, String b) {
        final var intersection = intersect(NotationGlob.create(a), NotationGlob.create(b));
        return intersection == null ? null : intersection.glob();
    }

    static NotationGlob intersect(NotationGlob a, NotationGlob b) {
        final var notesA = a.notes();
        final var notesB = b.notes();
        final var notes = new ArrayList<Note>(Math.max(notesA.size(), notesB.size()));
        for (int i = 0; i < Math.max(notesA.size(), notesB.size()); i++) {
            if (i >= notesA.size()) {
                notes.add(notesB.get(i));
            } else if (i >= notesB.size()) {
                notes.add(notesA.get(i));
            } else {
                final var note = notesA.get(i).intersect(notesB.get(i));
                if (note == null) {
                    return null;
                }
                notes.add(note);
            }
        }
        final var bang = a.isNegated() || b.isNegated() ? "!" : "";
        return NotationGlob.create(bang + NotationPath.toNotation(notes));
    }

    /// Returns a normalized pattern set selecting what either set selects.
    ///
    /// Positive patterns of both sides are kept. A negated pattern of one side is kept when
    /// the other side has no positive overlapping it, or when a negated pattern of the other
    /// side covers it. When a positive of the other side covers it, it is narrowed to its
    /// intersections with the other side's negated patterns. A negated pattern that only
    /// partially overlaps the other side's positives is kept as is, so the union may select
    /// less than both sets together in that case.
    /// @throws NotationException if any glob is invalid
    public static List<String> union(Collection<String> globsA, Collection<String> globsB) {
        Objects.requireNonNull(globsA, "globsA must not be null");
        Objects.requireNonNull(globsB, "globsB must not be null");
        final var a = normalizeGlobs(parseAll(globsA));
        final var b = normalizeGlobs(parseAll(globsB));

        final var union = new ArrayList<NotationGlob>();
        a.stream().filter(g -> !g.isNegated()).forEach(union::add);
        b.stream().filter(g -> !g.isNegated()).forEach(union::add);
        unionNegatives(a, b, union);
        unionNegatives(b, a, union);

        final var result = normalizeGlobs(union).stream().map(NotationGlob::glob).toList();
        LOG.fine(() -> "Union of " + globsA + " and " + globsB + " is " + result);
        return result;
    }

    private static void unionNegatives(List<NotationGlob> side, List<NotationGlob> other, List<NotationGlob> union) {
        final var otherPositives = other.stream().filter(g -> !g.isNegated()).toList();
        final var otherNegatives = other.stream().filter(NotationGlob::isNegated).toList();
        for (final var n : side) {
            if (!n.isNegated()) {
                continue;
            }
            final boolean disjoint = otherPositives.stream().allMatch(p -> intersect(n, p) == null);
            if (disjoint || otherNegatives.stream().anyMatch(m -> m.covers(n))) {
                union.add(n);
            } else if (otherPositives.stream().anyMatch(p -> p.covers(n))) {
                for (final var m : otherNegatives) {
                    final var intersection = intersect(n, m);
                    if (intersection != null) {
                        union.add(intersection);
                    }
                }
            } else {
                union.add(n);
            }
        }
    }

    private static List<NotationGlob> parseAll(Collection<String> globs) {
        final var parsed = new ArrayList<NotationGlob>(globs.size());
        for (final var glob : globs) {
            parsed.add(NotationGlob.create(glob));
        }
        return parsed;
    }
}
