package json.notation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/// Projects a tree through a list of glob patterns.
///
/// The patterns are normalized first and then applied to a result tree by full note count:
/// positive patterns copy matching members from the source, negated patterns remove them
/// again. The source tree is only read; every copied value is a deep clone.
final class NotationFilter {

    private static final Logger LOG = Logger.getLogger(NotationFilter.class.getName());

    /// Application order: a negated glob always runs after any positive glob covering it,
    /// which is shorter, or of the same length and sorted first.
    static final Comparator<NotationGlob> PIPELINE_ORDER = Comparator
            .comparingInt((NotationGlob g) -> g.notes().size())
            .thenComparing(NotationGlob::isNegated)
            .thenComparing(Globs.ORDER);

    private final Notation source;
    private final boolean strict;

    NotationFilter(Notation source) {
        this.source = source;
        this.strict = source.options().strict();
    }

    /// Runs the pipeline.
    /// @return the new root; the source tree is left as it was
    Object apply(List<String> patterns) {
        final var globs = new ArrayList<>(Globs.normalizeGlobs(patterns.stream().map(NotationGlob::create).toList()));
        globs.sort(PIPELINE_ORDER);
        final var root = source.value();
        if (globs.isEmpty()) {
            LOG.finer(() -> "No patterns left after normalizing " + patterns);
            return Trees.emptyLike(root);
        }
        final boolean firstIsWildcard = globs.get(0).isBareWildcard();
        if (globs.size() == 1 && firstIsWildcard) {
            return Trees.cloneDeep(root);
        }

        final var filtered = Notation.create(
                firstIsWildcard ? Trees.cloneDeep(root) : Trees.emptyLike(root),
                source.options().withStrict(false));
        for (final var glob : firstIsWildcard ? globs.subList(1, globs.size()) : globs) {
            LOG.finer(() -> "Applying glob " + glob);
            if (NotationGlob.wildcardCount(glob.reducedNotes()) == 0) {
                applyConcrete(glob, filtered);
            } else {
                applyWildcard(glob, filtered);
            }
        }
        return filtered.value();
    }

    private void applyConcrete(NotationGlob glob, Notation filtered) {
        final var path = NotationPath.of(glob.reducedNotes());
        if (!glob.isNegated()) {
            final var found = source.inspect(path);
            if (found.has()) {
                filtered.setAt(path, Trees.cloneDeep(found.value()), SetMode.OVERWRITE);
            }
            return;
        }
        if (glob.emptyValue() == null) {
            filtered.removeAt(path);
            return;
        }

        final var existing = filtered.inspect(path);
        if (!existing.has() || existing.type() != glob.emptyValue()) {
            if (strict) {
                throw integrityError(glob, path, existing.type());
            }
            LOG.finer(() -> "Skipping " + glob + ": '" + path + "' is " + existing.type());
            return;
        }
        final var removed = filtered.removeAt(path);
        final var mode = removed.parentIsArray() && !filtered.options().preserveIndices()
                ? SetMode.INSERT
                : SetMode.OVERWRITE;
        filtered.setAt(path, Trees.emptyOf(glob.emptyValue()), mode);
    }

    /// Positive globs walk the source and copy from it. Negated globs walk the result
    /// itself, highest list index first, so removals use the indices of the tree they mutate.
    private void applyWildcard(NotationGlob glob, Notation filtered) {
        final var full = glob.notes();
        final var reduced = glob.reducedNotes();
        final Set<List<Note>> done = new HashSet<>();
        final var walked = glob.isNegated() ? filtered.value() : source.value();

        Trees.walk(walked, List.of(), true, (notes, keyOrIndex, value) -> {
            if (!NotationGlob.covers(reduced, false, notes)) {
                return true;
            }
            if (strict && glob.emptyValue() != null && notes.size() == full.size() - 1
                    && ValueType.of(value) != glob.emptyValue()) {
                throw integrityError(glob, NotationPath.of(notes), ValueType.of(value));
            }
            for (int length = 1; length <= notes.size(); length++) {
                final var prefix = notes.subList(0, length);
                if (!NotationGlob.covers(full, glob.isNegated(), prefix)) {
                    continue;
                }
                if (done.add(List.copyOf(prefix))) {
                    final var path = NotationPath.of(prefix);
                    if (glob.isNegated()) {
                        filtered.removeAt(path);
                    } else {
                        filtered.setAt(path, Trees.cloneDeep(source.inspect(path).value()), SetMode.OVERWRITE);
                    }
                }
                break;
            }
            return true;
        });
    }

    private static NotationException integrityError(NotationGlob glob, NotationPath path, ValueType actual) {
        return new NotationException(NotationException.Kind.INTEGRITY_ERROR,
                "Integrity failed for glob '" + glob.glob() + "'. Cannot set empty "
                        + glob.emptyValue().name().toLowerCase(Locale.ROOT) + " for '" + path
                        + "' which has a type of '" + actual.name().toLowerCase(Locale.ROOT) + "'.");
    }
}
