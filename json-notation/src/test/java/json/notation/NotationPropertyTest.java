package json.notation;

import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based tests for the notation and glob laws.
/// Generates notations, trees and glob lists from small pools so that collisions
/// (shared prefixes, duplicate patterns, nested negations) are frequent.
class NotationPropertyTest extends NotationTestBase {

    private static final int MAX_DEPTH = 3;
    private static final List<String> NOTE_POOL = List.of(
            "a", "car", "$x", "_y1", "['x y']", "[\"q\"]", "['a.b']", "[0]", "[2]", "[007]");
    private static final List<String> KEY_POOL = List.of("a", "b", "car", "first name", "x.y", "0", "$k");
    private static final List<String> GLOB_POOL = List.of(
            "*", "a", "b", "a.b", "a.*", "*.b", "car", "!a", "!a.b", "!*.b", "!b.*", "!car.*", "!*");
    private static final List<String> POSITIVE_GLOB_POOL = List.of(
            "*", "a", "b", "a.b", "a.*", "*.b", "car", "car.a", "['first name']", "*.*.a");

    @Provide
    Arbitrary<String> notations() {
        return Arbitraries.of(NOTE_POOL).list().ofMinSize(1).ofMaxSize(5).map(NotationPath::join);
    }

    @Provide
    Arbitrary<String> keyRootedNotations() {
        return Arbitraries.of(NOTE_POOL).list().ofMaxSize(4).map(notes -> {
            final var all = new ArrayList<String>();
            all.add("root");
            all.addAll(notes);
            return NotationPath.join(all);
        });
    }

    @Provide
    Arbitrary<Map<String, Object>> trees() {
        return mapArbitrary(MAX_DEPTH);
    }

    @Provide
    Arbitrary<List<Object>> listTrees() {
        return listArbitrary(MAX_DEPTH);
    }

    @Provide
    Arbitrary<List<String>> globLists() {
        return Arbitraries.of(GLOB_POOL).list().ofMaxSize(6);
    }

    @Provide
    Arbitrary<List<String>> positiveGlobLists() {
        return Arbitraries.of(POSITIVE_GLOB_POOL).list().ofMinSize(1).ofMaxSize(4);
    }

    @Property(tries = 200)
    void joinOfSplitIsIdentity(@ForAll("notations") String notation) {
        LOG.fine(() -> "notation: " + notation);
        assertThat(NotationPath.isValid(notation)).isTrue();
        assertThat(NotationPath.join(NotationPath.split(notation))).isEqualTo(notation);
    }

    @Property(tries = 200)
    void setThenGetReturnsValue(@ForAll("keyRootedNotations") String notation, @ForAll int value) {
        final var accessor = Notation.create().set(notation, value);
        assertThat(accessor.get(notation)).isEqualTo(value);
        assertThat(accessor.has(notation)).isTrue();
    }

    @Property(tries = 200)
    void expandOfFlattenIsIdentity(@ForAll("trees") Map<String, Object> tree) {
        LOG.fine(() -> "tree: " + tree);
        final var expanded = Notation.create(Trees.cloneDeep(tree)).flatten().expand().value();
        assertThat(expanded).isEqualTo(tree);
    }

    @Property(tries = 100)
    void expandOfFlattenIsIdentityForListRoots(@ForAll("listTrees") List<Object> tree) {
        final var expanded = Notation.create(Trees.cloneDeep(tree)).flatten().expand().value();
        assertThat(expanded).isEqualTo(tree);
    }

    @Property(tries = 200)
    void normalizeIsIdempotentAndOrderIndependent(@ForAll("globLists") List<String> globs, @ForAll long seed) {
        final var normalized = Globs.normalize(globs);
        LOG.fine(() -> "normalize " + globs + " -> " + normalized);
        assertThat(Globs.normalize(normalized)).isEqualTo(normalized);

        final var shuffled = new ArrayList<>(globs);
        Collections.shuffle(shuffled, new Random(seed));
        assertThat(Globs.normalize(shuffled)).isEqualTo(normalized);
    }

    @Property(tries = 100)
    void normalizedSetIsEmptyOrHasPositive(@ForAll("globLists") List<String> globs) {
        final var normalized = Globs.normalize(globs);
        assertThat(normalized.isEmpty() || normalized.stream().anyMatch(g -> !g.startsWith("!"))).isTrue();
        assertThat(normalized).doesNotHaveDuplicates();
    }

    @Property(tries = 100)
    void everyGlobCoversItself(@ForAll("globLists") List<String> globs) {
        for (final var glob : globs) {
            final var parsed = NotationGlob.create(glob);
            assertThat(parsed.covers(parsed)).as("%s covers itself", glob).isTrue();
        }
    }

    @Property(tries = 200)
    void unionIsCommutative(@ForAll("globLists") List<String> a, @ForAll("globLists") List<String> b) {
        final var ab = Globs.normalize(Globs.union(a, b));
        LOG.fine(() -> "union " + a + " + " + b + " -> " + ab);
        assertThat(Globs.normalize(Globs.union(b, a))).isEqualTo(ab);
    }

    @Property(tries = 100)
    void unionWithItselfIsNormalize(@ForAll("globLists") List<String> globs) {
        assertThat(Globs.union(globs, globs)).isEqualTo(Globs.normalize(globs));
    }

    @Property(tries = 200)
    void unionOfPositivesSelectsBothSelections(@ForAll("trees") Map<String, Object> tree,
                                               @ForAll("positiveGlobLists") List<String> a,
                                               @ForAll("positiveGlobLists") List<String> b) {
        final var notation = Notation.create(tree);
        final var expected = new LinkedHashSet<String>();
        expected.addAll(leafNotations(notation.filter(a)));
        expected.addAll(leafNotations(notation.filter(b)));

        final var union = Globs.union(a, b);
        LOG.fine(() -> "union " + a + " + " + b + " -> " + union);
        assertThat(leafNotations(notation.filter(union))).isEqualTo(expected);
    }

    @Property(tries = 200)
    void filterNeverMutatesSource(@ForAll("trees") Map<String, Object> tree, @ForAll("globLists") List<String> globs) {
        final var before = Trees.cloneDeep(tree);
        Notation.create(tree).filter(globs);
        assertThat(tree).isEqualTo(before);
    }

    private static Set<String> leafNotations(Notation filtered) {
        return new LinkedHashSet<>(Notation.create(filtered.value()).getNotations());
    }

    private Arbitrary<Object> valueArbitrary(int depth) {
        final Arbitrary<Object> leaf = Arbitraries.oneOf(
                Arbitraries.integers().between(-5, 100).map(i -> (Object) i),
                Arbitraries.strings().alpha().ofMaxLength(4).map(s -> (Object) s),
                Arbitraries.of(true, false).map(b -> (Object) b)
        ).injectNull(0.1);
        if (depth == 0) {
            return leaf;
        }
        return Arbitraries.oneOf(
                leaf,
                mapArbitrary(depth - 1).map(m -> (Object) m),
                listArbitrary(depth - 1).map(l -> (Object) l));
    }

    private Arbitrary<Map<String, Object>> mapArbitrary(int depth) {
        return Arbitraries.maps(Arbitraries.of(KEY_POOL), valueArbitrary(depth)).ofMaxSize(3);
    }

    private Arbitrary<List<Object>> listArbitrary(int depth) {
        return valueArbitrary(depth).list().ofMaxSize(3);
    }
}
