package json.notation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for glob filtering through [Notation#filter(List)].
class NotationFilterTest extends NotationTestBase {

    private static final String FORD = "{brand: 'Ford', model: {name: 'Mustang', year: 1970}}";
    private static final NotationOptions STRICT = NotationOptions.DEFAULTS.withStrict(true);

    private static NotationException.Kind kindOf(Throwable t) {
        return ((NotationException) t).kind();
    }

    @Test
    void testWildcardMinusNestedKey() {
        final var source = map(FORD);
        final var filtered = Notation.create(source).filter(List.of("*", "!model.year")).value();
        assertThat(filtered).isEqualTo(map("{brand: 'Ford', model: {name: 'Mustang'}}"));
        assertThat(source).isEqualTo(map(FORD));
    }

    @Test
    void testSinglePositivePath() {
        assertThat(Notation.create(map(FORD)).filter("model.name").value())
                .isEqualTo(map("{model: {name: 'Mustang'}}"));
        assertThat(Notation.create(map(FORD)).filter("brand", "model.name").value())
                .isEqualTo(map("{brand: 'Ford', model: {name: 'Mustang'}}"));
        assertThat(Notation.create(map(FORD)).filter("missing").value()).isEqualTo(Map.of());
    }

    @Test
    void testEmptySelection() {
        assertThat(Notation.create(map(FORD)).filter().value()).isEqualTo(Map.of());
        assertThat(Notation.create(map(FORD)).filter(List.of()).value()).isEqualTo(Map.of());
        assertThat(Notation.create(map(FORD)).filter("!*").value()).isEqualTo(Map.of());
        assertThat(Notation.create(list("[1, 2]")).filter("!*").value()).isEqualTo(List.of());
        assertThat(Notation.create(list("[1, 2]")).filter().value()).isEqualTo(List.of());
    }

    @Test
    void testSelectAllIsDeepClone() {
        final var source = map(FORD);
        final var filtered = Notation.create(source).filter("*").value();
        assertThat(filtered).isEqualTo(source).isNotSameAs(source);
        assertThat(((Map<?, ?>) filtered).get("model")).isNotSameAs(source.get("model"));
    }

    @Test
    void testPositiveValuesAreCloned() {
        final var source = map(FORD);
        final var notation = Notation.create(source).filter("model");
        notation.set("model.name", "Pinto");
        assertThat(Notation.create(source).get("model.name")).isEqualTo("Mustang");
    }

    @Test
    void testWildcardPositive() {
        final var source = map("{a: {x: 1, y: 2}, b: {x: 3, z: 4}, c: 5}");
        assertThat(Notation.create(source).filter("*.x").value())
                .isEqualTo(map("{a: {x: 1}, b: {x: 3}}"));
        assertThat(source).isEqualTo(map("{a: {x: 1, y: 2}, b: {x: 3, z: 4}, c: 5}"));
    }

    @Test
    void testWildcardNegated() {
        final var source = map("{a: {x: 1, y: 2}, b: {x: 3, z: 4}, c: 5}");
        assertThat(Notation.create(source).filter("*", "!*.x").value())
                .isEqualTo(map("{a: {y: 2}, b: {z: 4}, c: 5}"));
    }

    @Test
    void testWildcardOverListItems() {
        final var source = map("{items: [{id: 1, tmp: 'x'}, {id: 2, tmp: 'y'}, {id: 3}]}");
        assertThat(Notation.create(source).filter("*", "!items[*].tmp").value())
                .isEqualTo(map("{items: [{id: 1}, {id: 2}, {id: 3}]}"));
    }

    @Test
    void testWildcardOverListRoot() {
        final var source = list("[{a: 1, b: 2}, {a: 3, b: 4}]");
        assertThat(Notation.create(source).filter("[*].a").value())
                .isEqualTo(list("[{a: 1}, {a: 3}]"));
    }

    @Test
    void testNegatedWildcardEmptiesContainers() {
        final var source = map("{a: {tags: [1, 2]}, b: {tags: [3]}, c: {tags: []}}");
        assertThat(Notation.create(source).filter("*", "!*.tags[*]").value())
                .isEqualTo(map("{a: {tags: []}, b: {tags: []}, c: {tags: []}}"));
    }

    @Test
    void testNegatedTrailingWildcardKeepsEmptyContainer() {
        assertThat(Notation.create(map(FORD)).filter("*", "!model.*").value())
                .isEqualTo(map("{brand: 'Ford', model: {}}"));
        assertThat(Notation.create(map("{list: [1, 2, 3], x: 1}")).filter("*", "!list[*]").value())
                .isEqualTo(map("{list: [], x: 1}"));
    }

    @Test
    void testKeyMinusItsChildrenKeepsEmptyContainer() {
        final var source = "{car: {model: 'Charger', year: 1970}, id: 1}";
        assertThat(Notation.create(map(source)).filter("car", "!car.*").value())
                .isEqualTo(map("{car: {}}"));
        assertThat(Notation.create(map(source), STRICT).filter("car", "!car.*").value())
                .isEqualTo(map("{car: {}}"));
        assertThat(Notation.create(map(source)).filter("!car.*", "car").value())
                .isEqualTo(map("{car: {}}"));
    }

    @Test
    void testKeyMinusItsItemsKeepsEmptyList() {
        assertThat(Notation.create(map("{a: [1, 2], b: 3}")).filter("a", "!a[*]").value())
                .isEqualTo(map("{a: []}"));
        assertThat(Notation.create(map("{a: [1, 2], b: 3}"), STRICT).filter("a", "!a[*]").value())
                .isEqualTo(map("{a: []}"));
    }

    @Test
    void testNegatedWildcardUsesIndicesOfFilteredList() {
        final var source = map("{a: [{x: 1}, {x: 2, y: 1}, {x: 3}]}");
        assertThat(Notation.create(source).filter("*", "!a[0]", "!a[*].y").value())
                .isEqualTo(map("{a: [{x: 2}, {x: 3}]}"));
        assertThat(Notation.create(source, NotationOptions.DEFAULTS.withPreserveIndices(true))
                .filter("*", "!a[0]", "!a[*].y").value())
                .isEqualTo(map("{a: [null, {x: 2}, {x: 3}]}"));
        assertThat(source).isEqualTo(map("{a: [{x: 1}, {x: 2, y: 1}, {x: 3}]}"));
    }

    @Test
    void testEmptiedListItemStaysInPlace() {
        final var source = map("{lists: [[1, 2], [3]]}");
        assertThat(Notation.create(source).filter("*", "!lists[0][*]").value())
                .isEqualTo(map("{lists: [[], [3]]}"));
        assertThat(Notation.create(map("{lists: [[1, 2], [3]]}"), NotationOptions.DEFAULTS.withPreserveIndices(true))
                .filter("*", "!lists[0][*]").value())
                .isEqualTo(map("{lists: [[], [3]]}"));
    }

    @Test
    void testIntegrityMismatchIgnoredWhenNotStrict() {
        assertThat(Notation.create(map("{list: 'text'}")).filter("*", "!list[*]").value())
                .isEqualTo(map("{list: 'text'}"));
        assertThat(Notation.create(map("{a: 1}")).filter("*", "!missing.*").value())
                .isEqualTo(map("{a: 1}"));
    }

    @Test
    void testIntegrityMismatchFailsWhenStrict() {
        assertThatThrownBy(() -> Notation.create(map("{list: 'text'}"), STRICT).filter("*", "!list[*]"))
                .isInstanceOf(NotationException.class)
                .hasMessageContaining("Integrity failed for glob '!list[*]'")
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(NotationException.Kind.INTEGRITY_ERROR));
        assertThatThrownBy(() -> Notation.create(map("{a: 1}"), STRICT).filter("*", "!missing.*"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(NotationException.Kind.INTEGRITY_ERROR));
        assertThatThrownBy(() -> Notation.create(map("{a: {tags: [1]}, b: {tags: 'x'}}"), STRICT).filter("*", "!*.tags[*]"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(NotationException.Kind.INTEGRITY_ERROR));
    }

    @Test
    void testStrictFilterPassesMatchingKinds() {
        assertThat(Notation.create(map("{a: {tags: [1]}, b: {tags: []}}"), STRICT).filter("*", "!*.tags[*]").value())
                .isEqualTo(map("{a: {tags: []}, b: {tags: []}}"));
    }

    @Test
    void testInvalidGlobFails() {
        assertThatThrownBy(() -> Notation.create(map(FORD)).filter("model..name"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(NotationException.Kind.INVALID_SYNTAX));
    }
}
