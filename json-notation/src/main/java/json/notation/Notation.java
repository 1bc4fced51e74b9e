package json.notation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Notation accessor for tree-shaped data made of maps, lists and scalar leaves.
/// Wraps a caller-supplied tree by reference and reads or mutates it in place through
/// notation strings such as `car.colors[0]` or `meta['content-type']`.
///
/// Usage examples:
/// ```java
/// Map<String, Object> car = ...; // {car: {brand: "Dodge", model: "Charger", year: 1970}}
/// Notation notation = Notation.create(car);
/// notation.get("car.model");                                   // "Charger"
/// notation.remove("car.model").set("car.color", "red").value(); // {car: {brand: "Dodge", year: 1970, color: "red"}}
///
/// // projection through glob patterns; the original tree is left untouched
/// Object filtered = Notation.create(car).filter("*", "!car.year").value();
/// ```
///
/// Mutating methods return the same instance so calls can be chained. Instances are not
/// thread-safe; concurrent mutation of one tree must be serialized by the caller.
/// Keys are matched against the map's own entries only, and `null` stands for an
/// "undefined" value: a member holding `null` is present but not defined.
public final class Notation {

    private static final Logger LOG = Logger.getLogger(Notation.class.getName());

    /// Keys that [#merge(Map)] silently skips, so that flat input cannot smuggle in
    /// structural names.
    static final Set<String> RESERVED_KEYS = Set.of("__proto__", "prototype", "constructor");

    /// Callback for [#eachValue(String, ValueVisitor)].
    @FunctionalInterface
    public interface ValueVisitor {
        /// @param levelValue the value at this level, or null when the level does not exist
        /// @return `false` to stop iterating
        boolean visit(Object levelValue, String levelNotation, Note note, int index, List<Note> notes);
    }

    private Object source;
    private boolean isArrayRoot;
    private NotationOptions options;

    private Notation(Object source, NotationOptions options) {
        this.source = source;
        this.isArrayRoot = source instanceof List;
        this.options = options;
    }

    /// Creates an accessor over a new, empty map.
    public static Notation create() {
        return new Notation(new LinkedHashMap<String, Object>(), NotationOptions.DEFAULTS);
    }

    /// Creates an accessor over the given map or list with default options.
    /// @throws NotationException of kind INVALID_SOURCE if source is not a map or a list
    public static Notation create(Object source) {
        return create(source, NotationOptions.DEFAULTS);
    }

    /// Creates an accessor over the given map or list.
    /// @param source the tree to wrap; it is not copied
    /// @param options accessor options
    /// @throws NotationException of kind INVALID_SOURCE if source is not a map or a list
    public static Notation create(Object source, NotationOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (!Trees.isCollection(source)) {
            throw new NotationException(NotationException.Kind.INVALID_SOURCE,
                    "Invalid source. Expected a data object or array.");
        }
        LOG.fine(() -> "Creating notation over " + ValueType.of(source) + " with " + options);
        return new Notation(source, options);
    }

    // ========== options and state ==========

    public NotationOptions options() {
        return options;
    }

    /// Replaces the options.
    public Notation options(NotationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        return this;
    }

    /// Shallow-merges the named options over the current ones.
    /// @see NotationOptions#merge(Map)
    public Notation options(Map<String, Boolean> overrides) {
        this.options = options.merge(overrides);
        return this;
    }

    /// Returns the (possibly replaced) root of the tree.
    public Object value() {
        return source;
    }

    /// Whether the accessor was created over a list.
    public boolean isArrayRoot() {
        return isArrayRoot;
    }

    // ========== inspection ==========

    /// Inspects the given notation: walks the tree note by note and reports whether the
    /// member exists, its value and diagnostics. Never fails on an absent path.
    /// @throws NotationException of kind INVALID_SYNTAX if the notation is invalid
    public InspectResult inspectGet(String notation) {
        return inspect(NotationPath.parse(notation));
    }

    InspectResult inspect(NotationPath path) {
        final var notation = path.toString();
        final var notes = path.notes();
        Object level = source;
        for (int i = 0; i < notes.size(); i++) {
            final var note = notes.get(i);
            final boolean parentIsArray = level instanceof List;
            if (!hasOwn(level, note)) {
                return InspectResult.absent(notation, i + 1, note, parentIsArray);
            }
            level = child(level, note);
            if (i == notes.size() - 1) {
                return InspectResult.present(notation, level, i + 1, note, parentIsArray);
            }
        }
        throw new IllegalStateException("unreachable: empty path " + notation);
    }

    /// Whether the tree has the notated member, even if its value is `null`.
    public boolean has(String notation) {
        return inspectGet(notation).has();
    }

    /// Whether the tree has the notated member with a non-null value.
    public boolean hasDefined(String notation) {
        final var result = inspectGet(notation);
        return result.has() && result.value() != null;
    }

    /// Gets the value at the given notation.
    /// @return the value, or null when absent in non-strict mode
    /// @throws NotationException of kind MISSING_INDEX or MISSING_PROPERTY when absent in strict mode
    public Object get(String notation) {
        final var result = inspectGet(notation);
        if (!result.has() && options.strict()) {
            throw missing(result, notation);
        }
        return result.value();
    }

    /// Gets the value at the given notation, or `defaultValue` when absent (strict mode included).
    public Object get(String notation, Object defaultValue) {
        final var result = inspectGet(notation);
        return result.has() ? result.value() : defaultValue;
    }

    /// Iterates the values along the given notation, root to leaf. Levels past the first
    /// missing member are visited with a null value.
    public Notation eachValue(String notation, ValueVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        final Object[] level = {source};
        NotationPath.eachNote(notation, (levelNotation, note, index, notes) -> {
            level[0] = hasOwn(level[0], note) ? child(level[0], note) : null;
            return visitor.visit(level[0], levelNotation, note, index, notes);
        });
        return this;
    }

    // ========== mutation ==========

    /// Sets the value at the given notation, overwriting any existing value.
    /// @see #set(String, Object, SetMode)
    public Notation set(String notation, Object value) {
        return set(notation, value, SetMode.OVERWRITE);
    }

    /// Sets the value at the given notation; `overwrite = false` keeps an existing value.
    public Notation set(String notation, Object value, boolean overwrite) {
        return set(notation, value, overwrite ? SetMode.OVERWRITE : SetMode.NO_OVERWRITE);
    }

    /// Sets the value at the given notation. Missing intermediate members are created: a list
    /// when the next note is an index, a map otherwise. Setting a list index past the end pads
    /// the list with `null`.
    /// @param notation the target notation
    /// @param value the value to set
    /// @param mode how to treat an existing value
    /// @throws NotationException INVALID_SYNTAX for an empty or invalid notation, TYPE_MISMATCH when a
    ///         key meets a list, an index meets a map or the walk meets a scalar, INSERT_ON_NON_LIST when
    ///         inserting into a map
    public Notation set(String notation, Object value, SetMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        if (notation == null || notation.isBlank()) {
            throw NotationException.invalidSyntax(notation);
        }
        final var path = NotationPath.parse(notation);
        LOG.finer(() -> "Setting " + path + " (" + mode + ")");
        setAt(path, value, mode);
        return this;
    }

    void setAt(NotationPath path, Object value, SetMode mode) {
        final var notes = path.notes();
        Object level = source;
        for (int i = 0; i < notes.size(); i++) {
            final var note = notes.get(i);
            final boolean last = i == notes.size() - 1;
            final Note next = last ? null : notes.get(i + 1);

            if (level instanceof List) {
                if (!(note instanceof Note.Index index)) {
                    throw new NotationException(NotationException.Kind.TYPE_MISMATCH,
                            "Cannot set string key '" + note.text() + "' on array " + describeParent(path, i));
                }
                level = setInList(asList(level), index.index(), value, mode, last, next);
            } else if (level instanceof Map) {
                if (!note.isKey()) {
                    throw new NotationException(NotationException.Kind.TYPE_MISMATCH,
                            "Cannot set index '" + note.text() + "' on object " + describeParent(path, i));
                }
                level = setInMap(asMap(level), (String) note.normalized(), value, mode, last, next);
            } else {
                throw new NotationException(NotationException.Kind.TYPE_MISMATCH,
                        "Cannot set '" + note.text() + "' on non-collection value " + describeParent(path, i));
            }
        }
    }

    private static Object setInList(List<Object> list, int index, Object value, SetMode mode, boolean last, Note next) {
        if (index < list.size()) {
            if (last) {
                switch (mode) {
                    case OVERWRITE -> list.set(index, value);
                    case INSERT -> list.add(index, value);
                    case NO_OVERWRITE -> { }
                }
                return value;
            }
            final var existing = list.get(index);
            if (existing != null) {
                return existing;
            }
            final var created = newContainerFor(next);
            list.set(index, created);
            return created;
        }
        while (list.size() < index) {
            list.add(null);
        }
        final var created = last ? value : newContainerFor(next);
        list.add(created);
        return created;
    }

    private static Object setInMap(Map<String, Object> map, String key, Object value, SetMode mode, boolean last, Note next) {
        if (last && mode == SetMode.INSERT) {
            throw new NotationException(NotationException.Kind.INSERT_ON_NON_LIST,
                    "Cannot set value by inserting at index, on an object");
        }
        if (map.containsKey(key)) {
            if (last) {
                if (mode == SetMode.OVERWRITE) {
                    map.put(key, value);
                }
                return value;
            }
            final var existing = map.get(key);
            if (existing != null) {
                return existing;
            }
        }
        final var created = last ? value : newContainerFor(next);
        map.put(key, created);
        return created;
    }

    /// Inspects the given notation and removes the member if it exists. A list item is
    /// spliced out (shifting later items) unless `preserveIndices` is set, in which case the
    /// slot is set to `null`. Never fails on an absent path.
    /// @throws NotationException of kind INVALID_SYNTAX if the notation is empty or invalid
    public InspectResult inspectRemove(String notation) {
        if (notation == null || notation.isBlank()) {
            throw NotationException.invalidSyntax(notation);
        }
        return removeAt(NotationPath.parse(notation));
    }

    InspectResult removeAt(NotationPath path) {
        final var notation = path.toString();
        final Object parent;
        if (path.size() == 1) {
            parent = source;
        } else {
            final var parentResult = inspect(path.parent());
            parent = parentResult.has() ? parentResult.value() : null;
        }
        final var last = path.last();
        final boolean parentIsArray = parent instanceof List;
        if (!hasOwn(parent, last)) {
            return InspectResult.absent(notation, path.size(), last, parentIsArray);
        }

        final var value = child(parent, last);
        final var result = InspectResult.present(notation, value, path.size(), last, parentIsArray);
        LOG.finer(() -> "Removing " + notation);
        if (parentIsArray) {
            final int index = ((Note.Index) last).index();
            if (options.preserveIndices()) {
                asList(parent).set(index, null);
            } else {
                asList(parent).remove(index);
            }
        } else {
            asMap(parent).remove((String) last.normalized());
        }
        return result;
    }

    /// Removes the member at the given notation.
    /// @throws NotationException of kind MISSING_INDEX or MISSING_PROPERTY when absent in strict mode
    public Notation remove(String notation) {
        final var result = inspectRemove(notation);
        if (!result.has() && options.strict()) {
            throw missing(result, notation);
        }
        return this;
    }

    /// Sets each entry of the given map, overwriting existing values.
    /// @see #merge(Map, boolean)
    public Notation merge(Map<String, ?> notations) {
        return merge(notations, true);
    }

    /// Sets each entry of the given map. Keys may be flat (`name`) or notated (`car.model`).
    /// Keys containing a reserved name (`__proto__`, `prototype`, `constructor`) are skipped.
    /// @throws NotationException of kind INVALID_NOTATIONS_OBJECT if notations is null
    public Notation merge(Map<String, ?> notations, boolean overwrite) {
        if (notations == null) {
            throw new NotationException(NotationException.Kind.INVALID_NOTATIONS_OBJECT,
                    "Invalid notations object. Expected an object.");
        }
        for (final var entry : notations.entrySet()) {
            final var notation = entry.getKey();
            if (isReserved(notation)) {
                LOG.fine(() -> "Skipping reserved notation: " + notation);
                continue;
            }
            set(notation, entry.getValue(), overwrite);
        }
        return this;
    }

    /// Removes every listed notation from the tree and returns a new tree holding the removed
    /// members at the same notations. Absent notations are ignored.
    /// @throws NotationException of kind INVALID_NOTATIONS_OBJECT if notations is null
    public Object separate(Collection<String> notations) {
        if (notations == null) {
            throw new NotationException(NotationException.Kind.INVALID_NOTATIONS_OBJECT,
                    "Invalid notations object. Expected an array.");
        }
        final var separated = new Notation(Trees.emptyLike(source), options);
        for (final var notation : notations) {
            final var result = inspectRemove(notation);
            if (result.has()) {
                separated.set(notation, result.value());
            }
        }
        return separated.source;
    }

    // ========== whole-tree operations ==========

    /// Deep-walks the tree in insertion and index order, visiting every leaf. Scalars and
    /// empty maps or lists are leaves.
    public Notation each(TreeVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        final var root = source;
        Trees.walk(root, List.of(), false,
                (notes, keyOrIndex, value) -> visitor.visit(NotationPath.toNotation(notes), keyOrIndex, value, root));
        return this;
    }

    /// Returns the notations of every leaf, in walk order.
    public List<String> getNotations() {
        final var notations = new ArrayList<String>();
        each((notation, keyOrIndex, value, root) -> notations.add(notation));
        return notations;
    }

    /// Replaces the tree with a deep copy, so that further mutation leaves the original untouched.
    @Override
    public Notation clone() {
        source = Trees.cloneDeep(source);
        return this;
    }

    /// Replaces the tree with a single-level map from leaf notation to leaf value.
    public Notation flatten() {
        final var flat = new LinkedHashMap<String, Object>();
        each((notation, keyOrIndex, value, root) -> {
            flat.put(notation, value);
            return true;
        });
        source = flat;
        return this;
    }

    /// Replaces a flat map of notations with the nested tree it describes; the opposite of
    /// [#flatten()]. The new root is a list when the first notation starts with an index, or
    /// when the map is empty and this accessor was created over a list.
    /// @throws NotationException of kind INVALID_NOTATIONS_OBJECT if the tree is not a map
    public Notation expand() {
        if (!(source instanceof Map)) {
            throw new NotationException(NotationException.Kind.INVALID_NOTATIONS_OBJECT,
                    "Invalid notations object. Expected an object.");
        }
        final Map<String, Object> flat = asMap(source);
        final boolean toArray = flat.isEmpty()
                ? isArrayRoot
                : NotationPath.parse(flat.keySet().iterator().next()).first() instanceof Note.Index;
        final Object root = toArray ? new ArrayList<>() : new LinkedHashMap<String, Object>();
        new Notation(root, options).merge(flat);
        source = root;
        isArrayRoot = toArray;
        return this;
    }

    /// Alias of [#expand()].
    public Notation aggregate() {
        return expand();
    }

    /// Projects the tree through glob patterns and replaces it with the result. The original
    /// tree is never mutated.
    /// @see NotationFilter
    public Notation filter(List<String> globs) {
        Objects.requireNonNull(globs, "globs must not be null");
        LOG.fine(() -> "Filtering with globs: " + globs);
        source = new NotationFilter(this).apply(globs);
        return this;
    }

    /// Varargs form of [#filter(List)].
    public Notation filter(String... globs) {
        return filter(Arrays.asList(globs));
    }

    // ========== copy and move ==========

    public Notation copyTo(Object destination, String notation) {
        return copyTo(destination, notation, null, true);
    }

    public Notation copyTo(Object destination, String notation, String newNotation) {
        return copyTo(destination, notation, newNotation, true);
    }

    /// Copies the member at `notation` into `destination` at `newNotation` (or the same notation).
    /// The copy is deep; this tree is not modified. An absent member is ignored.
    /// @throws NotationException of kind INVALID_DESTINATION if destination is not a map or a list
    public Notation copyTo(Object destination, String notation, String newNotation, boolean overwrite) {
        final var target = wrapDestination(destination);
        final var result = inspectGet(notation);
        if (result.has()) {
            target.set(newNotation == null ? notation : newNotation, Trees.cloneDeep(result.value()), overwrite);
        }
        return this;
    }

    public Notation copyFrom(Object target, String notation) {
        return copyFrom(target, notation, null, true);
    }

    public Notation copyFrom(Object target, String notation, String newNotation) {
        return copyFrom(target, notation, newNotation, true);
    }

    /// Copies the member at `notation` of `target` into this tree at `newNotation` (or the same
    /// notation). The target is not modified. An absent member is ignored.
    /// @throws NotationException of kind INVALID_DESTINATION if target is not a map or a list
    public Notation copyFrom(Object target, String notation, String newNotation, boolean overwrite) {
        final var result = wrapDestination(target).inspectGet(notation);
        if (result.has()) {
            set(newNotation == null ? notation : newNotation, Trees.cloneDeep(result.value()), overwrite);
        }
        return this;
    }

    public Notation moveTo(Object destination, String notation) {
        return moveTo(destination, notation, null, true);
    }

    public Notation moveTo(Object destination, String notation, String newNotation) {
        return moveTo(destination, notation, newNotation, true);
    }

    /// Removes the member at `notation` from this tree and sets it on `destination` at
    /// `newNotation` (or the same notation). An absent member is ignored.
    /// @throws NotationException of kind INVALID_DESTINATION if destination is not a map or a list
    public Notation moveTo(Object destination, String notation, String newNotation, boolean overwrite) {
        final var target = wrapDestination(destination);
        final var result = inspectRemove(notation);
        if (result.has()) {
            target.set(newNotation == null ? notation : newNotation, result.value(), overwrite);
        }
        return this;
    }

    public Notation moveFrom(Object target, String notation) {
        return moveFrom(target, notation, null, true);
    }

    public Notation moveFrom(Object target, String notation, String newNotation) {
        return moveFrom(target, notation, newNotation, true);
    }

    /// Removes the member at `notation` from `target` and sets it on this tree at
    /// `newNotation` (or the same notation). An absent member is ignored.
    /// @throws NotationException of kind INVALID_DESTINATION if target is not a map or a list
    public Notation moveFrom(Object target, String notation, String newNotation, boolean overwrite) {
        final var result = wrapDestination(target).inspectRemove(notation);
        if (result.has()) {
            set(newNotation == null ? notation : newNotation, result.value(), overwrite);
        }
        return this;
    }

    public Notation rename(String notation, String newNotation) {
        return rename(notation, newNotation, true);
    }

    /// Moves the member at `notation` to `newNotation` within this tree.
    public Notation rename(String notation, String newNotation, boolean overwrite) {
        return moveTo(source, notation, newNotation, overwrite);
    }

    public Map<String, Object> extract(String notation) {
        return extract(notation, null);
    }

    /// Returns a new map holding a copy of the member at `notation`, set at `newNotation`
    /// (or the same notation). This tree is not modified.
    public Map<String, Object> extract(String notation, String newNotation) {
        final var extracted = new LinkedHashMap<String, Object>();
        copyTo(extracted, notation, newNotation, true);
        return extracted;
    }

    public Map<String, Object> extrude(String notation) {
        return extrude(notation, null);
    }

    /// Moves the member at `notation` into a new map, at `newNotation` (or the same notation).
    public Map<String, Object> extrude(String notation, String newNotation) {
        final var extruded = new LinkedHashMap<String, Object>();
        moveTo(extruded, notation, newNotation, true);
        return extruded;
    }

    // ========== helpers ==========

    private Notation wrapDestination(Object destination) {
        if (!Trees.isCollection(destination)) {
            throw new NotationException(NotationException.Kind.INVALID_DESTINATION,
                    "Invalid destination. Expected a data object or array.");
        }
        return destination == source ? this : new Notation(destination, options);
    }

    static boolean hasOwn(Object container, Note note) {
        if (container instanceof Map<?, ?> map) {
            return note.isKey() && map.containsKey(note.normalized());
        }
        if (container instanceof List<?> list) {
            return note instanceof Note.Index index && index.index() < list.size();
        }
        return false;
    }

    static Object child(Object container, Note note) {
        if (container instanceof Map<?, ?> map) {
            return map.get(note.normalized());
        }
        return ((List<?>) container).get(((Note.Index) note).index());
    }

    private static Object newContainerFor(Note next) {
        return next.isIndexLike() ? new ArrayList<>() : new LinkedHashMap<String, Object>();
    }

    private static boolean isReserved(String notation) {
        for (final var reserved : RESERVED_KEYS) {
            if (notation.contains(reserved)) {
                return true;
            }
        }
        return false;
    }

    private static String describeParent(NotationPath path, int index) {
        return index == 0 ? "source" : "'" + path.prefix(index) + "'";
    }

    private static NotationException missing(InspectResult result, String notation) {
        return result.parentIsArray()
                ? new NotationException(NotationException.Kind.MISSING_INDEX,
                        "Implied index does not exist: '" + notation + "'")
                : new NotationException(NotationException.Kind.MISSING_PROPERTY,
                        "Implied property does not exist: '" + notation + "'");
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return (List<Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
