package json.notation;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/// Helpers over trees made of `Map`, `List` and scalar leaves.
final class Trees {

    private Trees() {}

    /// Receives leaves from [#walk].
    @FunctionalInterface
    interface LeafVisitor {
        boolean visit(List<Note> notes, Object keyOrIndex, Object value);
    }

    static boolean isCollection(Object value) {
        return value instanceof Map || value instanceof List;
    }

    static boolean isEmptyCollection(Object value) {
        return (value instanceof Map<?, ?> map && map.isEmpty()) || (value instanceof List<?> list && list.isEmpty());
    }

    static Object emptyLike(Object container) {
        return container instanceof List ? new ArrayList<>() : new LinkedHashMap<String, Object>();
    }

    static Object emptyOf(ValueType type) {
        return type == ValueType.ARRAY ? new ArrayList<>() : new LinkedHashMap<String, Object>();
    }

    /// Deep-copies maps and lists. Dates, calendars and arrays are copied; every other
    /// value is treated as immutable (or opaque) and shared by reference.
    static Object cloneDeep(Object value) {
        if (value instanceof Map<?, ?> map) {
            final var copy = new LinkedHashMap<String, Object>(Math.max(16, map.size() * 2));
            for (final var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), cloneDeep(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            final var copy = new ArrayList<>(list.size());
            for (final var item : list) {
                copy.add(cloneDeep(item));
            }
            return copy;
        }
        if (value instanceof Date date) {
            return date.clone();
        }
        if (value instanceof Calendar calendar) {
            return calendar.clone();
        }
        if (value != null && value.getClass().isArray()) {
            final int length = Array.getLength(value);
            final Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            for (int i = 0; i < length; i++) {
                Array.set(copy, i, cloneDeep(Array.get(value, i)));
            }
            return copy;
        }
        return value;
    }

    /// Deep walk visiting every leaf (scalar or empty container) with its full note list.
    /// Maps are walked in iteration order; lists in index order, or from the highest index
    /// to the lowest when `reverseLists` is set so that removals do not shift unvisited items.
    /// @return false if the visitor stopped the walk
    static boolean walk(Object container, List<Note> prefix, boolean reverseLists, LeafVisitor visitor) {
        if (container instanceof Map<?, ?> map) {
            // snapshot so visitors may mutate the tree
            for (final var entry : new ArrayList<>(map.entrySet())) {
                final var key = String.valueOf(entry.getKey());
                if (!visitChild(prefix, Note.key(key), key, entry.getValue(), reverseLists, visitor)) {
                    return false;
                }
            }
        } else if (container instanceof List<?> list) {
            final List<?> items = new ArrayList<>(list);
            if (reverseLists) {
                final ListIterator<?> it = items.listIterator(items.size());
                while (it.hasPrevious()) {
                    final int index = it.previousIndex();
                    if (!visitChild(prefix, Note.index(index), index, it.previous(), true, visitor)) {
                        return false;
                    }
                }
            } else {
                for (int i = 0; i < items.size(); i++) {
                    if (!visitChild(prefix, Note.index(i), i, items.get(i), false, visitor)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private static boolean visitChild(List<Note> prefix, Note note, Object keyOrIndex, Object value,
                                      boolean reverseLists, LeafVisitor visitor) {
        final var notes = new ArrayList<Note>(prefix.size() + 1);
        notes.addAll(prefix);
        notes.add(note);
        if (isCollection(value) && !isEmptyCollection(value)) {
            return walk(value, Collections.unmodifiableList(notes), reverseLists, visitor);
        }
        return visitor.visit(Collections.unmodifiableList(notes), keyOrIndex, value);
    }
}
