package json.notation;

/// Callback for [Notation#each(TreeVisitor)].
@FunctionalInterface
public interface TreeVisitor {

    /// Visits one leaf of the tree. Scalars and empty maps or lists are leaves.
    /// @param notation full notation of the leaf, e.g. `car.colors[1]`
    /// @param keyOrIndex `String` key or `Integer` index of the leaf in its parent
    /// @param value the leaf value
    /// @param root the root of the tree being walked
    /// @return `false` to stop the whole walk, `true` to continue
    boolean visit(String notation, Object keyOrIndex, Object value, Object root);
}
