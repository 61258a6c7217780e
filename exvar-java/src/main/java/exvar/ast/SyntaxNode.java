package exvar.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base of every tree node. A node is immutable once built, except for its parent
 * link, which is assigned exactly once when an enclosing node adopts it.
 */
public abstract class SyntaxNode {

    private final SyntaxKind kind;
    private final Pos pos;
    private SyntaxNode parent;

    protected SyntaxNode(SyntaxKind kind, Pos pos) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pos = pos == null ? Pos.NONE : pos;
    }

    public final SyntaxKind kind() {
        return kind;
    }

    public final Pos pos() {
        return pos;
    }

    public final SyntaxNode parent() {
        return parent;
    }

    /**
     * Direct children in source order. Absent optional parts are omitted.
     */
    public abstract List<SyntaxNode> children();

    protected final <T extends SyntaxNode> T adopt(T child) {
        if (child == null) return null;
        SyntaxNode c = child;
        if (c.parent != null && c.parent != this) {
            throw new IllegalArgumentException(c.kind + "@" + c.pos + " already belongs to "
                    + c.parent.kind + "@" + c.parent.pos);
        }
        c.parent = this;
        return child;
    }

    protected final <T extends SyntaxNode> List<T> adoptAll(List<T> children) {
        List<T> copy = List.copyOf(children);
        for (T child : copy) adopt(child);
        return copy;
    }

    protected static List<SyntaxNode> nodes(Object... parts) {
        List<SyntaxNode> out = new ArrayList<>();
        for (Object part : parts) {
            if (part == null) continue;
            if (part instanceof SyntaxNode n) {
                out.add(n);
            } else if (part instanceof List<?> list) {
                for (Object o : list) {
                    if (o != null) out.add((SyntaxNode) o);
                }
            } else {
                throw new IllegalArgumentException("Not a syntax node: " + part.getClass().getName());
            }
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return kind + "@" + pos;
    }
}
