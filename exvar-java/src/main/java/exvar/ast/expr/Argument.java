package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class Argument extends SyntaxNode {

    public enum RefKind {
        NONE, OUT, REF
    }

    private final RefKind refKind;
    private final Expr expr;

    public Argument(RefKind refKind, Expr expr, Pos pos) {
        super(SyntaxKind.ARGUMENT, pos);
        this.refKind = Objects.requireNonNull(refKind, "refKind");
        this.expr = adopt(Objects.requireNonNull(expr, "expr"));
    }

    public static Argument of(Expr expr) {
        return new Argument(RefKind.NONE, expr, expr.pos());
    }

    public RefKind refKind() { return refKind; }
    public Expr expr() { return expr; }

    @Override
    public List<SyntaxNode> children() { return List.of(expr); }
}
