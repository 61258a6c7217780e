package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class FieldAccessExpr extends Expr {
    private final Expr target;
    private final String member;

    public FieldAccessExpr(Expr target, String member, Pos pos) {
        super(SyntaxKind.MEMBER_ACCESS_EXPRESSION, pos);
        this.target = adopt(Objects.requireNonNull(target, "target"));
        this.member = Objects.requireNonNull(member, "member");
    }

    public Expr target() { return target; }
    public String member() { return member; }

    @Override
    public List<SyntaxNode> children() { return List.of(target); }
}
