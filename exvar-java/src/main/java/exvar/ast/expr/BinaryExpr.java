package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class BinaryExpr extends Expr {

    public enum Operator {
        ADD, SUB, MUL, DIV, MOD,
        EQ, NE, LT, GT, LE, GE,
        AND, OR,
        COALESCE
    }

    private final Expr left;
    private final Operator op;
    private final Expr right;

    public BinaryExpr(Expr left, Operator op, Expr right, Pos pos) {
        super(SyntaxKind.BINARY_EXPRESSION, pos);
        this.left = adopt(Objects.requireNonNull(left, "left"));
        this.op = Objects.requireNonNull(op, "op");
        this.right = adopt(Objects.requireNonNull(right, "right"));
    }

    public Expr left() { return left; }
    public Operator op() { return op; }
    public Expr right() { return right; }

    @Override
    public List<SyntaxNode> children() { return List.of(left, right); }
}
