package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class UnaryExpr extends Expr {

    public enum Operator {
        NEG, NOT
    }

    private final Operator op;
    private final Expr operand;

    public UnaryExpr(Operator op, Expr operand, Pos pos) {
        super(SyntaxKind.UNARY_EXPRESSION, pos);
        this.op = Objects.requireNonNull(op, "op");
        this.operand = adopt(Objects.requireNonNull(operand, "operand"));
    }

    public Operator op() { return op; }
    public Expr operand() { return operand; }

    @Override
    public List<SyntaxNode> children() { return List.of(operand); }
}
