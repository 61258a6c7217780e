package exvar.ast.pattern;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class ConstantPattern extends Pattern {
    private final Expr value;

    public ConstantPattern(Expr value, Pos pos) {
        super(SyntaxKind.CONSTANT_PATTERN, pos);
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public Expr value() { return value; }

    @Override
    public List<SyntaxNode> children() { return List.of(value); }
}
