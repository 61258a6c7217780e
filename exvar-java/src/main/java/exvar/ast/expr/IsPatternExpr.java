package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.pattern.Pattern;

import java.util.List;
import java.util.Objects;

public final class IsPatternExpr extends Expr {
    private final Expr expr;
    private final Pattern pattern;

    public IsPatternExpr(Expr expr, Pattern pattern, Pos pos) {
        super(SyntaxKind.IS_PATTERN_EXPRESSION, pos);
        this.expr = adopt(Objects.requireNonNull(expr, "expr"));
        this.pattern = adopt(Objects.requireNonNull(pattern, "pattern"));
    }

    public Expr expr() { return expr; }
    public Pattern pattern() { return pattern; }

    @Override
    public List<SyntaxNode> children() { return List.of(expr, pattern); }
}
