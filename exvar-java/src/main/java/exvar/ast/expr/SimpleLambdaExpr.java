package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.decl.Parameter;
import exvar.ast.stmt.BlockStmt;

import java.util.List;
import java.util.Objects;

public final class SimpleLambdaExpr extends Expr {
    private final Parameter param;
    private final SyntaxNode body;

    public SimpleLambdaExpr(Parameter param, SyntaxNode body, Pos pos) {
        super(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION, pos);
        this.param = adopt(Objects.requireNonNull(param, "param"));
        if (!(body instanceof BlockStmt) && !(body instanceof Expr)) {
            throw new IllegalArgumentException("Lambda body must be a block or an expression");
        }
        this.body = adopt(body);
    }

    public Parameter param() { return param; }
    public SyntaxNode body() { return body; }

    @Override
    public List<SyntaxNode> children() { return List.of(param, body); }
}
