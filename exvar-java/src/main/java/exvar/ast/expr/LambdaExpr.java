package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.decl.Parameter;
import exvar.ast.stmt.BlockStmt;

import java.util.List;
import java.util.Objects;

public final class LambdaExpr extends Expr {
    private final List<Parameter> params;
    private final SyntaxNode body;

    public LambdaExpr(List<Parameter> params, SyntaxNode body, Pos pos) {
        super(SyntaxKind.PARENTHESIZED_LAMBDA_EXPRESSION, pos);
        this.params = adoptAll(params);
        if (!(body instanceof BlockStmt) && !(body instanceof Expr)) {
            throw new IllegalArgumentException("Lambda body must be a block or an expression");
        }
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public List<Parameter> params() { return params; }
    public SyntaxNode body() { return body; }

    @Override
    public List<SyntaxNode> children() { return nodes(params, body); }
}
