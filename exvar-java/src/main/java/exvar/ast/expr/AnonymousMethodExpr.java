package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.decl.Parameter;
import exvar.ast.stmt.BlockStmt;

import java.util.List;
import java.util.Objects;

public final class AnonymousMethodExpr extends Expr {
    private final List<Parameter> params; // null when written without parentheses
    private final BlockStmt body;

    public AnonymousMethodExpr(List<Parameter> params, BlockStmt body, Pos pos) {
        super(SyntaxKind.ANONYMOUS_METHOD_EXPRESSION, pos);
        this.params = params == null ? null : adoptAll(params);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public List<Parameter> params() { return params == null ? List.of() : params; }
    public boolean hasParameterList() { return params != null; }
    public BlockStmt body() { return body; }

    @Override
    public List<SyntaxNode> children() { return nodes(params, body); }
}
