package exvar.ast.query;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class FromClause extends QueryClause {
    private final Identifier identifier;
    private final Expr source;

    public FromClause(Identifier identifier, Expr source, Pos pos) {
        super(SyntaxKind.FROM_CLAUSE, pos);
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.source = adopt(Objects.requireNonNull(source, "source"));
    }

    public Identifier identifier() { return identifier; }
    public Expr source() { return source; }

    @Override
    public List<SyntaxNode> children() { return List.of(source); }
}
