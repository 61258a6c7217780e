package exvar.ast.query;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class LetClause extends QueryClause {
    private final Identifier identifier;
    private final Expr value;

    public LetClause(Identifier identifier, Expr value, Pos pos) {
        super(SyntaxKind.LET_CLAUSE, pos);
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public Identifier identifier() { return identifier; }
    public Expr value() { return value; }

    @Override
    public List<SyntaxNode> children() { return List.of(value); }
}
