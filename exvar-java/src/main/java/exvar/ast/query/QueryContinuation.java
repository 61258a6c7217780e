package exvar.ast.query;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class QueryContinuation extends SyntaxNode {
    private final Identifier identifier;
    private final QueryBody body;

    public QueryContinuation(Identifier identifier, QueryBody body, Pos pos) {
        super(SyntaxKind.QUERY_CONTINUATION, pos);
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Identifier identifier() { return identifier; }
    public QueryBody body() { return body; }

    @Override
    public List<SyntaxNode> children() { return List.of(body); }
}
