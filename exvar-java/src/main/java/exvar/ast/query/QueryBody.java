package exvar.ast.query;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

/**
 * Everything after the leading {@code from}: intermediate clauses, the closing
 * {@code select}/{@code group} clause and an optional {@code into} continuation.
 */
public final class QueryBody extends SyntaxNode {
    private final List<QueryClause> clauses;
    private final QueryClause selectOrGroup;
    private final QueryContinuation continuation;

    public QueryBody(List<QueryClause> clauses, QueryClause selectOrGroup, QueryContinuation continuation, Pos pos) {
        super(SyntaxKind.QUERY_BODY, pos);
        this.clauses = adoptAll(clauses);
        if (!(selectOrGroup instanceof SelectClause) && !(selectOrGroup instanceof GroupClause)) {
            throw new IllegalArgumentException("Query body must end with a select or group clause");
        }
        this.selectOrGroup = adopt(Objects.requireNonNull(selectOrGroup, "selectOrGroup"));
        this.continuation = adopt(continuation);
    }

    public List<QueryClause> clauses() { return clauses; }
    public QueryClause selectOrGroup() { return selectOrGroup; }
    public QueryContinuation continuation() { return continuation; }

    @Override
    public List<SyntaxNode> children() { return nodes(clauses, selectOrGroup, continuation); }
}
