package exvar.ast.query;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

public abstract sealed class QueryClause extends SyntaxNode
        permits FromClause, JoinClause, WhereClause, LetClause, OrderByClause, SelectClause, GroupClause {

    protected QueryClause(SyntaxKind kind, Pos pos) {
        super(kind, pos);
    }
}
