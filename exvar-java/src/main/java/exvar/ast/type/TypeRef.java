package exvar.ast.type;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

public abstract sealed class TypeRef extends SyntaxNode
        permits PrimitiveTypeRef, NamedTypeRef, ArrayTypeRef {

    protected TypeRef(SyntaxKind kind, Pos pos) {
        super(kind, pos);
    }

    public boolean isVar() {
        return false;
    }

    public abstract String text();
}
