package exvar.ast.decl;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class FieldDecl extends MemberDecl {
    private final TypeRef type;
    private final Identifier name;
    private final Expr initializer; // может быть null

    public FieldDecl(TypeRef type, Identifier name, Expr initializer, Pos pos) {
        super(SyntaxKind.FIELD_DECLARATION, pos);
        this.type = adopt(Objects.requireNonNull(type, "type"));
        this.name = Objects.requireNonNull(name, "name");
        this.initializer = adopt(initializer);
    }

    public TypeRef type() { return type; }
    @Override
    public Identifier name() { return name; }
    public Expr initializer() { return initializer; }

    @Override
    public List<SyntaxNode> children() { return nodes(type, initializer); }
}
