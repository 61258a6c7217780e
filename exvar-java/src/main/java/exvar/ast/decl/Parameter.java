package exvar.ast.decl;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class Parameter extends SyntaxNode {
    private final TypeRef type; // может быть null
    private final Identifier name;

    public Parameter(TypeRef type, Identifier name, Pos pos) {
        super(SyntaxKind.PARAMETER, pos);
        this.type = adopt(type);
        this.name = Objects.requireNonNull(name, "name");
    }

    public TypeRef type() { return type; }
    public Identifier name() { return name; }

    @Override
    public List<SyntaxNode> children() { return nodes(type); }
}
