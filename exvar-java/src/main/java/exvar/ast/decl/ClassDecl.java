package exvar.ast.decl;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class ClassDecl extends SyntaxNode {
    private final Identifier name;
    private final TypeRef baseType; // может быть null
    private final List<MemberDecl> members;

    public ClassDecl(Identifier name, TypeRef baseType, List<MemberDecl> members, Pos pos) {
        super(SyntaxKind.CLASS_DECLARATION, pos);
        this.name = Objects.requireNonNull(name, "name");
        this.baseType = adopt(baseType);
        this.members = adoptAll(members);
    }

    public Identifier name() { return name; }
    public TypeRef baseType() { return baseType; }
    public List<MemberDecl> members() { return members; }

    @Override
    public List<SyntaxNode> children() { return nodes(baseType, members); }
}
