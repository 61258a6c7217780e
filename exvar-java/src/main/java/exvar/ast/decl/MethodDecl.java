package exvar.ast.decl;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.stmt.BlockStmt;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class MethodDecl extends MemberDecl {
    private final TypeRef returnType;
    private final Identifier name;
    private final List<Parameter> params;
    private final BlockStmt body;

    public MethodDecl(TypeRef returnType, Identifier name, List<Parameter> params, BlockStmt body, Pos pos) {
        super(SyntaxKind.METHOD_DECLARATION, pos);
        this.returnType = adopt(Objects.requireNonNull(returnType, "returnType"));
        this.name = Objects.requireNonNull(name, "name");
        this.params = adoptAll(params);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public TypeRef returnType() { return returnType; }
    @Override
    public Identifier name() { return name; }
    public List<Parameter> params() { return params; }
    public BlockStmt body() { return body; }

    @Override
    public List<SyntaxNode> children() { return nodes(returnType, params, body); }
}
