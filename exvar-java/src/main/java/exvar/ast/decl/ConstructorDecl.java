package exvar.ast.decl;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.stmt.BlockStmt;

import java.util.List;
import java.util.Objects;

public final class ConstructorDecl extends MemberDecl {
    private final Identifier name;
    private final List<Parameter> params;
    private final ConstructorInitializer initializer; // может быть null
    private final BlockStmt body;

    public ConstructorDecl(Identifier name, List<Parameter> params, ConstructorInitializer initializer,
                           BlockStmt body, Pos pos) {
        super(SyntaxKind.CONSTRUCTOR_DECLARATION, pos);
        this.name = Objects.requireNonNull(name, "name");
        this.params = adoptAll(params);
        this.initializer = adopt(initializer);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    @Override
    public Identifier name() { return name; }
    public List<Parameter> params() { return params; }
    public ConstructorInitializer initializer() { return initializer; }
    public BlockStmt body() { return body; }

    @Override
    public List<SyntaxNode> children() { return nodes(params, initializer, body); }
}
