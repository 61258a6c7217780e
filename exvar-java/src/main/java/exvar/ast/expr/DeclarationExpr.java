package exvar.ast.expr;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * A variable declared in argument position, as in {@code F(out int x)}. Only ever
 * the expression of an {@link Argument}.
 */
public final class DeclarationExpr extends Expr {
    private final TypeRef type;
    private final Identifier identifier;

    public DeclarationExpr(TypeRef type, Identifier identifier, Pos pos) {
        super(SyntaxKind.DECLARATION_EXPRESSION, pos);
        this.type = adopt(Objects.requireNonNull(type, "type"));
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    public TypeRef type() { return type; }
    public Identifier identifier() { return identifier; }

    @Override
    public List<SyntaxNode> children() { return List.of(type); }
}
