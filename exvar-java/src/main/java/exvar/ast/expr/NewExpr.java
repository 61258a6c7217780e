package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class NewExpr extends Expr {
    private final TypeRef type;
    private final ArgumentList args;

    public NewExpr(TypeRef type, ArgumentList args, Pos pos) {
        super(SyntaxKind.OBJECT_CREATION_EXPRESSION, pos);
        this.type = adopt(Objects.requireNonNull(type, "type"));
        this.args = adopt(Objects.requireNonNull(args, "args"));
    }

    public TypeRef type() { return type; }
    public ArgumentList args() { return args; }

    @Override
    public List<SyntaxNode> children() { return List.of(type, args); }
}
