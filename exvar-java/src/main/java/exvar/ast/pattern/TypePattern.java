package exvar.ast.pattern;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class TypePattern extends Pattern {
    private final TypeRef type;

    public TypePattern(TypeRef type, Pos pos) {
        super(SyntaxKind.TYPE_PATTERN, pos);
        this.type = adopt(Objects.requireNonNull(type, "type"));
    }

    public TypeRef type() { return type; }

    @Override
    public List<SyntaxNode> children() { return List.of(type); }
}
