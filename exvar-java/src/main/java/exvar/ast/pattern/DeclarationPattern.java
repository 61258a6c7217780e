package exvar.ast.pattern;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class DeclarationPattern extends Pattern {
    private final TypeRef type;
    private final Identifier identifier;

    public DeclarationPattern(TypeRef type, Identifier identifier, Pos pos) {
        super(SyntaxKind.DECLARATION_PATTERN, pos);
        this.type = adopt(Objects.requireNonNull(type, "type"));
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    public TypeRef type() { return type; }
    public Identifier identifier() { return identifier; }

    @Override
    public List<SyntaxNode> children() { return List.of(type); }
}
