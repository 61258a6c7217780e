package exvar.ast.type;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class PrimitiveTypeRef extends TypeRef {
    private final String name;

    public PrimitiveTypeRef(String name, Pos pos) {
        super(SyntaxKind.PREDEFINED_TYPE, pos);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() { return name; }

    @Override
    public String text() { return name; }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
