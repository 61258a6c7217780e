package exvar.ast.stmt;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;
import exvar.ast.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class VarDeclStmt extends Stmt {
    private final TypeRef type;
    private final List<Declarator> declarators;

    public VarDeclStmt(TypeRef type, List<Declarator> declarators, Pos pos) {
        super(SyntaxKind.LOCAL_DECLARATION_STATEMENT, pos);
        this.type = adopt(Objects.requireNonNull(type, "type"));
        if (declarators.isEmpty()) throw new IllegalArgumentException("At least one declarator is required");
        this.declarators = adoptAll(declarators);
    }

    public TypeRef type() { return type; }
    public List<Declarator> declarators() { return declarators; }

    @Override
    public List<SyntaxNode> children() { return nodes(type, declarators); }

    public static final class Declarator extends SyntaxNode {
        private final Identifier identifier;
        private final Expr initializer; // может быть null

        public Declarator(Identifier identifier, Expr initializer, Pos pos) {
            super(SyntaxKind.VARIABLE_DECLARATOR, pos);
            this.identifier = Objects.requireNonNull(identifier, "identifier");
            this.initializer = adopt(initializer);
        }

        public Identifier identifier() { return identifier; }
        public Expr initializer() { return initializer; }

        @Override
        public List<SyntaxNode> children() { return nodes(initializer); }
    }
}
