package exvar.ast;

import exvar.ast.decl.ClassDecl;

import java.util.List;

public final class Program extends SyntaxNode {
    private final List<ClassDecl> classes;

    public Program(List<ClassDecl> classes) {
        super(SyntaxKind.PROGRAM, new Pos(1, 1));
        this.classes = adoptAll(classes);
    }

    public List<ClassDecl> classes() { return classes; }

    @Override
    public List<SyntaxNode> children() { return List.copyOf(classes); }
}
