package exvar.sema;

import exvar.ast.Program;
import exvar.ast.SyntaxNode;
import exvar.ast.decl.ClassDecl;
import exvar.ast.decl.ConstructorDecl;
import exvar.ast.decl.FieldDecl;
import exvar.ast.decl.MemberDecl;
import exvar.ast.decl.MethodDecl;
import exvar.ast.decl.Parameter;
import exvar.ast.expr.AnonymousMethodExpr;
import exvar.ast.expr.Expr;
import exvar.ast.expr.LambdaExpr;
import exvar.ast.expr.SimpleLambdaExpr;
import exvar.ast.stmt.BlockStmt;
import exvar.ast.stmt.DoStmt;
import exvar.ast.stmt.ForStmt;
import exvar.ast.stmt.IfStmt;
import exvar.ast.stmt.LockStmt;
import exvar.ast.stmt.Stmt;
import exvar.ast.stmt.SwitchLabel;
import exvar.ast.stmt.SwitchSection;
import exvar.ast.stmt.SwitchStmt;
import exvar.ast.stmt.VarDeclStmt;
import exvar.ast.stmt.WhileStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static exvar.sema.ExpressionVariableFinder.findExpressionVariables;

/**
 * Builds the tree of local scopes for a program: every block, switch section,
 * loop, constructor initializer and closure gets a {@link Scope} holding the
 * locals declared directly in it, including those declared inside expressions.
 */
public final class LocalScopeBinder {
    private static final Logger logger = LoggerFactory.getLogger(LocalScopeBinder.class);

    public record Result(
            Scope global,
            Map<SyntaxNode, Scope> scopes
    ) {
        public Scope scopeOf(SyntaxNode node) {
            return scopes.get(node);
        }
    }

    private final SymbolFactory factory;
    private final Map<SyntaxNode, Scope> scopes = new LinkedHashMap<>();
    private SymbolTable table;

    public LocalScopeBinder() {
        this(LocalSymbolFactory.INSTANCE);
    }

    public LocalScopeBinder(SymbolFactory factory) {
        this.factory = factory;
    }

    public Result bind(Program program) {
        scopes.clear();
        Scope global = new Scope(null, null, program);
        table = new SymbolTable(global);

        for (ClassDecl c : program.classes()) {
            for (MemberDecl m : c.members()) bindMember(c, m);
        }

        table = null;
        return new Result(global, Collections.unmodifiableMap(new LinkedHashMap<>(scopes)));
    }

    // ---------- members ----------

    private void bindMember(ClassDecl owner, MemberDecl m) {
        String name = owner.name().text() + "." + m.name().text();
        switch (m.kind()) {
            case FIELD_DECLARATION -> {
                FieldDecl f = (FieldDecl) m;
                if (f.initializer() == null) return;
                open(new MemberSymbol(name, MemberSymbol.Kind.FIELD, f.pos()), f);
                List<LocalSymbol> locals = new ArrayList<>();
                findExpressionVariables(factory, table.current(), locals, f.initializer(), null);
                defineAll(locals);
                bindClosures(f.initializer());
                close();
            }
            case METHOD_DECLARATION -> {
                MethodDecl md = (MethodDecl) m;
                open(new MemberSymbol(name, MemberSymbol.Kind.METHOD, md.pos()), md);
                defineParameters(md.params());
                bindBlock(md.body());
                close();
            }
            case CONSTRUCTOR_DECLARATION -> {
                ConstructorDecl cd = (ConstructorDecl) m;
                open(new MemberSymbol(name, MemberSymbol.Kind.CONSTRUCTOR, cd.pos()), cd);
                defineParameters(cd.params());

                if (cd.initializer() != null) {
                    // out variables of : this(...) / : base(...) stay in scope for the body
                    Scope ctorScope = table.current();
                    openNested(cd.initializer());
                    List<LocalSymbol> locals = new ArrayList<>();
                    findExpressionVariables(factory, table.current(), locals, cd.initializer(), ctorScope);
                    defineAll(locals);
                    bindClosures(cd.initializer());
                    bindBlock(cd.body());
                    close();
                } else {
                    bindBlock(cd.body());
                }
                close();
            }
            default -> throw new IllegalStateException("Unexpected member: " + m.kind());
        }
    }

    // ---------- statements ----------

    private void bindBlock(BlockStmt b) {
        openNested(b);
        buildLocals(b.statements());
        for (Stmt s : b.statements()) bindStmt(s);
        close();
    }

    /**
     * Defines the locals that the given statements declare in the current scope.
     * Loops, lock and switch statements declare theirs in a scope of their own.
     */
    private void buildLocals(List<Stmt> statements) {
        List<LocalSymbol> locals = new ArrayList<>();
        for (Stmt s : statements) {
            switch (s.kind()) {
                case LOCAL_DECLARATION_STATEMENT -> {
                    VarDeclStmt v = (VarDeclStmt) s;
                    for (VarDeclStmt.Declarator d : v.declarators()) {
                        locals.add(factory.makeLocal(table.current(), v.type(), d.identifier(),
                                LocalDeclarationKind.REGULAR_VARIABLE));
                        findExpressionVariables(factory, table.current(), locals, d.initializer(), null);
                    }
                }
                case EXPRESSION_STATEMENT, IF_STATEMENT, RETURN_STATEMENT ->
                        findExpressionVariables(factory, table.current(), locals, s, null);
                default -> {
                    // declares nothing here
                }
            }
        }
        defineAll(locals);
    }

    private void bindStmt(Stmt s) {
        switch (s.kind()) {
            case BLOCK -> bindBlock((BlockStmt) s);

            case IF_STATEMENT -> {
                IfStmt i = (IfStmt) s;
                bindClosures(i.condition());
                bindEmbedded(i.thenStmt());
                if (i.elseStmt() != null) bindEmbedded(i.elseStmt());
            }

            case WHILE_STATEMENT -> {
                WhileStmt w = (WhileStmt) s;
                bindConditionScope(w, w.condition(), w.body());
            }

            case DO_STATEMENT -> {
                DoStmt d = (DoStmt) s;
                bindConditionScope(d, d.condition(), d.body());
            }

            case LOCK_STATEMENT -> {
                LockStmt l = (LockStmt) s;
                bindConditionScope(l, l.expr(), l.body());
            }

            case SWITCH_STATEMENT -> {
                SwitchStmt sw = (SwitchStmt) s;
                openNested(sw);
                List<LocalSymbol> locals = new ArrayList<>();
                findExpressionVariables(factory, table.current(), locals, sw, null);
                defineAll(locals);
                bindClosures(sw.subject());
                for (SwitchSection section : sw.sections()) bindSection(section);
                close();
            }

            case FOR_STATEMENT -> bindFor((ForStmt) s);

            default -> bindClosures(s);
        }
    }

    private void bindEmbedded(Stmt s) {
        switch (s.kind()) {
            case EXPRESSION_STATEMENT, IF_STATEMENT, RETURN_STATEMENT, LOCAL_DECLARATION_STATEMENT -> {
                openNested(s);
                buildLocals(List.of(s));
                bindStmt(s);
                close();
            }
            default -> bindStmt(s);
        }
    }

    private void bindConditionScope(Stmt s, Expr condition, Stmt body) {
        openNested(s);
        List<LocalSymbol> locals = new ArrayList<>();
        findExpressionVariables(factory, table.current(), locals, s, null);
        defineAll(locals);
        bindClosures(condition);
        bindEmbedded(body);
        close();
    }

    private void bindSection(SwitchSection section) {
        openNested(section);
        List<LocalSymbol> locals = new ArrayList<>();
        findExpressionVariables(factory, table.current(), locals, section, null);
        defineAll(locals);
        buildLocals(section.statements());

        for (SwitchLabel label : section.labels()) bindClosures(label);
        for (Stmt s : section.statements()) bindStmt(s);
        close();
    }

    private void bindFor(ForStmt f) {
        openNested(f);
        if (f.init() != null) buildLocals(List.of(f.init()));

        List<LocalSymbol> locals = new ArrayList<>();
        findExpressionVariables(factory, table.current(), locals, f.condition(), null);
        findExpressionVariables(factory, table.current(), locals, f.updates());
        defineAll(locals);

        if (f.init() != null) bindClosures(f.init());
        if (f.condition() != null) bindClosures(f.condition());
        for (Expr u : f.updates()) bindClosures(u);
        bindEmbedded(f.body());
        close();
    }

    // ---------- closures ----------

    /**
     * Binds every lambda and anonymous method under {@code root} that is not nested in
     * another closure or in a statement bound separately.
     */
    private void bindClosures(SyntaxNode root) {
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            SyntaxNode n = pending.pop();
            if (n.kind().isClosure()) {
                bindClosure(n);
                continue;
            }
            if (n != root && n instanceof Stmt) continue;

            List<SyntaxNode> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) pending.push(children.get(i));
        }
    }

    private void bindClosure(SyntaxNode closure) {
        List<Parameter> params;
        SyntaxNode body;
        switch (closure.kind()) {
            case PARENTHESIZED_LAMBDA_EXPRESSION -> {
                LambdaExpr l = (LambdaExpr) closure;
                params = l.params();
                body = l.body();
            }
            case SIMPLE_LAMBDA_EXPRESSION -> {
                SimpleLambdaExpr l = (SimpleLambdaExpr) closure;
                params = List.of(l.param());
                body = l.body();
            }
            case ANONYMOUS_METHOD_EXPRESSION -> {
                AnonymousMethodExpr a = (AnonymousMethodExpr) closure;
                params = a.params();
                body = a.body();
            }
            default -> throw new IllegalStateException("Not a closure: " + closure.kind());
        }

        open(new MemberSymbol("lambda@" + closure.pos(), MemberSymbol.Kind.LAMBDA, closure.pos()), closure);
        defineParameters(params);
        if (body instanceof BlockStmt b) {
            bindBlock(b);
        } else {
            List<LocalSymbol> locals = new ArrayList<>();
            findExpressionVariables(factory, table.current(), locals, body, null);
            defineAll(locals);
            bindClosures(body);
        }
        close();
    }

    // ---------- helpers ----------

    private void open(MemberSymbol owner, SyntaxNode syntax) {
        scopes.put(syntax, table.push(owner, syntax));
    }

    private void openNested(SyntaxNode syntax) {
        scopes.put(syntax, table.pushNested(syntax));
    }

    private void close() {
        Scope s = table.pop();
        logger.debug("{} {}: {}", s.containingMember(), s.syntax(), s.locals());
    }

    private void defineParameters(List<Parameter> params) {
        for (Parameter p : params) {
            table.define(factory.makeLocal(table.current(), p.type(), p.name(), LocalDeclarationKind.PARAMETER));
        }
    }

    private void defineAll(List<LocalSymbol> locals) {
        for (LocalSymbol l : locals) table.define(l);
    }
}
