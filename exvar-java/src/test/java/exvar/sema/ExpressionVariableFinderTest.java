package exvar.sema;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.Program;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.decl.ClassDecl;
import exvar.ast.decl.ConstructorDecl;
import exvar.ast.decl.MethodDecl;
import exvar.ast.expr.Argument;
import exvar.ast.expr.ArgumentList;
import exvar.ast.expr.ArrayAccessExpr;
import exvar.ast.expr.BinaryExpr;
import exvar.ast.expr.CallExpr;
import exvar.ast.expr.DeclarationExpr;
import exvar.ast.expr.Expr;
import exvar.ast.expr.IsPatternExpr;
import exvar.ast.expr.ParenExpr;
import exvar.ast.expr.VarExpr;
import exvar.ast.pattern.DeclarationPattern;
import exvar.ast.stmt.Stmt;
import exvar.ast.stmt.SwitchStmt;
import exvar.ast.type.NamedTypeRef;
import exvar.ast.type.PrimitiveTypeRef;
import exvar.lexer.Lexer;
import exvar.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static exvar.sema.ExpressionVariableFinder.findExpressionVariables;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class ExpressionVariableFinderTest {

    private final Scope scope = new Scope(null, new MemberSymbol("C.M", MemberSymbol.Kind.METHOD, Pos.NONE), null);

    @Mock
    SymbolFactory factory;

    private static Expr expr(String src) {
        return new Parser(new Lexer(src).tokenize()).parseStandaloneExpr();
    }

    /** Statements of the body of method {@code M} in {@code class C { void M() { <body> } }}. */
    private static List<Stmt> body(String src) {
        Program p = new Parser(new Lexer("class C { void M() { " + src + " } }").tokenize()).parseProgram();
        return ((MethodDecl) p.classes().get(0).members().get(0)).body().statements();
    }

    private List<LocalSymbol> find(SyntaxNode node) {
        List<LocalSymbol> out = new ArrayList<>();
        findExpressionVariables(scope, out, node);
        return out;
    }

    private static List<String> names(List<LocalSymbol> locals) {
        return locals.stream().map(LocalSymbol::name).toList();
    }

    private static List<LocalDeclarationKind> kinds(List<LocalSymbol> locals) {
        return locals.stream().map(LocalSymbol::kind).toList();
    }

    // ---------- nothing to find ----------

    @Test
    void no_declaration_sites_yields_empty_output() {
        assertTrue(find(expr("a + b * F(c, ref d) ?? G(out e)")).isEmpty());

        List<LocalSymbol> out = new ArrayList<>();
        findExpressionVariables(scope, out, List.of(expr("a = 1"), expr("F(b)")));
        assertTrue(out.isEmpty());
    }

    @Test
    void null_root_and_empty_list_are_no_ops() {
        List<LocalSymbol> out = new ArrayList<>();
        findExpressionVariables(scope, out, (SyntaxNode) null);
        findExpressionVariables(scope, out, List.of());
        assertTrue(out.isEmpty());
    }

    @Test
    void output_is_appended_not_replaced() {
        List<LocalSymbol> out = new ArrayList<>();
        findExpressionVariables(scope, out, expr("o is int a"));
        findExpressionVariables(scope, out, expr("F(out var b)"));
        assertEquals(List.of("a", "b"), names(out));
    }

    // ---------- patterns and out variables ----------

    @Test
    void pattern_variable_in_is_expression() {
        var locals = find(expr("o is string s"));
        assertEquals(1, locals.size());

        LocalSymbol s = locals.get(0);
        assertEquals("s", s.name());
        assertEquals(LocalDeclarationKind.PATTERN_VARIABLE, s.kind());
        assertEquals("string", s.declaredType().text());
        assertSame(scope, s.scope());
        assertEquals("C.M", s.containingMember().name());
        assertNull(s.declaringContext());
    }

    @Test
    void recursive_pattern_reports_nested_designations_in_order() {
        var locals = find(expr("o is Point(int x, var y, 0)"));
        assertEquals(List.of("x", "y"), names(locals));
        assertTrue(locals.get(1).isImplicitlyTyped());
    }

    @Test
    void out_variables_in_invocation_carry_call_as_context() {
        Expr call = expr("F(out var x, out int y, out z)");
        Scope enclosing = new Scope(null, null, null);

        List<LocalSymbol> out = new ArrayList<>();
        findExpressionVariables(scope, out, call, enclosing);

        assertEquals(List.of("x", "y"), names(out));
        assertEquals(List.of(LocalDeclarationKind.OUT_VARIABLE, LocalDeclarationKind.OUT_VARIABLE), kinds(out));
        assertSame(call, out.get(0).declaringContext());
        assertSame(enclosing, out.get(0).enclosingScope());
        assertTrue(out.get(0).isImplicitlyTyped());
        assertFalse(out.get(1).isImplicitlyTyped());
    }

    @Test
    void out_variable_in_object_creation() {
        Expr creation = expr("new Foo(1, out var z)");
        var locals = find(creation);
        assertEquals(List.of("z"), names(locals));
        assertEquals(SyntaxKind.OBJECT_CREATION_EXPRESSION, locals.get(0).declaringContext().kind());
    }

    @Test
    void out_variables_in_constructor_initializers() {
        Program p = new Parser(new Lexer("""
                class C : B {
                    C(int a) : base(F(out var x), out var y) { }
                    C() : this(out int z) { }
                }
                """).tokenize()).parseProgram();
        ClassDecl c = p.classes().get(0);
        ConstructorDecl first = (ConstructorDecl) c.members().get(0);
        ConstructorDecl second = (ConstructorDecl) c.members().get(1);

        var locals = find(first.initializer());
        assertEquals(List.of("x", "y"), names(locals));
        assertEquals(SyntaxKind.INVOCATION_EXPRESSION, locals.get(0).declaringContext().kind());
        assertEquals(SyntaxKind.BASE_CONSTRUCTOR_INITIALIZER, locals.get(1).declaringContext().kind());

        var thisLocals = find(second.initializer());
        assertEquals(SyntaxKind.THIS_CONSTRUCTOR_INITIALIZER, thisLocals.get(0).declaringContext().kind());
    }

    @Test
    void nested_sites_are_reported_in_source_order() {
        var locals = find(expr("F(G(out var a), o is int b, H(p is string c, out var d))"));
        assertEquals(List.of("a", "b", "c", "d"), names(locals));
        assertEquals(List.of(
                LocalDeclarationKind.OUT_VARIABLE,
                LocalDeclarationKind.PATTERN_VARIABLE,
                LocalDeclarationKind.PATTERN_VARIABLE,
                LocalDeclarationKind.OUT_VARIABLE
        ), kinds(locals));
    }

    // ---------- closures ----------

    @Test
    void declarations_inside_closures_are_not_reported() {
        assertTrue(find(expr("F(x => G(out var y))")).isEmpty());
        assertTrue(find(expr("F((int p, q) => p is int r)")).isEmpty());
        assertTrue(find(expr("F(delegate { G(out var z); })")).isEmpty());
        assertTrue(find(expr("F(delegate(int a) { return a is int b; })")).isEmpty());
    }

    @Test
    void closure_argument_does_not_hide_sibling_arguments() {
        var locals = find(expr("F(out var before, x => G(out var inside), o is int after)"));
        assertEquals(List.of("before", "after"), names(locals));
    }

    @Test
    void closure_as_root_yields_nothing() {
        assertTrue(find(expr("x => x is int y")).isEmpty());
    }

    // ---------- binary chains ----------

    @Test
    void binary_chain_leaves_visited_left_to_right() {
        var locals = find(expr("a is int x && F(out var y) || b is string z"));
        assertEquals(List.of("x", "y", "z"), names(locals));
    }

    @Test
    void coalesce_is_visited_in_order() {
        var locals = find(expr("a ?? (b is int x) ?? F(out var y)"));
        assertEquals(List.of("x", "y"), names(locals));
    }

    @Test
    void deep_binary_chain_does_not_overflow() {
        int n = 50_000;
        Expr chain = leaf(0);
        for (int i = 1; i <= n; i++) {
            chain = new BinaryExpr(chain, BinaryExpr.Operator.OR, leaf(i), Pos.NONE);
        }

        var locals = find(chain);

        assertEquals(n + 1, locals.size());
        for (int i = 0; i <= n; i++) {
            assertEquals("v" + i, locals.get(i).name());
        }
    }

    private static Expr leaf(int i) {
        return new IsPatternExpr(
                new VarExpr("o", Pos.NONE),
                new DeclarationPattern(new PrimitiveTypeRef("int", Pos.NONE), Identifier.of("v" + i), Pos.NONE),
                Pos.NONE);
    }

    // ---------- statements ----------

    @Test
    void if_visits_condition_only() {
        var s = body("if (o is int a) { G(out var b); } else H(out var c);").get(0);
        assertEquals(List.of("a"), names(find(s)));
    }

    @Test
    void loops_and_lock_visit_their_condition_only() {
        var stmts = body("""
                while (F(out var w)) { G(out var inWhile); }
                do { G(out var inDo); } while (o is int d);
                lock (H(out var l)) { G(out var inLock); }
                """);
        assertEquals(List.of("w"), names(find(stmts.get(0))));
        assertEquals(List.of("d"), names(find(stmts.get(1))));
        assertEquals(List.of("l"), names(find(stmts.get(2))));
    }

    @Test
    void local_declaration_visits_initializers_but_not_declared_names() {
        var s = body("int x = F(out var y), u, z = o is int w;").get(0);
        assertEquals(List.of("y", "w"), names(find(s)));
    }

    @Test
    void switch_statement_visits_subject_only() {
        var s = body("switch (F(out var a)) { case int b: G(out var c); break; }").get(0);
        assertEquals(List.of("a"), names(find(s)));
    }

    @Test
    void switch_section_visits_pattern_then_guard() {
        var sw = (SwitchStmt) body("""
                switch (o) {
                    case int x when F(out var y):
                        G(out var notInLabel);
                        break;
                    case 1:
                    case string s:
                    default:
                        break;
                }
                """).get(0);

        var first = find(sw.sections().get(0));
        assertEquals(List.of("x", "y"), names(first));
        assertEquals(List.of(LocalDeclarationKind.PATTERN_VARIABLE, LocalDeclarationKind.OUT_VARIABLE), kinds(first));

        assertEquals(List.of("s"), names(find(sw.sections().get(1))));
    }

    @Test
    void recursive_case_pattern_and_guard_in_source_order() {
        var sw = (SwitchStmt) body("""
                switch (o) {
                    case Point(int a, (var b, 1)) when F(out var c) && d is string e:
                        break;
                }
                """).get(0);

        var found = find(sw.sections().get(0));
        assertEquals(List.of("a", "b", "c", "e"), names(found));
        assertEquals(List.of(
                LocalDeclarationKind.PATTERN_VARIABLE,
                LocalDeclarationKind.PATTERN_VARIABLE,
                LocalDeclarationKind.OUT_VARIABLE,
                LocalDeclarationKind.PATTERN_VARIABLE
        ), kinds(found));
        assertTrue(found.get(1).isImplicitlyTyped());
    }

    @Test
    void statements_in_a_for_loop_are_visited_generically() {
        var s = body("for (int i = F(out var a); i < 10; G(out var b)) { H(out var c); }").get(0);
        assertEquals(List.of("a", "b", "c"), names(find(s)));
    }

    // ---------- queries ----------

    @Test
    void query_reports_from_source_and_join_sources_only() {
        var locals = find(expr("""
                from a in F(out var x)
                join b in G(out var y) on a equals H(out var notOn)
                where I(out var notWhere)
                let c = J(out var notLet)
                from d in K(out var notSecondFrom)
                select L(out var notSelect)
                """));
        assertEquals(List.of("x", "y"), names(locals));
    }

    @Test
    void query_continuation_reports_its_join_sources() {
        var locals = find(expr("""
                from a in xs
                group a by a.Key into g
                join c in F(out var k) on g equals c
                select c
                """));
        assertEquals(List.of("k"), names(locals));
    }

    // ---------- multi-root ----------

    @Test
    void multi_root_reports_in_list_order() {
        List<LocalSymbol> out = new ArrayList<>();
        findExpressionVariables(scope, out, List.of(expr("F(out var e1)"), expr("o is int e2"), expr("x => G(out var e3)")));

        assertEquals(List.of("e1", "e2"), names(out));
        assertNull(out.get(0).enclosingScope());
    }

    // ---------- failures ----------

    @Test
    void out_declaration_in_element_access_is_fatal() {
        var access = new ArrayAccessExpr(
                new VarExpr("a", Pos.NONE),
                ArgumentList.bracketed(List.of(outVar("x")), Pos.NONE),
                Pos.NONE);

        var ex = assertThrows(UnexpectedSyntaxException.class, () -> find(access));
        assertEquals(SyntaxKind.ELEMENT_ACCESS_EXPRESSION, ex.unexpectedKind());
    }

    @Test
    void out_declaration_without_argument_parent_is_fatal() {
        var orphan = new DeclarationExpr(new NamedTypeRef("var", Pos.NONE), Identifier.of("x"), Pos.NONE);
        var ex = assertThrows(UnexpectedSyntaxException.class, () -> find(orphan));
        assertNull(ex.unexpectedKind());

        var parenthesized = new ParenExpr(
                new DeclarationExpr(new NamedTypeRef("var", Pos.NONE), Identifier.of("y"), Pos.NONE), Pos.NONE);
        var ex2 = assertThrows(UnexpectedSyntaxException.class, () -> find(parenthesized));
        assertEquals(SyntaxKind.PARENTHESIZED_EXPRESSION, ex2.unexpectedKind());
    }

    @Test
    void argument_list_without_owner_is_fatal() {
        var args = ArgumentList.parenthesized(List.of(outVar("x")), Pos.NONE);
        var ex = assertThrows(UnexpectedSyntaxException.class, () -> find(args));
        assertNull(ex.unexpectedKind());
    }

    @Test
    void finder_is_reusable_after_failure() {
        var bad = new ArrayAccessExpr(
                new VarExpr("a", Pos.NONE),
                ArgumentList.bracketed(List.of(outVar("x")), Pos.NONE),
                Pos.NONE);
        for (int i = 0; i < 20; i++) {
            assertThrows(UnexpectedSyntaxException.class, () -> find(bad));
        }
        assertEquals(List.of("ok"), names(find(expr("F(out var ok)"))));
    }

    private static Argument outVar(String name) {
        return new Argument(Argument.RefKind.OUT,
                new DeclarationExpr(new NamedTypeRef("var", Pos.NONE), Identifier.of(name), Pos.NONE),
                Pos.NONE);
    }

    // ---------- purity ----------

    @Test
    void same_input_gives_same_output() {
        Expr e = expr("F(out var a, o is int b) && x is string c");
        assertEquals(find(e), find(e));
    }

    @Test
    void tree_is_not_modified() {
        CallExpr call = (CallExpr) expr("F(out var a)");
        var before = call.args().arguments().get(0).expr().parent();
        find(call);
        assertSame(before, call.args().arguments().get(0).expr().parent());
        assertNull(call.parent());
    }

    // ---------- factory interaction ----------

    @Test
    void factory_is_called_in_encounter_order() {
        Expr e = expr("o is int x && F(out var y)");
        Scope enclosing = new Scope(null, null, null);

        findExpressionVariables(factory, scope, new ArrayList<>(), e, enclosing);

        InOrder order = inOrder(factory);
        order.verify(factory).makePatternVariable(eq(scope), any(), eq(new Identifier("x", new Pos(1, 10))));
        order.verify(factory).makeOutVariable(eq(scope), eq(enclosing), any(),
                eq(new Identifier("y", new Pos(1, 25))), any(CallExpr.class));
        order.verifyNoMoreInteractions();
    }

    @Test
    void factory_sees_null_enclosing_scope_when_none_given() {
        findExpressionVariables(factory, scope, new ArrayList<>(), expr("F(out int y)"), null);
        verify(factory).makeOutVariable(eq(scope), isNull(), any(), any(), any());
    }

    @Test
    void factory_untouched_for_closures_only() {
        findExpressionVariables(factory, scope, new ArrayList<>(), expr("F(x => G(out var y), delegate { o is int z; })"), null);
        verifyNoInteractions(factory);
    }
}
