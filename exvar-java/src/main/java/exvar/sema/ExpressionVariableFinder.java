package exvar.sema;

import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.BinaryExpr;
import exvar.ast.expr.DeclarationExpr;
import exvar.ast.expr.Expr;
import exvar.ast.expr.QueryExpr;
import exvar.ast.pattern.DeclarationPattern;
import exvar.ast.query.JoinClause;
import exvar.ast.query.QueryBody;
import exvar.ast.query.QueryClause;
import exvar.ast.stmt.DoStmt;
import exvar.ast.stmt.IfStmt;
import exvar.ast.stmt.LockStmt;
import exvar.ast.stmt.PatternCaseLabel;
import exvar.ast.stmt.SwitchLabel;
import exvar.ast.stmt.SwitchSection;
import exvar.ast.stmt.SwitchStmt;
import exvar.ast.stmt.VarDeclStmt;
import exvar.ast.stmt.WhileStmt;
import exvar.util.ObjectPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Collects variables declared inside expressions: pattern variables ({@code o is string s})
 * and out variables ({@code F(out var x)}). Only the parts of a statement whose
 * declarations belong to the scope being built are visited; lambda and anonymous
 * method bodies are skipped, their variables are found when the closure itself is bound.
 */
public final class ExpressionVariableFinder {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionVariableFinder.class);

    private static final ObjectPool<ExpressionVariableFinder> POOL = new ObjectPool<>(ExpressionVariableFinder::new);

    private SymbolFactory factory;
    private Scope scope;
    private Scope enclosingScope;
    private List<LocalSymbol> builder;

    private ExpressionVariableFinder() {}

    // ---------- entry ----------

    public static void findExpressionVariables(Scope scope, List<LocalSymbol> builder, SyntaxNode node) {
        findExpressionVariables(LocalSymbolFactory.INSTANCE, scope, builder, node, null);
    }

    public static void findExpressionVariables(Scope scope, List<LocalSymbol> builder, SyntaxNode node,
                                               Scope enclosingScope) {
        findExpressionVariables(LocalSymbolFactory.INSTANCE, scope, builder, node, enclosingScope);
    }

    /**
     * Appends the expression variables declared in {@code node} to {@code builder}.
     *
     * @param enclosingScope passed through to out variables; may be {@code null}
     * @throws UnexpectedSyntaxException if an out variable declaration sits anywhere
     *                                   but in the arguments of a call, creation or constructor initializer
     */
    public static void findExpressionVariables(SymbolFactory factory, Scope scope, List<LocalSymbol> builder,
                                               SyntaxNode node, Scope enclosingScope) {
        if (node == null) return;

        ExpressionVariableFinder finder = POOL.allocate();
        finder.init(factory, scope, enclosingScope, builder);
        try {
            finder.visit(node);
        } finally {
            finder.clear();
            POOL.free(finder);
        }
    }

    public static void findExpressionVariables(Scope scope, List<LocalSymbol> builder, List<? extends Expr> nodes) {
        findExpressionVariables(LocalSymbolFactory.INSTANCE, scope, builder, nodes);
    }

    public static void findExpressionVariables(SymbolFactory factory, Scope scope, List<LocalSymbol> builder,
                                               List<? extends Expr> nodes) {
        if (nodes.isEmpty()) return;

        ExpressionVariableFinder finder = POOL.allocate();
        finder.init(factory, scope, null, builder);
        try {
            for (Expr n : nodes) finder.visit(n);
        } finally {
            finder.clear();
            POOL.free(finder);
        }
    }

    private void init(SymbolFactory factory, Scope scope, Scope enclosingScope, List<LocalSymbol> builder) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.enclosingScope = enclosingScope;
    }

    private void clear() {
        factory = null;
        scope = null;
        enclosingScope = null;
        builder = null;
    }

    // ---------- traversal ----------

    private void visit(SyntaxNode node) {
        if (node == null) return;

        switch (node.kind()) {
            case LOCAL_DECLARATION_STATEMENT -> {
                for (VarDeclStmt.Declarator d : ((VarDeclStmt) node).declarators()) {
                    visit(d.initializer());
                }
            }
            case WHILE_STATEMENT -> visit(((WhileStmt) node).condition());
            case DO_STATEMENT -> visit(((DoStmt) node).condition());
            case IF_STATEMENT -> visit(((IfStmt) node).condition());
            case LOCK_STATEMENT -> visit(((LockStmt) node).expr());
            case SWITCH_STATEMENT -> visit(((SwitchStmt) node).subject());
            case SWITCH_SECTION -> visitSwitchSection((SwitchSection) node);

            case DECLARATION_PATTERN -> visitDeclarationPattern((DeclarationPattern) node);
            case DECLARATION_EXPRESSION -> visitDeclarationExpression((DeclarationExpr) node);

            case PARENTHESIZED_LAMBDA_EXPRESSION, SIMPLE_LAMBDA_EXPRESSION, ANONYMOUS_METHOD_EXPRESSION -> {
                // closure body: bound later in its own scope
            }

            case QUERY_EXPRESSION -> {
                QueryExpr q = (QueryExpr) node;
                visit(q.from().source());
                visit(q.body());
            }
            case QUERY_BODY -> visitQueryBody((QueryBody) node);

            case BINARY_EXPRESSION -> visitBinary((BinaryExpr) node);

            default -> {
                for (SyntaxNode child : node.children()) visit(child);
            }
        }
    }

    private void visitSwitchSection(SwitchSection section) {
        for (SwitchLabel label : section.labels()) {
            if (label instanceof PatternCaseLabel match) {
                visit(match.pattern());
                if (match.whenCondition() != null) {
                    visit(match.whenCondition());
                }
            }
        }
    }

    private void visitQueryBody(QueryBody body) {
        // only join sources are evaluated in the enclosing scope; later from/let/where run per element
        for (QueryClause clause : body.clauses()) {
            if (clause.kind() == SyntaxKind.JOIN_CLAUSE) {
                visit(((JoinClause) clause).inExpr());
            }
        }
        visit(body.continuation());
    }

    private void visitBinary(BinaryExpr node) {
        // a + b + c + ... nests to the left; walk the left spine with an explicit stack
        Deque<Expr> operands = new ArrayDeque<>();
        Expr current = node;
        do {
            BinaryExpr binOp = (BinaryExpr) current;
            operands.push(binOp.right());
            current = binOp.left();
        } while (current.kind() == SyntaxKind.BINARY_EXPRESSION);

        visit(current);
        while (!operands.isEmpty()) {
            visit(operands.pop());
        }
    }

    // ---------- declarations ----------

    private void visitDeclarationPattern(DeclarationPattern node) {
        builder.add(factory.makePatternVariable(scope, node.type(), node.identifier()));
        logger.trace("pattern variable {} at {}", node.identifier(), node.identifier().pos());

        for (SyntaxNode child : node.children()) visit(child);
    }

    private void visitDeclarationExpression(DeclarationExpr node) {
        SyntaxNode argument = node.parent();
        if (argument == null || argument.kind() != SyntaxKind.ARGUMENT) {
            throw new UnexpectedSyntaxException(argument == null ? null : argument.kind(), node);
        }
        SyntaxNode argumentList = argument.parent();
        if (argumentList == null
                || (argumentList.kind() != SyntaxKind.ARGUMENT_LIST
                && argumentList.kind() != SyntaxKind.BRACKETED_ARGUMENT_LIST)) {
            throw new UnexpectedSyntaxException(argumentList == null ? null : argumentList.kind(), node);
        }
        SyntaxNode context = argumentList.parent();
        if (context == null) {
            throw new UnexpectedSyntaxException(null, node);
        }

        switch (context.kind()) {
            case INVOCATION_EXPRESSION, OBJECT_CREATION_EXPRESSION,
                    THIS_CONSTRUCTOR_INITIALIZER, BASE_CONSTRUCTOR_INITIALIZER -> {
                builder.add(factory.makeOutVariable(scope, enclosingScope, node.type(), node.identifier(), context));
                logger.trace("out variable {} at {}", node.identifier(), node.identifier().pos());
            }
            // the parser only accepts out declarations in the argument lists above
            default -> throw new UnexpectedSyntaxException(context.kind(), node);
        }
    }
}
