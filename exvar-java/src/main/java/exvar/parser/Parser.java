package exvar.parser;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.Program;
import exvar.ast.SyntaxNode;
import exvar.ast.decl.ClassDecl;
import exvar.ast.decl.ConstructorDecl;
import exvar.ast.decl.ConstructorInitializer;
import exvar.ast.decl.FieldDecl;
import exvar.ast.decl.MemberDecl;
import exvar.ast.decl.MethodDecl;
import exvar.ast.decl.Parameter;
import exvar.ast.expr.*;
import exvar.ast.pattern.ConstantPattern;
import exvar.ast.pattern.DeclarationPattern;
import exvar.ast.pattern.Pattern;
import exvar.ast.pattern.RecursivePattern;
import exvar.ast.pattern.TypePattern;
import exvar.ast.query.FromClause;
import exvar.ast.query.GroupClause;
import exvar.ast.query.JoinClause;
import exvar.ast.query.LetClause;
import exvar.ast.query.OrderByClause;
import exvar.ast.query.QueryBody;
import exvar.ast.query.QueryClause;
import exvar.ast.query.QueryContinuation;
import exvar.ast.query.SelectClause;
import exvar.ast.query.WhereClause;
import exvar.ast.stmt.*;
import exvar.ast.type.ArrayTypeRef;
import exvar.ast.type.NamedTypeRef;
import exvar.ast.type.PrimitiveTypeRef;
import exvar.ast.type.TypeRef;
import exvar.lexer.Token;
import exvar.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

public final class Parser {
    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<ClassDecl> classes = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            if (match(TokenType.CLASS)) classes.add(parseClassDecl());
            else throw error(peek(), "Expected 'class' at top-level");
        }
        return new Program(classes);
    }

    public Expr parseStandaloneExpr() {
        Expr e = parseExpr();
        if (!check(TokenType.EOF)) throw error(peek(), "Expected end of expression");
        return e;
    }

    // ---------- class ----------
    private ClassDecl parseClassDecl() {
        Pos start = previous().pos();
        Identifier className = identifier("Expected class name");

        TypeRef baseType = null;
        if (match(TokenType.COLON)) baseType = parseTypeRef();

        consume(TokenType.LBRACE, "Expected '{' after class name");

        List<MemberDecl> members = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            // constructor: ClassName(params) [: this(...) | : base(...)] { ... }
            if (check(TokenType.IDENTIFIER)
                    && peek().lexeme().equals(className.text())
                    && checkNext(TokenType.LPAREN)) {
                members.add(parseConstructorDecl());
                continue;
            }

            Pos memberStart = peek().pos();
            TypeRef type = parseTypeRef();
            Identifier name = identifier("Expected field or method name");

            // method: Type Name(params) { ... }
            if (check(TokenType.LPAREN)) {
                List<Parameter> params = parseParams();
                BlockStmt body = parseBlock();
                members.add(new MethodDecl(type, name, params, body, memberStart));
                continue;
            }

            // field: Type Name [= init];
            Expr init = match(TokenType.ASSIGN) ? parseExpr() : null;
            consume(TokenType.SEMICOLON, "Expected ';' after field declaration");
            members.add(new FieldDecl(type, name, init, memberStart));
        }

        consume(TokenType.RBRACE, "Expected '}' after class body");
        return new ClassDecl(className, baseType, members, start);
    }

    private ConstructorDecl parseConstructorDecl() {
        Pos start = peek().pos();
        Identifier name = identifier("Expected constructor name");
        List<Parameter> params = parseParams();

        ConstructorInitializer init = null;
        if (match(TokenType.COLON)) {
            Pos initPos = peek().pos();
            if (match(TokenType.THIS)) {
                init = ConstructorInitializer.ofThis(parseArgumentList(), initPos);
            } else if (match(TokenType.BASE)) {
                init = ConstructorInitializer.ofBase(parseArgumentList(), initPos);
            } else {
                throw error(peek(), "Expected 'this' or 'base' in constructor initializer");
            }
        }

        BlockStmt body = parseBlock();
        return new ConstructorDecl(name, params, init, body, start);
    }

    private List<Parameter> parseParams() {
        consume(TokenType.LPAREN, "Expected '('");
        List<Parameter> ps = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                Pos p = peek().pos();
                TypeRef t = parseTypeRef();
                ps.add(new Parameter(t, identifier("Expected parameter name"), p));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        return ps;
    }

    // ---------- block / statements ----------
    private BlockStmt parseBlock() {
        Pos start = consume(TokenType.LBRACE, "Expected '{'").pos();
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            stmts.add(parseStmt());
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new BlockStmt(stmts, start);
    }

    private Stmt parseStmt() {
        if (check(TokenType.LBRACE)) return parseBlock();

        Pos start = peek().pos();
        if (match(TokenType.IF)) return parseIf(start);
        if (match(TokenType.WHILE)) return parseWhile(start);
        if (match(TokenType.DO)) return parseDo(start);
        if (match(TokenType.FOR)) return parseFor(start);
        if (match(TokenType.LOCK)) return parseLock(start);
        if (match(TokenType.SWITCH)) return parseSwitch(start);
        if (match(TokenType.RETURN)) return parseReturn(start);
        if (match(TokenType.BREAK)) {
            consume(TokenType.SEMICOLON, "Expected ';' after break");
            return new BreakStmt(start);
        }

        // varDecl: Type IDENTIFIER ('=' | ';' | ',')
        if (isDeclarationStart()) {
            VarDeclStmt v = parseVarDeclNoSemicolon();
            consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
            return v;
        }

        // expr stmt
        Expr e = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExprStmt(e, start);
    }

    private VarDeclStmt parseVarDeclNoSemicolon() {
        Pos start = peek().pos();
        TypeRef type = parseTypeRef();

        List<VarDeclStmt.Declarator> declarators = new ArrayList<>();
        do {
            Pos p = peek().pos();
            Identifier name = identifier("Expected variable name");
            Expr init = match(TokenType.ASSIGN) ? parseExpr() : null;
            declarators.add(new VarDeclStmt.Declarator(name, init, p));
        } while (match(TokenType.COMMA));

        return new VarDeclStmt(type, declarators, start);
    }

    private IfStmt parseIf(Pos start) {
        Expr cond = parseParenthesizedCondition("if");
        Stmt thenS = parseStmt();
        Stmt elseS = match(TokenType.ELSE) ? parseStmt() : null;
        return new IfStmt(cond, thenS, elseS, start);
    }

    private WhileStmt parseWhile(Pos start) {
        Expr cond = parseParenthesizedCondition("while");
        return new WhileStmt(cond, parseStmt(), start);
    }

    private DoStmt parseDo(Pos start) {
        Stmt body = parseStmt();
        consume(TokenType.WHILE, "Expected 'while' after do body");
        Expr cond = parseParenthesizedCondition("while");
        consume(TokenType.SEMICOLON, "Expected ';' after do-while");
        return new DoStmt(body, cond, start);
    }

    private LockStmt parseLock(Pos start) {
        Expr e = parseParenthesizedCondition("lock");
        return new LockStmt(e, parseStmt(), start);
    }

    private Expr parseParenthesizedCondition(String keyword) {
        consume(TokenType.LPAREN, "Expected '(' after " + keyword);
        Expr e = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        return e;
    }

    private ForStmt parseFor(Pos start) {
        consume(TokenType.LPAREN, "Expected '(' after for");

        Stmt init = null;
        if (!check(TokenType.SEMICOLON)) {
            if (isDeclarationStart()) {
                init = parseVarDeclNoSemicolon();
            } else {
                Pos p = peek().pos();
                init = new ExprStmt(parseExpr(), p);
            }
        }
        consume(TokenType.SEMICOLON, "Expected ';' after for-init");

        Expr cond = check(TokenType.SEMICOLON) ? null : parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after for-condition");

        List<Expr> updates = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do { updates.add(parseExpr()); } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after for");

        return new ForStmt(init, cond, updates, parseStmt(), start);
    }

    private SwitchStmt parseSwitch(Pos start) {
        Expr subject = parseParenthesizedCondition("switch");
        consume(TokenType.LBRACE, "Expected '{' after switch");

        List<SwitchSection> sections = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            Pos sectionStart = peek().pos();
            List<SwitchLabel> labels = new ArrayList<>();
            while (check(TokenType.CASE) || check(TokenType.DEFAULT)) {
                labels.add(parseSwitchLabel());
            }
            if (labels.isEmpty()) throw error(peek(), "Expected 'case' or 'default'");

            List<Stmt> stmts = new ArrayList<>();
            while (!check(TokenType.CASE) && !check(TokenType.DEFAULT)
                    && !check(TokenType.RBRACE) && !check(TokenType.EOF)) {
                stmts.add(parseStmt());
            }
            sections.add(new SwitchSection(labels, stmts, sectionStart));
        }

        consume(TokenType.RBRACE, "Expected '}' after switch body");
        return new SwitchStmt(subject, sections, start);
    }

    private SwitchLabel parseSwitchLabel() {
        Pos start = peek().pos();
        if (match(TokenType.DEFAULT)) {
            consume(TokenType.COLON, "Expected ':' after default");
            return new DefaultLabel(start);
        }
        consume(TokenType.CASE, "Expected 'case'");

        if (isPatternStart()) {
            Pattern pattern = parsePattern();
            Expr when = parseWhenOpt();
            consume(TokenType.COLON, "Expected ':' after case pattern");
            return new PatternCaseLabel(pattern, when, start);
        }

        // case CONST: stays a constant label unless a guard turns it into a pattern
        Expr value = parseExpr();
        Expr when = parseWhenOpt();
        consume(TokenType.COLON, "Expected ':' after case value");
        if (when == null) return new CaseLabel(value, start);
        return new PatternCaseLabel(new ConstantPattern(value, value.pos()), when, start);
    }

    private Expr parseWhenOpt() {
        if (peek().isContextual("when")) {
            advance();
            return parseExpr();
        }
        return null;
    }

    private ReturnStmt parseReturn(Pos start) {
        if (match(TokenType.SEMICOLON)) {
            return new ReturnStmt(null, start);
        }
        Expr value = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(value, start);
    }

    // ---------- types ----------
    private TypeRef parseTypeRef() {
        Token t = peek();
        TypeRef base;
        if (isPredefinedType(t.type())) {
            advance();
            base = new PrimitiveTypeRef(t.lexeme(), t.pos());
        } else {
            Token n = consume(TokenType.IDENTIFIER, "Expected type name");
            base = new NamedTypeRef(n.lexeme(), n.pos());
        }

        // array suffix: []
        while (check(TokenType.LBRACKET) && checkNext(TokenType.RBRACKET)) {
            advance();
            advance();
            base = new ArrayTypeRef(base, t.pos());
        }
        return base;
    }

    private int scanType(int i) {
        TokenType t = typeAt(i);
        if (!isPredefinedType(t) && t != TokenType.IDENTIFIER) return -1;
        i++;
        while (typeAt(i) == TokenType.LBRACKET && typeAt(i + 1) == TokenType.RBRACKET) i += 2;
        return i;
    }

    private boolean isDeclarationStart() {
        int i = scanType(pos);
        if (i < 0 || typeAt(i) != TokenType.IDENTIFIER) return false;
        TokenType after = typeAt(i + 1);
        return after == TokenType.ASSIGN || after == TokenType.SEMICOLON || after == TokenType.COMMA;
    }

    private static boolean isPredefinedType(TokenType t) {
        return switch (t) {
            case INT, DOUBLE, BOOL, STRING, OBJECT, VOID -> true;
            default -> false;
        };
    }

    // ---------- patterns ----------
    private boolean isPatternStart() {
        if (check(TokenType.LPAREN)) return true;
        int i = scanType(pos);
        if (i < 0) return false;
        if (typeAt(i) == TokenType.IDENTIFIER && !tokens.get(i).isContextual("when")) return true;
        if (typeAt(i) == TokenType.LPAREN) return true;
        return isPredefinedType(typeAt(pos)) || i > pos + 1; // int, string[], Foo[]
    }

    private Pattern parsePattern() {
        Pos start = peek().pos();

        // (p, q)
        if (check(TokenType.LPAREN)) {
            return new RecursivePattern(null, parseSubpatterns(), start);
        }

        if (isPatternStart()) {
            TypeRef type = parseTypeRef();
            if (check(TokenType.IDENTIFIER) && !peek().isContextual("when")) {
                return new DeclarationPattern(type, identifier("Expected designation"), start);
            }
            if (check(TokenType.LPAREN)) {
                return new RecursivePattern(type, parseSubpatterns(), start);
            }
            return new TypePattern(type, start);
        }

        return new ConstantPattern(parseAdd(), start);
    }

    private List<Pattern> parseSubpatterns() {
        consume(TokenType.LPAREN, "Expected '('");
        List<Pattern> subs = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do { subs.add(parsePattern()); } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after subpatterns");
        return subs;
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseAssign(); }

    private Expr parseAssign() {
        if (isLambdaStart()) return parseLambda();

        Expr left = parseCoalesce();
        if (match(TokenType.ASSIGN)) {
            Token op = previous();
            Expr right = parseAssign(); // right-assoc

            if (!(left instanceof VarExpr
                    || left instanceof FieldAccessExpr
                    || left instanceof ArrayAccessExpr)) {
                throw error(op, "Invalid assignment target");
            }
            return new AssignExpr(left, right, left.pos());
        }
        return left;
    }

    private Expr parseCoalesce() {
        Expr e = parseOr();
        if (match(TokenType.COALESCE)) {
            Expr r = parseCoalesce(); // right-assoc
            return new BinaryExpr(e, BinaryExpr.Operator.COALESCE, r, e.pos());
        }
        return e;
    }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r, e.pos());
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseEquality();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseEquality();
            e = new BinaryExpr(e, toBinOp(op.type()), r, e.pos());
        }
        return e;
    }

    private Expr parseEquality() {
        Expr e = parseRelational();
        while (match(TokenType.EQ, TokenType.NEQ)) {
            Token op = previous();
            Expr r = parseRelational();
            e = new BinaryExpr(e, toBinOp(op.type()), r, e.pos());
        }
        return e;
    }

    private Expr parseRelational() {
        Expr e = parseAdd();
        while (true) {
            if (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE)) {
                Token op = previous();
                Expr r = parseAdd();
                e = new BinaryExpr(e, toBinOp(op.type()), r, e.pos());
                continue;
            }
            if (match(TokenType.IS)) {
                e = new IsPatternExpr(e, parsePattern(), e.pos());
                continue;
            }
            break;
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r, e.pos());
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r, e.pos());
        }
        return e;
    }

    private Expr parseUnary() {
        Pos start = peek().pos();
        if (match(TokenType.NOT)) {
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary(), start);
        }
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary(), start);
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if (check(TokenType.LPAREN)) {
                e = new CallExpr(e, parseArgumentList(), e.pos());
                continue;
            }
            if (check(TokenType.LBRACKET)) {
                e = new ArrayAccessExpr(e, parseBracketedArgumentList(), e.pos());
                continue;
            }
            if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expected member name after '.'");
                e = new FieldAccessExpr(e, name.lexeme(), e.pos());
                continue;
            }
            break;
        }
        return e;
    }

    private Expr parsePrimary() {
        Token t = peek();
        Pos start = t.pos();

        if (match(TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL)) return new NumberLiteral(t.lexeme(), start);
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(t.lexeme(), start);
        if (match(TokenType.TRUE)) return new BoolLiteral(true, start);
        if (match(TokenType.FALSE)) return new BoolLiteral(false, start);
        if (match(TokenType.NULL)) return new NullLiteral(start);
        if (match(TokenType.THIS)) return new ThisExpr(start);

        if (match(TokenType.NEW)) {
            TypeRef type = parseTypeRef();
            return new NewExpr(type, parseArgumentList(), start);
        }
        if (match(TokenType.DELEGATE)) {
            List<Parameter> params = check(TokenType.LPAREN) ? parseParams() : null;
            return new AnonymousMethodExpr(params, parseBlock(), start);
        }
        if (isQueryStart()) return parseQuery();

        if (match(TokenType.IDENTIFIER)) return new VarExpr(t.lexeme(), start);
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return new ParenExpr(e, start);
        }
        throw error(t, "Expected expression");
    }

    // ---------- arguments ----------
    private ArgumentList parseArgumentList() {
        Pos start = consume(TokenType.LPAREN, "Expected '('").pos();
        List<Argument> args = parseArguments(TokenType.RPAREN, false);
        consume(TokenType.RPAREN, "Expected ')'");
        return ArgumentList.parenthesized(args, start);
    }

    private ArgumentList parseBracketedArgumentList() {
        Pos start = consume(TokenType.LBRACKET, "Expected '['").pos();
        List<Argument> args = parseArguments(TokenType.RBRACKET, true);
        consume(TokenType.RBRACKET, "Expected ']'");
        return ArgumentList.bracketed(args, start);
    }

    private List<Argument> parseArguments(TokenType close, boolean bracketed) {
        List<Argument> args = new ArrayList<>();
        if (check(close)) return args;
        do {
            Pos start = peek().pos();
            if (match(TokenType.OUT)) {
                if (isOutDeclaration()) {
                    if (bracketed) {
                        throw error(previous(), "Out variable declarations are only allowed in call and creation arguments");
                    }
                    Pos declStart = peek().pos();
                    TypeRef type = parseTypeRef();
                    Identifier name = identifier("Expected out variable name");
                    args.add(new Argument(Argument.RefKind.OUT, new DeclarationExpr(type, name, declStart), start));
                } else {
                    args.add(new Argument(Argument.RefKind.OUT, parseExpr(), start));
                }
            } else if (match(TokenType.REF)) {
                args.add(new Argument(Argument.RefKind.REF, parseExpr(), start));
            } else {
                args.add(new Argument(Argument.RefKind.NONE, parseExpr(), start));
            }
        } while (match(TokenType.COMMA));
        return args;
    }

    private boolean isOutDeclaration() {
        int i = scanType(pos);
        if (i < 0 || typeAt(i) != TokenType.IDENTIFIER) return false;
        TokenType after = typeAt(i + 1);
        return after == TokenType.COMMA || after == TokenType.RPAREN || after == TokenType.RBRACKET;
    }

    // ---------- lambdas ----------
    private boolean isLambdaStart() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ARROW)) return true;
        if (!check(TokenType.LPAREN)) return false;

        int depth = 0;
        for (int i = pos; i < tokens.size(); i++) {
            TokenType t = tokens.get(i).type();
            if (t == TokenType.LPAREN) depth++;
            else if (t == TokenType.RPAREN && --depth == 0) return typeAt(i + 1) == TokenType.ARROW;
            else if (t == TokenType.EOF || t == TokenType.SEMICOLON || t == TokenType.LBRACE) return false;
        }
        return false;
    }

    private Expr parseLambda() {
        Pos start = peek().pos();
        if (check(TokenType.IDENTIFIER)) {
            Identifier name = identifier("Expected lambda parameter");
            consume(TokenType.ARROW, "Expected '=>'");
            return new SimpleLambdaExpr(new Parameter(null, name, name.pos()), parseLambdaBody(), start);
        }

        consume(TokenType.LPAREN, "Expected '('");
        List<Parameter> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                Pos p = peek().pos();
                int i = scanType(pos);
                TypeRef type = (i >= 0 && typeAt(i) == TokenType.IDENTIFIER) ? parseTypeRef() : null;
                params.add(new Parameter(type, identifier("Expected lambda parameter"), p));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after lambda parameters");
        consume(TokenType.ARROW, "Expected '=>'");
        return new LambdaExpr(params, parseLambdaBody(), start);
    }

    private SyntaxNode parseLambdaBody() {
        return check(TokenType.LBRACE) ? parseBlock() : parseExpr();
    }

    // ---------- queries ----------
    private boolean isQueryStart() {
        return peek().isContextual("from")
                && typeAt(pos + 1) == TokenType.IDENTIFIER
                && typeAt(pos + 2) == TokenType.IN;
    }

    private QueryExpr parseQuery() {
        Pos start = peek().pos();
        FromClause from = parseFromClause();
        return new QueryExpr(from, parseQueryBody(), start);
    }

    private FromClause parseFromClause() {
        Pos start = advance().pos(); // from
        Identifier name = identifier("Expected range variable");
        consume(TokenType.IN, "Expected 'in'");
        return new FromClause(name, parseExpr(), start);
    }

    private QueryBody parseQueryBody() {
        Pos start = peek().pos();
        List<QueryClause> clauses = new ArrayList<>();
        while (true) {
            Token t = peek();
            if (t.isContextual("from")) {
                clauses.add(parseFromClause());
            } else if (t.isContextual("join")) {
                advance();
                Identifier name = identifier("Expected join variable");
                consume(TokenType.IN, "Expected 'in'");
                Expr in = parseExpr();
                contextual("on");
                Expr left = parseExpr();
                contextual("equals");
                Expr right = parseExpr();
                clauses.add(new JoinClause(name, in, left, right, t.pos()));
            } else if (t.isContextual("where")) {
                advance();
                clauses.add(new WhereClause(parseExpr(), t.pos()));
            } else if (t.isContextual("let")) {
                advance();
                Identifier name = identifier("Expected let variable");
                consume(TokenType.ASSIGN, "Expected '=' in let clause");
                clauses.add(new LetClause(name, parseExpr(), t.pos()));
            } else if (t.isContextual("orderby")) {
                advance();
                clauses.add(new OrderByClause(parseExpr(), t.pos()));
            } else {
                break;
            }
        }

        Token t = peek();
        QueryClause selectOrGroup;
        if (t.isContextual("select")) {
            advance();
            selectOrGroup = new SelectClause(parseExpr(), t.pos());
        } else if (t.isContextual("group")) {
            advance();
            Expr element = parseExpr();
            contextual("by");
            selectOrGroup = new GroupClause(element, parseExpr(), t.pos());
        } else {
            throw error(t, "Expected 'select' or 'group' at end of query");
        }

        QueryContinuation continuation = null;
        if (peek().isContextual("into")) {
            Pos intoPos = advance().pos();
            Identifier name = identifier("Expected continuation name");
            continuation = new QueryContinuation(name, parseQueryBody(), intoPos);
        }
        return new QueryBody(clauses, selectOrGroup, continuation, start);
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private void contextual(String word) {
        if (!peek().isContextual(word)) throw error(peek(), "Expected '" + word + "'");
        advance();
    }

    private Identifier identifier(String msg) {
        Token t = consume(TokenType.IDENTIFIER, msg);
        return new Identifier(t.lexeme(), t.pos());
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        return typeAt(pos + 1) == t;
    }

    private TokenType typeAt(int i) {
        if (i >= tokens.size()) return TokenType.EOF;
        return tokens.get(i).type();
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParserException error(Token at, String msg) {
        return new ParserException("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " '" + at.lexeme() + "')");
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            case AND -> BinaryExpr.Operator.AND;
            case OR  -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }

}
