package exvar.cli;

import exvar.lexer.Lexer;
import exvar.lexer.LexerException;
import exvar.parser.Parser;
import exvar.parser.ParserException;
import exvar.sema.LocalScopeBinder;
import exvar.sema.LocalSymbol;
import exvar.sema.Scope;
import exvar.sema.SemanticException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Main {
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: exvar <input-file>");
            return 2;
        }

        Path input = Path.of(args[0]);
        try {
            // 1. Чтение
            String source = Files.readString(input);
            out.println("[1/4] Reading: " + input);

            // 2. Лексер
            var tokens = new Lexer(source).tokenize();
            out.println("[2/4] Lexer: " + tokens.size() + " tokens");

            // 3. Парсер
            var program = new Parser(tokens).parseProgram();
            out.println("[3/4] Parser: " + program.classes().size() + " classes");

            // 4. Области видимости
            var result = new LocalScopeBinder().bind(program);
            out.println("[4/4] Binder: " + result.scopes().size() + " scopes");

            int locals = 0;
            for (Scope scope : result.scopes().values()) {
                for (LocalSymbol local : scope.locals()) {
                    out.println(scope.containingMember() + "  [" + scope.syntax() + "]  " + local);
                    locals++;
                }
            }

            out.println("\n✓ Success: " + input);
            out.println("  Locals: " + locals);
            return 0;
        } catch (IOException e) {
            err.println("Cannot read " + input + ": " + e.getMessage());
            return 1;
        } catch (LexerException | ParserException | SemanticException e) {
            err.println("error: " + e.getMessage());
            return 1;
        }
    }
}
