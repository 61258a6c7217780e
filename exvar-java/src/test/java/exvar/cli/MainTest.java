package exvar.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String src) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, src);
        return file;
    }

    @Test
    void prints_locals_of_every_scope() throws IOException {
        Path file = write("ok.cs", """
                class C {
                    void M(int p) {
                        if (F(out var y) && o is string s) { }
                    }
                }
                """);

        assertEquals(0, run(file.toString()));

        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("[3/4] Parser: 1 classes"));
        assertTrue(text.contains("method C.M  [METHOD_DECLARATION@2:5]  p : int (PARAMETER)"));
        assertTrue(text.contains("y : var (OUT_VARIABLE)"));
        assertTrue(text.contains("s : string (PATTERN_VARIABLE)"));
        assertTrue(text.contains("Locals: 3"));
    }

    @Test
    void usage_error_exits_with_2() {
        assertEquals(2, run());
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
    }

    @Test
    void syntax_error_exits_with_1() throws IOException {
        Path file = write("bad.cs", "class C { void M() { F(; } }");
        assertEquals(1, run(file.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("error: [1:"));
    }

    @Test
    void duplicate_local_exits_with_1() throws IOException {
        Path file = write("dup.cs", "class C { void M() { int x = 1; F(out var x); } }");
        assertEquals(1, run(file.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Duplicate symbol: x"));
    }

    @Test
    void missing_file_exits_with_1() {
        assertEquals(1, run(dir.resolve("absent.cs").toString()));
    }
}
