package exvar.ast;

import exvar.ast.expr.Argument;
import exvar.ast.expr.ArgumentList;
import exvar.ast.expr.BinaryExpr;
import exvar.ast.expr.CallExpr;
import exvar.ast.expr.VarExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxNodeTest {

    @Test
    void constructor_adopts_children() {
        var a = new VarExpr("a", new Pos(1, 1));
        var b = new VarExpr("b", new Pos(1, 5));
        var sum = new BinaryExpr(a, BinaryExpr.Operator.ADD, b, new Pos(1, 1));

        assertSame(sum, a.parent());
        assertSame(sum, b.parent());
        assertNull(sum.parent());
        assertEquals(List.of(a, b), sum.children());
    }

    @Test
    void nested_lists_are_adopted() {
        var x = new VarExpr("x", Pos.NONE);
        var arg = Argument.of(x);
        var args = ArgumentList.parenthesized(List.of(arg), Pos.NONE);
        var call = new CallExpr(new VarExpr("F", Pos.NONE), args, Pos.NONE);

        assertSame(arg, x.parent());
        assertSame(args, arg.parent());
        assertSame(call, args.parent());
    }

    @Test
    void node_cannot_get_a_second_parent() {
        var shared = new VarExpr("s", new Pos(2, 3));
        new BinaryExpr(shared, BinaryExpr.Operator.ADD, new VarExpr("t", Pos.NONE), Pos.NONE);

        var ex = assertThrows(IllegalArgumentException.class,
                () -> new BinaryExpr(new VarExpr("u", Pos.NONE), BinaryExpr.Operator.SUB, shared, Pos.NONE));
        assertTrue(ex.getMessage().startsWith("IDENTIFIER_NAME@2:3 already belongs to BINARY_EXPRESSION"));
    }

    @Test
    void to_string_is_kind_and_position() {
        assertEquals("IDENTIFIER_NAME@4:7", new VarExpr("v", new Pos(4, 7)).toString());
    }
}
