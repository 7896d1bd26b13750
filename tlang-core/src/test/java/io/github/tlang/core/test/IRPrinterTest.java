package io.github.tlang.core.test;

import io.github.tlang.core.ir.IRBuilder;
import io.github.tlang.core.ir.StmtList;
import io.github.tlang.core.ir.expr.IdExpr;
import io.github.tlang.core.passes.Passes;
import io.github.tlang.core.passes.display.IRPrinter;
import io.github.tlang.core.passes.form.LowerAST;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class IRPrinterTest {
    private static final String LOWERED_DEMO = String.join("\n",
            "f32 alloca a",
            "f32 alloca b",
            "i32 alloca p",
            "i32 alloca q",
            "$0 = load a",
            "$1 = load b",
            "unknown $2 = add $0 $1",
            "[store] a = $2",
            "$3 = load p",
            "$4 = load q",
            "unknown $5 = add $3 $4",
            "[store] p = $5",
            "$6 = load a",
            "unknown print $6",
            "$7 = load a",
            "i32 $8 = const 500",
            "unknown $9 = cmp_lt $7 $8",
            "if $9 {",
            "  $10 = load b",
            "  unknown print $10",
            "} else {",
            "  $11 = load a",
            "  unknown print $11",
            "}",
            "$12 = load a",
            "i32 $13 = const 5",
            "unknown $14 = cmp_gt $12 $13",
            "if $14 {",
            "  $15 = load b",
            "  i32 $16 = const 1",
            "  unknown $17 = add $15 $16",
            "  i32 $18 = const 3",
            "  unknown $19 = div $17 $18",
            "  [store] b = $19",
            "  $20 = load b",
            "  i32 $21 = const 3",
            "  unknown $22 = mul $20 $21",
            "  [store] b = $22",
            "} else {",
            "  $23 = load b",
            "  i32 $24 = const 2",
            "  unknown $25 = add $23 $24",
            "  [store] b = $25",
            "  $26 = load b",
            "  i32 $27 = const 4",
            "  unknown $28 = sub $26 $27",
            "  [store] b = $28",
            "}",
            "for i in range(0, 100) {",
            "  for j in range(0, 200) {",
            "    $29 = load i",
            "    $30 = load j",
            "    unknown $31 = add $29 $30",
            "    unknown print $31",
            "  }",
            "}",
            "$32 = load b",
            "unknown print $32",
            "");

    @Test
    void testLoweredDemo() {
        StmtList root = Utils.demoProgram();
        LowerAST.run(root);
        assertEquals(LOWERED_DEMO, IRPrinter.print(root));
    }

    @Test
    void testPrintingIsStable() {
        StmtList root = Utils.demoProgram();
        LowerAST.run(root);
        assertEquals(IRPrinter.print(root), IRPrinter.print(root));
    }

    @Test
    void testTypedDemo() {
        StmtList root = Utils.demoProgram();
        Passes.FULL.run(root);
        String printed = IRPrinter.print(root);

        assertTrue(printed.contains("\nf32 $2 = add $0 $1\n"), printed);
        assertTrue(printed.contains("\ni32 $5 = add $3 $4\n"), printed);
        assertTrue(printed.contains("\nf32 print $6\n"), printed);
        assertTrue(printed.contains("\ni32 $9 = cmp_lt $7 $8\n"), printed);
        assertTrue(printed.contains("\n  f32 print $10\n"), printed);
        assertTrue(printed.contains("\n  f32 $17 = add $15 $16\n"), printed);
        assertTrue(printed.contains("\n    i32 print $31\n"), printed);
        assertTrue(printed.endsWith("\nf32 print $32\n"), printed);
        assertFalse(printed.contains("unknown"), printed);
    }

    @Test
    void testFrontendStatements() {
        IdExpr a = IdExpr.declare("a");
        IdExpr b = IdExpr.declare("b");
        IdExpr i = IdExpr.declare("i");
        StmtList root = IRBuilder.build(ib -> {
            ib.assign(a, a.add(b));
            ib.ifThen(a.lt(500), t -> t.print(b));
            ib.forRange(i, 0, 100, body ->
                    body.assign(b, b.add(1).div(3)));
        });
        assertEquals(String.join("\n",
                        "a = (a + b)",
                        "if (a < 500) {",
                        "  print b",
                        "}",
                        "for i in range(0, 100) {",
                        "  b = ((b + 1) / 3)",
                        "}",
                        ""),
                IRPrinter.print(root));
    }

    @Test
    void testDebugPrintPass() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        StmtList root = Utils.demoProgram();
        LowerAST.INSTANCE.then(IRPrinter.debugPrint(ps)).run(root);
        assertEquals(LOWERED_DEMO, baos.toString(StandardCharsets.UTF_8));
    }
}
