package io.github.tlang.core.test;

import io.github.tlang.core.ir.*;
import io.github.tlang.core.ir.expr.IdExpr;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public class Utils {
    /**
     * Builds the demo program:
     * <pre>
     * a = a + b
     * p = p + q
     * print(a)
     * if (a &lt; 500) print(b) else print(a)
     * if (a &gt; 5) { b = (b + 1) / 3; b = b * 3 } else { b = b + 2; b = b - 4 }
     * for i in [0, 100): for j in [0, 200): print(i + j)
     * print(b)
     * </pre>
     */
    @NotNull
    public static StmtList demoProgram() {
        IdExpr a = IdExpr.declare("a");
        IdExpr b = IdExpr.declare("b");
        IdExpr p = IdExpr.declare("p");
        IdExpr q = IdExpr.declare("q");
        IdExpr i = IdExpr.declare("i");
        IdExpr j = IdExpr.declare("j");

        return IRBuilder.build(ib -> {
            ib.alloca(DataType.F32, a);
            ib.alloca(DataType.F32, b);
            ib.alloca(DataType.I32, p);
            ib.alloca(DataType.I32, q);

            ib.assign(a, a.add(b));
            ib.assign(p, p.add(q));

            ib.print(a);
            ib.ifThen(a.lt(500), t -> t.print(b), f -> f.print(a));

            ib.ifThen(a.gt(5), t -> {
                t.assign(b, b.add(1).div(3));
                t.assign(b, b.mul(3));
            }, f -> {
                f.assign(b, b.add(2));
                f.assign(b, b.sub(4));
            });

            ib.forRange(i, 0, 100, outer ->
                    outer.forRange(j, 0, 200, inner ->
                            inner.print(i.add(j))));
            ib.print(b);
        });
    }

    /**
     * Collect every statement in a tree, in pre-order.
     */
    @NotNull
    public static List<Stmt> allStatements(StmtList root) {
        List<Stmt> out = new ArrayList<>();
        collect(root, out);
        return out;
    }

    private static void collect(StmtList block, List<Stmt> out) {
        for (Stmt stmt : block.statements()) {
            out.add(stmt);
            for (StmtList nested : stmt.blocks()) {
                collect(nested, out);
            }
        }
    }
}
