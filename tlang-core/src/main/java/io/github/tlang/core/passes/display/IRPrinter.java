package io.github.tlang.core.passes.display;

import io.github.tlang.core.ir.*;
import io.github.tlang.core.passes.InPlaceIRPass;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Prints a tree as indented text, one line per statement.
 * <p>
 * Statements are named {@code $0}, {@code $1}, ... in the order they are first
 * encountered, so printing the same tree always produces the same text.
 * The tree is never modified.
 */
public class IRPrinter extends IRVisitor<Void> {
    private final PrintStream out;
    private final Map<Stmt, String> names = new IdentityHashMap<>();
    private int currentIndent = -1;

    public IRPrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Print a tree to {@link System#err}.
     *
     * @param root The root of the tree.
     */
    public static void run(IRNode root) {
        root.accept(new IRPrinter(System.err));
    }

    /**
     * Print a tree to a string.
     *
     * @param root The root of the tree.
     * @return The printed tree.
     */
    public static String print(IRNode root) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        root.accept(new IRPrinter(ps));
        ps.flush();
        return baos.toString(StandardCharsets.UTF_8);
    }

    /**
     * A pass which prints the tree it is given to {@code out}, for debugging between other passes.
     *
     * @param out The stream to print to.
     * @return The pass.
     */
    public static InPlaceIRPass<IRNode> debugPrint(PrintStream out) {
        return root -> root.accept(new IRPrinter(out));
    }

    private String name(Stmt stmt) {
        return names.computeIfAbsent(stmt, $ -> "$" + names.size());
    }

    private void print(String line) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < currentIndent; i++) {
            sb.append("  ");
        }
        sb.append(line).append('\n');
        out.print(sb);
    }

    @Override
    public Void visit(StmtList stmtList) {
        currentIndent++;
        for (Stmt stmt : stmtList.statements()) {
            stmt.accept(this);
        }
        currentIndent--;
        return null;
    }

    @Override
    public Void visit(AssignStmt assign) {
        print(assign.id.name() + " = " + assign.rhs.serialize());
        return null;
    }

    @Override
    public Void visit(AllocaStmt alloca) {
        print(alloca.type + " alloca " + alloca.id.name());
        return null;
    }

    @Override
    public Void visit(BinaryOpStmt bin) {
        print(String.format("%s %s = %s %s %s",
                bin.type, name(bin), bin.op.mnemonic, name(bin.lhs), name(bin.rhs)));
        return null;
    }

    private void printBranches(String header, StmtList trueStatements, StmtList falseStatements) {
        print(header);
        if (trueStatements != null) {
            trueStatements.accept(this);
        }
        if (falseStatements != null) {
            print("} else {");
            falseStatements.accept(this);
        }
        print("}");
    }

    @Override
    public Void visit(IfStmt ifStmt) {
        printBranches("if " + name(ifStmt.condition) + " {",
                ifStmt.getTrueStatements(),
                ifStmt.getFalseStatements());
        return null;
    }

    @Override
    public Void visit(FrontendIfStmt ifStmt) {
        printBranches("if " + ifStmt.condition.serialize() + " {",
                ifStmt.getTrueStatements(),
                ifStmt.getFalseStatements());
        return null;
    }

    @Override
    public Void visit(FrontendPrintStmt print) {
        print("print " + print.expr.serialize());
        return null;
    }

    @Override
    public Void visit(PrintStmt print) {
        print(print.type + " print " + name(print.value));
        return null;
    }

    @Override
    public Void visit(ConstStmt constStmt) {
        print(String.format("%s %s = const %s", constStmt.type, name(constStmt), constStmt.value));
        return null;
    }

    @Override
    public Void visit(ForStmt forStmt) {
        print(String.format("for %s in range(%s, %s) {",
                forStmt.loopVar.name(), forStmt.begin.serialize(), forStmt.end.serialize()));
        forStmt.getBody().accept(this);
        print("}");
        return null;
    }

    @Override
    public Void visit(LocalLoadStmt load) {
        print(name(load) + " = load " + load.id.name());
        return null;
    }

    @Override
    public Void visit(LocalStoreStmt store) {
        print("[store] " + store.id.name() + " = " + name(store.value));
        return null;
    }
}
