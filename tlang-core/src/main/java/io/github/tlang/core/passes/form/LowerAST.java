package io.github.tlang.core.passes.form;

import io.github.tlang.core.ext.MetadataState;
import io.github.tlang.core.ir.*;
import io.github.tlang.core.ir.expr.Flattener;
import io.github.tlang.core.passes.InPlaceIRPass;
import io.github.tlang.core.passes.Traversal;
import io.github.tlang.core.passes.meta.CountHighLevelStmts;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lowers front-end statements to SSA form.
 * <p>
 * Every {@link AssignStmt}, {@link FrontendPrintStmt} and {@link FrontendIfStmt} is replaced
 * with the flattening of its expression, followed by a {@link LocalStoreStmt},
 * {@link PrintStmt} or {@link IfStmt} respectively, consuming the flattened value.
 * Mutable locals stay as alloca/load/store; every other value becomes a single-assignment statement.
 * <p>
 * Rewrites happen as soon as a front-end statement is reached, which invalidates the
 * traversal in progress. The visit methods then return {@link Traversal#RESTART}
 * all the way up, and the tree is traversed again from the root, until a full traversal
 * completes without a rewrite. Each rewrite removes one front-end statement and adds none,
 * so this takes at most one traversal more than there are front-end statements.
 */
public final class LowerAST extends IRVisitor<Traversal> {
    private static final Logger LOGGER = Logger.getLogger(LowerAST.class.getName());

    private static final LowerAST VISITOR = new LowerAST();

    /**
     * This pass, as an {@link InPlaceIRPass}.
     */
    public static final InPlaceIRPass<IRNode> INSTANCE = LowerAST::run;

    private LowerAST() {
    }

    /**
     * Lower the tree rooted at {@code root}.
     *
     * @param root The root of the tree, usually a {@link StmtList}.
     * @throws LoweringDidNotConvergeException If rewriting went on for more traversals than
     *                                         there were front-end statements to begin with.
     */
    public static void run(IRNode root) {
        int limit = CountHighLevelStmts.count(root) + 1;
        int traversals = 0;
        while (true) {
            if (traversals == limit) {
                throw new LoweringDidNotConvergeException(traversals, CountHighLevelStmts.count(root));
            }
            traversals++;
            if (root.accept(VISITOR) == Traversal.CONTINUE) break;
        }
        LOGGER.log(Level.FINE, "lowering converged after {0} traversal(s)", traversals);
        MetadataState.of(root).validate(MetadataState.LOWERED);
    }

    private Traversal rewrite(Stmt target, VecStatement lowered) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("lowering %s into %d statement(s)", target, lowered.size()));
        }
        target.replaceWith(lowered);
        return Traversal.RESTART;
    }

    private Traversal visitBlock(StmtList block) {
        return block == null ? Traversal.CONTINUE : block.accept(this);
    }

    @Override
    public Traversal visit(StmtList stmtList) {
        for (Stmt stmt : stmtList.statements()) {
            if (stmt.accept(this) == Traversal.RESTART) {
                return Traversal.RESTART;
            }
        }
        return Traversal.CONTINUE;
    }

    @Override
    public Traversal visit(AssignStmt assign) {
        VecStatement flattened = Flattener.flatten(assign.rhs);
        flattened.push(new LocalStoreStmt(assign.id, flattened.back()));
        return rewrite(assign, flattened);
    }

    @Override
    public Traversal visit(FrontendPrintStmt print) {
        VecStatement flattened = Flattener.flatten(print.expr);
        flattened.push(new PrintStmt(flattened.back()));
        return rewrite(print, flattened);
    }

    @Override
    public Traversal visit(FrontendIfStmt ifStmt) {
        VecStatement flattened = Flattener.flatten(ifStmt.condition);
        flattened.push(new IfStmt(flattened.back(),
                ifStmt.takeTrueStatements(),
                ifStmt.takeFalseStatements()));
        return rewrite(ifStmt, flattened);
    }

    @Override
    public Traversal visit(IfStmt ifStmt) {
        if (visitBlock(ifStmt.getTrueStatements()) == Traversal.RESTART) {
            return Traversal.RESTART;
        }
        return visitBlock(ifStmt.getFalseStatements());
    }

    @Override
    public Traversal visit(ForStmt forStmt) {
        return forStmt.getBody().accept(this);
    }

    // already lowered

    @Override
    public Traversal visit(AllocaStmt alloca) {
        return Traversal.CONTINUE;
    }

    @Override
    public Traversal visit(ConstStmt constStmt) {
        return Traversal.CONTINUE;
    }

    @Override
    public Traversal visit(BinaryOpStmt bin) {
        return Traversal.CONTINUE;
    }

    @Override
    public Traversal visit(LocalLoadStmt load) {
        return Traversal.CONTINUE;
    }

    @Override
    public Traversal visit(LocalStoreStmt store) {
        return Traversal.CONTINUE;
    }

    @Override
    public Traversal visit(PrintStmt print) {
        return Traversal.CONTINUE;
    }
}
