package io.github.tlang.core.passes.meta;

import io.github.tlang.core.ext.MetadataState;
import io.github.tlang.core.ir.*;
import io.github.tlang.core.passes.InPlaceIRPass;

import java.util.HashMap;
import java.util.Map;

/**
 * Fills in the {@link Stmt#type data type} of lowered statements.
 * <p>
 * Loads take the type their local was allocated with, and loop variables are {@link DataType#I32}.
 * Comparisons produce {@link DataType#I32}; other binary operations produce the
 * {@link DataType#promote(DataType, DataType) wider} of their operand types. Prints take the type
 * of what they print.
 * <p>
 * This visitor is permissive: it is not yet exhaustive, and statements that don't
 * produce a value are skipped.
 */
public final class TypeCheck extends IRVisitor<Void> {
    /**
     * This pass, as an {@link InPlaceIRPass}. Lowers the tree first if needed.
     */
    public static final InPlaceIRPass<IRNode> INSTANCE = TypeCheck::run;

    private final Map<Identifier, DataType> localTypes = new HashMap<>();

    private TypeCheck() {
        super(true);
    }

    public static void run(IRNode root) {
        MetadataState state = MetadataState.of(root);
        state.ensureValid(root, MetadataState.LOWERED);
        root.accept(new TypeCheck());
        state.validate(MetadataState.TYPES_INFERRED);
    }

    private void visitBlocks(Stmt stmt) {
        for (StmtList block : stmt.blocks()) {
            block.accept(this);
        }
    }

    @Override
    public Void visit(StmtList stmtList) {
        for (Stmt stmt : stmtList.statements()) {
            stmt.accept(this);
        }
        return null;
    }

    @Override
    public Void visit(AllocaStmt alloca) {
        localTypes.put(alloca.id, alloca.type);
        return null;
    }

    @Override
    public Void visit(ConstStmt constStmt) {
        if (constStmt.type == DataType.UNKNOWN) {
            constStmt.type = DataType.of(constStmt.value);
        }
        return null;
    }

    @Override
    public Void visit(LocalLoadStmt load) {
        load.type = localTypes.getOrDefault(load.id, DataType.UNKNOWN);
        return null;
    }

    @Override
    public Void visit(BinaryOpStmt bin) {
        bin.type = bin.op.isComparison()
                ? DataType.I32
                : DataType.promote(bin.lhs.type, bin.rhs.type);
        return null;
    }

    @Override
    public Void visit(PrintStmt print) {
        print.type = print.value.type;
        return null;
    }

    @Override
    public Void visit(IfStmt ifStmt) {
        visitBlocks(ifStmt);
        return null;
    }

    @Override
    public Void visit(ForStmt forStmt) {
        localTypes.put(forStmt.loopVar, DataType.I32);
        visitBlocks(forStmt);
        return null;
    }
}
