package io.github.tlang.core.ir.expr;

import io.github.tlang.core.ir.ConstStmt;
import io.github.tlang.core.ir.DataType;
import io.github.tlang.core.ir.Stmt;

import java.util.Objects;

public final class ConstExpr extends Expr {
    public final Number value;
    public final DataType type;

    public ConstExpr(Number value, DataType type) {
        this.value = Objects.requireNonNull(value, "value");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static ConstExpr of(Number value) {
        return new ConstExpr(value, DataType.of(value));
    }

    @Override
    public String serialize() {
        return value.toString();
    }

    @Override
    Stmt emit(Flattener flattener) {
        return flattener.push(new ConstStmt(value, type));
    }
}
