package io.github.tlang.core.ir;

/**
 * The data type attached to a value. The IR itself only carries it around;
 * only {@link io.github.tlang.core.passes.meta.TypeCheck} interprets it.
 */
public enum DataType {
    UNKNOWN("unknown"),
    I32("i32"),
    I64("i64"),
    F32("f32"),
    F64("f64"),
    ;

    public final String name;

    DataType(String name) {
        this.name = name;
    }

    /**
     * Get the type of a boxed literal.
     *
     * @param value The literal.
     * @return Its type, or {@link #UNKNOWN} for other number classes.
     */
    public static DataType of(Number value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return I32;
        if (value instanceof Long) return I64;
        if (value instanceof Float) return F32;
        if (value instanceof Double) return F64;
        return UNKNOWN;
    }

    /**
     * The type both operands of a binary operation are converted to.
     * <p>
     * Unknown types do not participate, so {@code promote(UNKNOWN, F32)} is {@code F32}.
     *
     * @param lhs The left type.
     * @param rhs The right type.
     * @return The wider of the two.
     */
    public static DataType promote(DataType lhs, DataType rhs) {
        return lhs.ordinal() >= rhs.ordinal() ? lhs : rhs;
    }

    @Override
    public String toString() {
        return name;
    }
}
