package io.github.tlang.core.ops;

/**
 * The binary operations of the language.
 */
public enum BinaryOpType {
    ADD("add", "+"),
    SUB("sub", "-"),
    MUL("mul", "*"),
    DIV("div", "/"),
    MOD("mod", "%"),
    MAX("max", "max"),
    MIN("min", "min"),
    BIT_AND("bit_and", "&"),
    BIT_OR("bit_or", "|"),
    BIT_XOR("bit_xor", "^"),
    CMP_LT("cmp_lt", "<"),
    CMP_LE("cmp_le", "<="),
    CMP_GT("cmp_gt", ">"),
    CMP_GE("cmp_ge", ">="),
    CMP_EQ("cmp_eq", "=="),
    CMP_NE("cmp_ne", "!="),
    ;

    /**
     * The name used in lowered IR, e.g. {@code add}.
     */
    public final String mnemonic;
    /**
     * The symbol used in serialized expressions, e.g. {@code +}.
     */
    public final String symbol;

    BinaryOpType(String mnemonic, String symbol) {
        this.mnemonic = mnemonic;
        this.symbol = symbol;
    }

    public boolean isComparison() {
        return ordinal() >= CMP_LT.ordinal();
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
