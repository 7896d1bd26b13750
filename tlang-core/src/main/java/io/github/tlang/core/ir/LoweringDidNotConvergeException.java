package io.github.tlang.core.ir;

public class LoweringDidNotConvergeException extends IRException {
    public LoweringDidNotConvergeException(int traversals, int remaining) {
        super(String.format("lowering did not converge after %d traversals, %d high-level statements remain",
                traversals, remaining));
    }
}
