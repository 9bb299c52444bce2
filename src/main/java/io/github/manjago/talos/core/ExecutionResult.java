package io.github.manjago.talos.core;

/**
 * Result of executing a single instruction.
 */
public enum ExecutionResult {

    /** Instruction executed successfully */
    OK(false),

    /** Fewer elements on the stack than the instruction consumes */
    ERROR_STACK_UNDERFLOW(true),

    /** invert of zero */
    ERROR_ZERO_INVERSE(true),

    /** div_mod by zero */
    ERROR_DIVISION_BY_ZERO(true),

    /** log_2_floor of zero */
    ERROR_ZERO_LOGARITHM(true),

    /** assert or assert_vector did not hold */
    ERROR_ASSERTION_FAILED(true),

    /** Control flow inside straight-line code */
    ERROR_CONTROL_FLOW(true);

    private final boolean isError;

    ExecutionResult(boolean isError) {
        this.isError = isError;
    }

    /**
     * @return true if this result indicates an error condition
     */
    public boolean isError() {
        return isError;
    }

    /**
     * @return true if this result indicates successful execution
     */
    public boolean isSuccess() {
        return !isError;
    }
}
