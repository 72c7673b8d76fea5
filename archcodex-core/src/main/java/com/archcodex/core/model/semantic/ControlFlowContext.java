package com.archcodex.core.model.semantic;

/**
 * Exception-handling context surrounding a call.
 *
 * @param inTryBlock inside a try block
 * @param inCatchBlock inside a catch block
 * @param inFinallyBlock inside a finally block
 * @param tryDepth number of enclosing try statements
 */
public record ControlFlowContext(
    boolean inTryBlock,
    boolean inCatchBlock,
    boolean inFinallyBlock,
    int tryDepth
) {
    public static final ControlFlowContext NONE = new ControlFlowContext(false, false, false, 0);
}
