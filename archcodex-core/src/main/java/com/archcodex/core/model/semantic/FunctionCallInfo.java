package com.archcodex.core.model.semantic;

import java.util.List;
import java.util.Objects;

/**
 * One call expression.
 *
 * @param callee full callee text, e.g. {@code db.users.insert}
 * @param receiver receiver expression, e.g. {@code db.users}, may be null
 * @param methodName invoked name, e.g. {@code insert}
 * @param arguments raw argument texts
 * @param argumentCount number of arguments
 * @param location call position
 * @param rawText call source text
 * @param controlFlow surrounding try/catch context
 * @param constructorCall a {@code new X()} expression
 * @param parentFunction name of the enclosing function or method, may be null
 */
public record FunctionCallInfo(
    String callee,
    String receiver,
    String methodName,
    List<String> arguments,
    int argumentCount,
    SourceLocation location,
    String rawText,
    ControlFlowContext controlFlow,
    boolean constructorCall,
    String parentFunction
) {
    public FunctionCallInfo {
        Objects.requireNonNull(callee, "callee must not be null");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
        location = location != null ? location : SourceLocation.START;
        controlFlow = controlFlow != null ? controlFlow : ControlFlowContext.NONE;
        methodName = methodName != null ? methodName : lastSegment(callee);
    }

    public static FunctionCallInfo of(String callee, int line, String parentFunction) {
        int dot = callee.lastIndexOf('.');
        String receiver = dot > 0 ? callee.substring(0, dot) : null;
        return new FunctionCallInfo(callee, receiver, null, List.of(), 0, SourceLocation.at(line),
            callee + "()", ControlFlowContext.NONE, false, parentFunction);
    }

    private static String lastSegment(String callee) {
        int dot = callee.lastIndexOf('.');
        return dot >= 0 ? callee.substring(dot + 1) : callee;
    }
}
