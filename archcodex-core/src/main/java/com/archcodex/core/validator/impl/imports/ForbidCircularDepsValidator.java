package com.archcodex.core.validator.impl.imports;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.project.ProjectContext;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code forbid_circular_deps}: the file is not part of an import cycle.
 *
 * <p>Searches the project's import graph breadth-first from the file, so the reported cycle is a
 * shortest one. A constraint value of {@code false} disables the check.
 *
 * @since 1.0.0
 */
public class ForbidCircularDepsValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "forbid_circular_deps";
    }

    @Override
    public String getErrorCode() {
        return "E024";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        if (Boolean.FALSE.equals(constraint.value()) || "false".equals(constraint.value())) {
            return ValidationOutcome.pass();
        }
        if (context.project() == null) {
            return notEvaluated(constraint, context);
        }
        ProjectContext project = context.project();
        String start = project.relativize(context.filePath());

        List<String> cycle = shortestCycle(project, start);
        if (cycle.isEmpty()) {
            return ValidationOutcome.pass();
        }
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("Circular dependency: " + String.join(" → ", cycle))
            .fixHint("Break the cycle by extracting the shared code or inverting one dependency")
            .build());
    }

    private static List<String> shortestCycle(ProjectContext project, String start) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        parent.put(start, null);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : project.importsOf(current)) {
                if (next.equals(start)) {
                    List<String> path = new ArrayList<>();
                    for (String node = current; node != null; node = parent.get(node)) {
                        path.add(node);
                    }
                    Collections.reverse(path);
                    path.add(start);
                    return path;
                }
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return List.of();
    }
}
