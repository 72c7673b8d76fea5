package com.archcodex.core.validator.impl.imports;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.project.ProjectContext;
import com.archcodex.core.tag.ArchTag;
import com.archcodex.core.tag.ParsedTags;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code importable_by}: only files tagged with one of the listed architectures may import this file.
 *
 * <p>Entries are architecture ids or dotted globs ({@code domain.*}, {@code api.**}). Importers are
 * found through the project's import graph; untagged importers are rejected.
 *
 * @since 1.0.0
 */
public class ImportableByValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "importable_by";
    }

    @Override
    public String getErrorCode() {
        return "E023";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        if (context.project() == null) {
            return notEvaluated(constraint, context);
        }
        ProjectContext project = context.project();
        List<String> allowed = constraint.valueAsList();
        List<Violation> violations = new ArrayList<>();

        for (String importer : project.importersOf(context.filePath())) {
            Optional<String> importerArch = project.tags(importer)
                .flatMap(ParsedTags::tag)
                .map(ArchTag::archId);
            boolean permitted = importerArch
                .map(arch -> allowed.stream().anyMatch(pattern -> GlobPatterns.matchesDotted(pattern, arch)))
                .orElse(false);
            if (!permitted) {
                violations.add(violation(constraint, context)
                    .line(1)
                    .column(1)
                    .message("'" + importer + "' (" + importerArch.map(a -> "@arch " + a).orElse("untagged")
                        + ") imports this file, but it is only importable by " + quoteAll(allowed))
                    .fixHint("Remove the import from '" + importer + "' or route it through an allowed architecture")
                    .build());
            }
        }
        return outcome(violations);
    }
}
