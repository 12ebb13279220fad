package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.RangePointer;
import com.sbomcheck.core.model.SnippetRange;
import com.sbomcheck.core.model.SpdxSnippet;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;

/**
 * Checks snippet ranges: at least one byte range, positive positions, start not after end,
 * both pointers of the same kind and pointing into {@code snippetFromFile}.
 *
 * <p>Whether the referenced file exists is checked by a {@link ReferenceRule}.
 */
public class SnippetRangeRule extends AbstractRule<SpdxSnippet> {

    private static final String FIELD = "ranges";

    public SnippetRangeRule() {
        super("SPDX-9.3", "Snippet ranges are well-formed and include a byte range",
            Severity.ERROR, SpdxSnippet.class, EntityType.SNIPPET);
    }

    @Override
    protected void check(SpdxSnippet snippet, RuleContext context, List<Violation> violations) {
        if (context.isUnbound(snippet, FIELD)) {
            return;
        }
        boolean hasByteRange = false;
        for (SnippetRange range : snippet.ranges()) {
            RangePointer start = range.startPointer();
            RangePointer end = range.endPointer();
            if (start == null || end == null) {
                violations.add(violation(context, snippet, FIELD, "range must have a startPointer and an endPointer"));
                continue;
            }
            if (start.isByteOffset() != end.isByteOffset()) {
                violations.add(violation(context, snippet, FIELD, "range pointers must both be offsets or both be line numbers"));
                continue;
            }
            Integer from = position(start);
            Integer to = position(end);
            if (from == null || to == null) {
                violations.add(violation(context, snippet, FIELD, "range pointer must have an offset or a lineNumber"));
                continue;
            }
            if (from < 1 || to < 1) {
                violations.add(violation(context, snippet, FIELD, "range positions start at 1 but was " + from + ":" + to));
            } else if (from > to) {
                violations.add(violation(context, snippet, FIELD, "range start " + from + " is after end " + to));
            }
            checkReference(snippet, start, context, violations);
            checkReference(snippet, end, context, violations);
            hasByteRange |= start.isByteOffset();
        }
        if (!hasByteRange) {
            violations.add(violation(context, snippet, FIELD, "a byte range is mandatory"));
        }
    }

    private static Integer position(RangePointer pointer) {
        return pointer.isByteOffset() ? pointer.offset() : pointer.lineNumber();
    }

    private void checkReference(SpdxSnippet snippet, RangePointer pointer, RuleContext context,
                                List<Violation> violations) {
        String reference = pointer.reference();
        if (reference == null || snippet.snippetFromFile() == null) {
            return;
        }
        if (!reference.equals(snippet.snippetFromFile())) {
            violations.add(violation(context, snippet, FIELD,
                "range reference '" + reference + "' must be the snippetFromFile '" + snippet.snippetFromFile() + "'"));
        }
    }
}
