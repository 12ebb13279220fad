package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.Checksum;
import com.sbomcheck.core.model.ChecksumAlgorithm;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Checks algorithm names and digest lengths of package and file checksums.
 *
 * <p>Files must also carry a SHA1 checksum.
 *
 * @param <T> package or file
 */
public class ChecksumRule<T extends SpdxEntity> extends AbstractRule<T> {

    private static final String FIELD = "checksums";

    private final Function<T, List<Checksum>> checksums;
    private final boolean sha1Required;

    public ChecksumRule(String code, EntityType target, Class<T> entityClass,
                        Function<T, List<Checksum>> checksums, boolean sha1Required) {
        super(code, target.label() + " checksums use known algorithms and hex digests of the right length"
                + (sha1Required ? ", including SHA1" : ""),
            Severity.ERROR, entityClass, target);
        this.checksums = checksums;
        this.sha1Required = sha1Required;
    }

    @Override
    protected void check(T entity, RuleContext context, List<Violation> violations) {
        if (context.isUnbound(entity, FIELD)) {
            return;
        }
        List<Checksum> values = checksums.apply(entity);
        boolean hasSha1 = false;

        for (Checksum checksum : values) {
            if (checksum.algorithm() == null) {
                violations.add(violation(context, entity, FIELD + ".algorithm", "checksum algorithm is mandatory"));
                continue;
            }
            Optional<ChecksumAlgorithm> algorithm = ChecksumAlgorithm.fromSpdxName(checksum.algorithm());
            if (algorithm.isEmpty()) {
                violations.add(violation(context, entity, FIELD + ".algorithm",
                    "checksum algorithm must be one of the SPDX 2.3 algorithms but was '" + checksum.algorithm() + "'"));
                continue;
            }
            hasSha1 |= algorithm.get() == ChecksumAlgorithm.SHA1;

            String value = checksum.checksumValue();
            if (value == null || value.isBlank()) {
                violations.add(violation(context, entity, FIELD + ".checksumValue",
                    algorithm.get().spdxName() + " checksumValue is mandatory"));
            } else if (!SpdxFormats.isHex(value) || !algorithm.get().acceptsLength(value.length())) {
                violations.add(violation(context, entity, FIELD + ".checksumValue",
                    algorithm.get().spdxName() + " checksumValue must be " + algorithm.get().describeLength()
                        + " hex characters but was '" + value + "'"));
            }
        }

        if (sha1Required && !hasSha1) {
            violations.add(violation(context, entity, FIELD, "a SHA1 checksum is mandatory"));
        }
    }
}
