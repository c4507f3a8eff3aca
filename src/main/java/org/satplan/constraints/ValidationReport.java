package org.satplan.constraints;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.satplan.data.ConstraintViolation;
import org.satplan.data.ViolationType;

import java.util.List;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class ValidationReport {
    private final List<ConstraintViolation> violations;

    public boolean isFeasible() {
        return violations.stream().noneMatch(ConstraintViolation::isError);
    }

    public List<ConstraintViolation> getErrors() {
        return violations.stream().filter(ConstraintViolation::isError).toList();
    }

    public List<ConstraintViolation> getWarnings() {
        return violations.stream().filter(violation -> !violation.isError()).toList();
    }

    public List<ConstraintViolation> getViolations(ViolationType type) {
        return violations.stream().filter(violation -> violation.getType() == type).toList();
    }

    public List<String> describe() {
        return violations.stream()
                .map(violation -> violation.getType().getTag() + " [" + violation.getSeverity().getLabel() + "] " + violation.getMessage())
                .toList();
    }
}
