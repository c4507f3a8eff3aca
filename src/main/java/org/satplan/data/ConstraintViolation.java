package org.satplan.data;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Optional;

@Getter
@Builder
@ToString
public class ConstraintViolation {
    @NonNull
    private final ViolationType type;
    @NonNull
    private final ViolationSeverity severity;
    @NonNull
    private final String message;
    private final String subjectId;
    private final String action1Id;
    private final String action2Id;
    private final Double requiredGapSec;
    private final Double actualGapSec;

    public boolean isError() {
        return severity == ViolationSeverity.ERROR;
    }

    public Optional<Double> getRequiredGap() {
        return Optional.ofNullable(requiredGapSec);
    }

    public Optional<Double> getActualGap() {
        return Optional.ofNullable(actualGapSec);
    }
}
