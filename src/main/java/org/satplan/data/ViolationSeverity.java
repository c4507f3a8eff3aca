package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ViolationSeverity {
    ERROR("error"),
    WARNING("warning");

    private final String label;
}
