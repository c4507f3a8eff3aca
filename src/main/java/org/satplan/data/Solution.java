package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Map;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class Solution {
    private final Map<String, String> assignments;
    private final double objectiveValue;
    private final boolean feasible;
    private final List<String> constraintViolations;

    public static Solution empty() {
        return new Solution(Map.of(), 0.0, true, List.of());
    }
}
