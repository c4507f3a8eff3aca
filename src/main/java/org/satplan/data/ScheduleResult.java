package org.satplan.data;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ScheduleResult<T> {
    private final boolean success;
    @Getter(AccessLevel.NONE)
    private final T value;
    private final String message;

    public static <T> ScheduleResult<T> success(T value, String message) {
        return new ScheduleResult<>(true, value, message);
    }

    public static <T> ScheduleResult<T> failure(String message) {
        return new ScheduleResult<>(false, null, message);
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public T orElseThrow() {
        return getValue().orElseThrow(() -> new IllegalStateException("Scheduling failed: " + message));
    }
}
