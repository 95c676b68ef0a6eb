package dev.microtest.engine;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TestStatus {
    PASS,
    FAIL,
    SKIP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
