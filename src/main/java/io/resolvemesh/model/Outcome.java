package io.resolvemesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.util.Objects;

public record Outcome(Decision decision, BigDecimal value) {
    public Outcome {
        Objects.requireNonNull(decision, "decision");
    }

    public static Outcome binary(Decision decision) {
        return new Outcome(decision, null);
    }

    public static Outcome numeric(BigDecimal value) {
        return new Outcome(Decision.TRUE, Objects.requireNonNull(value, "value"));
    }

    @JsonIgnore
    public boolean isNumeric() {
        return value != null && decision != Decision.INVALID;
    }

    public String describe() {
        return isNumeric() ? value.toPlainString() : decision.wireValue();
    }
}
