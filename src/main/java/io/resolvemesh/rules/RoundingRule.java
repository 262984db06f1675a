package io.resolvemesh.rules;

import java.math.BigDecimal;

/**
 * Market-specific rounding policy for reported numeric values.
 */
public interface RoundingRule {
    boolean conforms(BigDecimal value);

    String describe();
}
