package io.resolvemesh.rules;

import java.math.BigDecimal;
import java.util.Locale;

public final class RoundingRules {
    private static final RoundingRule NONE = new RoundingRule() {
        @Override
        public boolean conforms(BigDecimal value) {
            return value != null;
        }

        @Override
        public String describe() {
            return "none";
        }
    };

    private RoundingRules() {
    }

    public static RoundingRule none() {
        return NONE;
    }

    /**
     * Value must be an integer multiple of {@code step}, e.g. {@code 0.25} for quarter-point moves.
     */
    public static RoundingRule granularity(BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            throw new IllegalArgumentException("granularity must be > 0");
        }
        return new RoundingRule() {
            @Override
            public boolean conforms(BigDecimal value) {
                return value != null && value.remainder(step).signum() == 0;
            }

            @Override
            public String describe() {
                return "granularity:" + step.toPlainString();
            }
        };
    }

    public static RoundingRule decimals(int places) {
        if (places < 0) {
            throw new IllegalArgumentException("decimals must be >= 0");
        }
        return new RoundingRule() {
            @Override
            public boolean conforms(BigDecimal value) {
                return value != null && Math.max(0, value.stripTrailingZeros().scale()) <= places;
            }

            @Override
            public String describe() {
                return "decimals:" + places;
            }
        };
    }

    /**
     * Accepts {@code none}, {@code decimals:N}, {@code granularity:X} or a bare step such as {@code 0.25}.
     */
    public static RoundingRule parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return none();
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if ("none".equals(v)) {
            return none();
        }
        try {
            if (v.startsWith("decimals:")) {
                return decimals(Integer.parseInt(v.substring("decimals:".length()).trim()));
            }
            if (v.startsWith("granularity:")) {
                return granularity(new BigDecimal(v.substring("granularity:".length()).trim()));
            }
            return granularity(new BigDecimal(v));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported rounding rule: " + raw, e);
        }
    }
}
