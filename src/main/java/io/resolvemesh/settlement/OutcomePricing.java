package io.resolvemesh.settlement;

import io.resolvemesh.model.Decision;
import io.resolvemesh.model.Outcome;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Maps outcomes to 18-decimal fixed-point settlement prices.
 */
public final class OutcomePricing {
    public static final BigInteger ONE = BigInteger.TEN.pow(18);
    public static final BigInteger HALF = ONE.divide(BigInteger.TWO);
    private static final BigDecimal SCALE = new BigDecimal(ONE);

    private OutcomePricing() {
    }

    public static BigInteger price(Outcome outcome) {
        if (outcome.isNumeric()) {
            return outcome.value().multiply(SCALE).setScale(0, RoundingMode.HALF_EVEN).toBigIntegerExact();
        }
        Decision decision = outcome.decision();
        return switch (decision) {
            case TRUE -> ONE;
            case FALSE -> BigInteger.ZERO;
            case INVALID -> HALF;
        };
    }
}
