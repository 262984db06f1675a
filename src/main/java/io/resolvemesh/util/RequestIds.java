package io.resolvemesh.util;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Deterministic request identity: {@code sha256(identifier || uint256(timestamp) || ancillary)}.
 */
public final class RequestIds {
    private static final int WORD_BYTES = 32;

    private RequestIds() {
    }

    public static String compute(String identifier, long requestTimestamp, String ancillaryData) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be empty");
        }
        if (requestTimestamp < 0L) {
            throw new IllegalArgumentException("requestTimestamp must be >= 0");
        }
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        buf.writeBytes(identifier.trim().getBytes(StandardCharsets.UTF_8));
        buf.writeBytes(uint256(requestTimestamp));
        buf.writeBytes(ancillaryData == null ? new byte[0] : ancillaryData.getBytes(StandardCharsets.UTF_8));
        return "0x" + HexFormat.of().formatHex(Hashing.sha256(buf.toByteArray()));
    }

    public static boolean looksLikeRequestId(String raw) {
        return raw != null
                && raw.length() == 66
                && raw.startsWith("0x")
                && Hashing.isSha256Hex(raw.substring(2));
    }

    private static byte[] uint256(long value) {
        byte[] raw = BigInteger.valueOf(value).toByteArray();
        byte[] out = new byte[WORD_BYTES];
        int copy = Math.min(raw.length, WORD_BYTES);
        System.arraycopy(raw, raw.length - copy, out, WORD_BYTES - copy, copy);
        return out;
    }
}
