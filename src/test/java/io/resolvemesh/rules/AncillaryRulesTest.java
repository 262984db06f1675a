package io.resolvemesh.rules;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;

final class AncillaryRulesTest {

    @Test
    void parsesNumericRulesWithWindowAndSources() {
        AncillaryRules rules = AncillaryRules.parse("q: What was the BTC/USD close?, type: numeric, min: 0, max: 100000,"
                + " rounding: decimals:2, sources: https://api.coinbase.com/v2/prices; Data.Example.org/btc,"
                + " resolve_after: 1700000000, deadline: 2023-11-15T00:00:00Z");

        Assertions.assertTrue(rules.wellFormed(), () -> "problems: " + rules.problems());
        Assertions.assertEquals("What was the BTC/USD close?", rules.question());
        Assertions.assertEquals(OutcomeType.NUMERIC, rules.type());
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(rules.min()));
        Assertions.assertEquals(0, new BigDecimal("100000").compareTo(rules.max()));
        Assertions.assertEquals("decimals:2", rules.rounding().describe());
        Assertions.assertEquals(List.of("https://api.coinbase.com/v2/prices", "Data.Example.org/btc"), rules.sources());
        Assertions.assertEquals(1_700_000_000L, rules.resolveAfterSec());
        Assertions.assertEquals(1_700_006_400L, rules.deadlineSec());

        long earliest = rules.earliestResolveAtMs(1_600_000_000L, 30L);
        Assertions.assertEquals(1_700_000_000_000L, earliest);
        Assertions.assertEquals(1_700_006_400_000L, rules.deadlineAtMs(earliest, 60L));
        Assertions.assertEquals(List.of("api.coinbase.com", "data.example.org", "extra.example.com"),
                rules.allowedHosts(List.of(" Extra.Example.com", "api.coinbase.com")));
    }

    @Test
    void defaultsToBinaryWithGraceAndWindow() {
        AncillaryRules rules = AncillaryRules.parse("Will it rain in Lisbon tomorrow?");
        Assertions.assertEquals(OutcomeType.BINARY, rules.type());
        Assertions.assertEquals("Will it rain in Lisbon tomorrow?", rules.question());
        Assertions.assertNull(rules.templateId());
        Assertions.assertTrue(rules.sources().isEmpty());
        Assertions.assertEquals("none", rules.rounding().describe());

        long earliest = rules.earliestResolveAtMs(1_000L, 30L);
        Assertions.assertEquals(1_030_000L, earliest);
        Assertions.assertEquals(earliest + 7_200_000L, rules.deadlineAtMs(earliest, 7_200L));
    }

    @Test
    void deadlineNeverPrecedesEarliestResolveTime() {
        AncillaryRules rules = AncillaryRules.parse("q: early?, deadline: 100");
        long earliest = rules.earliestResolveAtMs(5_000L, 0L);
        Assertions.assertEquals(earliest, rules.deadlineAtMs(earliest, 3_600L));
    }

    @Test
    void oversizedTimesAreProblemsAndNeverOpenTheGateEarly() {
        AncillaryRules rules = AncillaryRules.parse("q: when?, resolve_after: 9223372036854775807, deadline: -5");
        Assertions.assertFalse(rules.wellFormed());
        Assertions.assertTrue(rules.problems().contains("resolve_after out of range: 9223372036854775807"));
        Assertions.assertTrue(rules.problems().contains("deadline out of range: -5"));
        Assertions.assertNull(rules.resolveAfterSec());
        Assertions.assertNull(rules.deadlineSec());

        long earliest = rules.earliestResolveAtMs(1_700_000_000L, 30L);
        Assertions.assertEquals(1_700_000_030_000L, earliest);
        Assertions.assertEquals(1_700_003_630_000L, rules.deadlineAtMs(earliest, 3_600L));

        AncillaryRules plain = AncillaryRules.parse("q: far future request?");
        long far = plain.earliestResolveAtMs(Long.MAX_VALUE - 10L, 3_600L);
        Assertions.assertEquals(Long.MAX_VALUE, far);
        Assertions.assertEquals(Long.MAX_VALUE, plain.deadlineAtMs(far, 3_600L));
        Assertions.assertEquals(AncillaryRules.MAX_EPOCH_SECONDS,
                AncillaryRules.parse("q: last?, resolve_after: 9999-12-31T23:59:59Z").resolveAfterSec());
    }

    @Test
    void decodesHexEncodedAncillaryData() {
        String text = "q: Did it happen?, description: see the official feed, template: feed_check";
        String hex = "0x" + HexFormat.of().formatHex(text.getBytes(StandardCharsets.UTF_8));
        AncillaryRules rules = AncillaryRules.parse(hex);
        Assertions.assertEquals(text, rules.text());
        Assertions.assertEquals("Did it happen?\nsee the official feed", rules.question());
        Assertions.assertEquals("feed_check", rules.templateId());

        Assertions.assertEquals("0xfffe", AncillaryRules.decodeText("0xfffe"));
        Assertions.assertEquals("", AncillaryRules.decodeText(null));
    }

    @Test
    void collectsProblemsInsteadOfThrowing() {
        AncillaryRules numeric = AncillaryRules.parse("q: price?, type: scalar, min: abc, rounding: granularity:-1");
        Assertions.assertFalse(numeric.wellFormed());
        Assertions.assertTrue(numeric.problems().contains("min is not a number: abc"));
        Assertions.assertTrue(numeric.problems().contains("numeric requests must declare min and max"));
        Assertions.assertTrue(numeric.problems().stream().anyMatch(p -> p.contains("granularity must be > 0")));

        AncillaryRules inverted = AncillaryRules.parse("q: range?, type: numeric, min: 5, max: 1");
        Assertions.assertTrue(inverted.problems().contains("min greater than max"));

        AncillaryRules unknown = AncillaryRules.parse("q: colour?, type: color, resolve_after: next tuesday");
        Assertions.assertTrue(unknown.problems().contains("Unsupported outcome type: color"));
        Assertions.assertTrue(unknown.problems().stream().anyMatch(p -> p.startsWith("resolve_after is neither")));
        Assertions.assertEquals(OutcomeType.BINARY, unknown.type());
    }

    @Test
    void extractsHostsFromLooseSourceStrings() {
        Assertions.assertEquals("data.example.org", AncillaryRules.hostOf(" data.example.org/path?q=1 "));
        Assertions.assertEquals("api.example.com", AncillaryRules.hostOf("https://API.example.com:8443/v1"));
        Assertions.assertNull(AncillaryRules.hostOf(""));
        Assertions.assertNull(AncillaryRules.hostOf("http://[broken"));
    }
}
