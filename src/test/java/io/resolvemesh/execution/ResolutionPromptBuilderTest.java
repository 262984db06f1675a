package io.resolvemesh.execution;

import io.resolvemesh.rules.AncillaryRules;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ResolutionPromptBuilderTest {
    private static final String ADDRESS = "0x" + "ab".repeat(20);
    private static final String TX = "0x" + "12".repeat(32);

    private final ResolutionPromptBuilder builder = new ResolutionPromptBuilder();

    @Test
    void numericPromptCarriesBoundsRoundingAndHosts() {
        AncillaryRules rules = AncillaryRules.parse("q: ETH close on 2024-01-01?, type: numeric, min: 0, max: 1000,"
                + " rounding: decimals:2");
        ResolutionPromptBuilder.PreparedPrompt prompt = builder.build(rules, List.of("prices.example.com"), null);

        Assertions.assertTrue(prompt.prompt().contains("within [0, 1000]"));
        Assertions.assertTrue(prompt.prompt().contains("rounding rule decimals:2"));
        Assertions.assertTrue(prompt.prompt().contains("only from these hosts: prices.example.com."));
        Assertions.assertTrue(prompt.prompt().contains("reason, sources (the URLs used) and value."));
        Assertions.assertTrue(prompt.prompt().endsWith("Oracle question:\nETH close on 2024-01-01?\n"));
        Assertions.assertFalse(prompt.prompt().contains("previous script failed"));
        Assertions.assertEquals(prompt, builder.build(rules, List.of("prices.example.com"), null));
    }

    @Test
    void binaryPromptMentionsThresholdWhenPresent() {
        AncillaryRules rules = AncillaryRules.parse("q: Did BTC close above 50000?, threshold: 50000");
        String prompt = builder.build(rules, List.of(), null).prompt();
        Assertions.assertTrue(prompt.contains("strictly greater than 50000"));
        Assertions.assertTrue(prompt.contains("(none listed; use the sources named in the question)"));
        Assertions.assertFalse(prompt.contains("rounding rule"));
    }

    @Test
    void longHexLiteralsAreReplacedAndRestored() {
        AncillaryRules rules = AncillaryRules.parse("q: Did " + ADDRESS + " send " + TX + " before " + ADDRESS + " was paused?");
        ResolutionPromptBuilder.PreparedPrompt prompt = builder.build(rules, List.of(), null);

        Assertions.assertEquals(2, prompt.placeholders().size());
        Assertions.assertEquals(ADDRESS, prompt.placeholders().get("__PLACEHOLDER_HEX_1__"));
        Assertions.assertEquals(TX, prompt.placeholders().get("__PLACEHOLDER_HEX_2__"));
        Assertions.assertFalse(prompt.prompt().contains(ADDRESS));
        Assertions.assertTrue(prompt.prompt().contains(
                "Did __PLACEHOLDER_HEX_1__ send __PLACEHOLDER_HEX_2__ before __PLACEHOLDER_HEX_1__ was paused?"));
        Assertions.assertTrue(prompt.prompt().contains("(length 66)"));

        String restored = builder.restore("TARGET = \"__PLACEHOLDER_HEX_1__\"\nTX = \"__PLACEHOLDER_HEX_2__\"",
                prompt.placeholders());
        Assertions.assertEquals("TARGET = \"" + ADDRESS + "\"\nTX = \"" + TX + "\"", restored);
        Assertions.assertEquals("", builder.restore(null, prompt.placeholders()));
    }

    @Test
    void regenerationPromptIncludesPreviousFailure() {
        AncillaryRules rules = AncillaryRules.parse("q: Will it rain?");
        String prompt = builder.build(rules, List.of(),
                new ResolutionPromptBuilder.RegenerationContext("print(" + ADDRESS + ")", "script exit=1 stderr=NameError"))
                .prompt();
        Assertions.assertTrue(prompt.startsWith("The previous script failed. Generate a corrected version."));
        Assertions.assertTrue(prompt.contains("print(__PLACEHOLDER_HEX_1__)"));
        Assertions.assertTrue(prompt.contains("Error:\nscript exit=1 stderr=NameError"));

        String unknown = builder.build(rules, List.of(), new ResolutionPromptBuilder.RegenerationContext("x", " ")).prompt();
        Assertions.assertTrue(unknown.contains("Error:\nunknown error"));
    }
}
