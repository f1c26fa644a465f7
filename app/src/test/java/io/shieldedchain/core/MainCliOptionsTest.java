package io.shieldedchain.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(1, options.blocks());
        assertNull(options.paramsUrl());
        assertNotNull(options.minerAddress());
    }

    @Test
    void parsesMiningOptions() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--network=test",
                "--blocks=5",
                "--miner-address=0102030405060708090a0b0c0d0e0f1011121314",
                "--max-tries=42",
                "--params-url=https://example.org/sprout.params",
                "--params-sha256=abcd",
                "--params-dir=/tmp/params"
        });
        assertFalse(options.showHelp());
        assertEquals("test", options.network());
        assertEquals(5, options.blocks());
        assertEquals("0102030405060708090a0b0c0d0e0f1011121314", options.minerAddress());
        assertEquals(42, options.maxTries());
        assertEquals("https://example.org/sprout.params", options.paramsUrl());
        assertEquals("abcd", options.paramsSha256());
        assertEquals(Path.of("/tmp/params"), options.paramsDir());
    }

    @Test
    void invalidBlockCountSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--blocks=0"});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
        assertTrue(options.errorMessage().contains("--blocks"));
    }

    @Test
    void blockCountAboveIntRangeSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--blocks=2147483648"});
        assertTrue(options.showHelp());
        assertEquals("Invalid value for --blocks: 2147483648", options.errorMessage());
        assertEquals(1, options.blocks());
    }

    @Test
    void paramsUrlNeedsChecksum() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--params-url=http://localhost/x.params"});
        assertTrue(options.showHelp());
        assertEquals("--params-url requires --params-sha256", options.errorMessage());
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
