package me.golemcore.interactions.domain.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SemanticVersionTest {

    @Test
    void shouldOrderByNumericComponents() {
        assertTrue(SemanticVersion.compare("0.9.0", "1.0.0") < 0);
        assertTrue(SemanticVersion.compare("1.10.0", "1.9.3") > 0);
        assertTrue(SemanticVersion.compare("2.0.1", "2.0.0") > 0);
        assertEquals(0, SemanticVersion.compare("1.0", "1.0.0"));
    }

    @Test
    void shouldSortPreReleaseBeforeRelease() {
        assertTrue(SemanticVersion.compare("1.0.0-beta", "1.0.0") < 0);
        assertTrue(SemanticVersion.compare("1.0.0-alpha", "1.0.0-beta") < 0);
    }

    @Test
    void shouldIgnorePrefixAndBuildMetadata() {
        assertEquals(0, SemanticVersion.compare("v1.2.3", "1.2.3+build.7"));
        assertEquals("1.2.3", SemanticVersion.parse("V1.2.3").toString());
    }

    @Test
    void shouldTreatMissingOrGarbageAsZero() {
        assertEquals(new SemanticVersion(0, 0, 0, null), SemanticVersion.parse(null));
        assertEquals(new SemanticVersion(1, 0, 0, null), SemanticVersion.parse("1.x"));
        assertEquals("0.0.0-rc1", SemanticVersion.parse("-rc1").toString());
    }
}
