package com.tempeh.plugin.version;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VersionRangeTest {

    private static boolean matches(String range, String version) {
        return VersionRange.parse(range).isSatisfiedBy(SemanticVersion.parse(version));
    }

    @Test
    void caret_staysBelowNextMajor() {
        assertTrue(matches("^1.0.0", "1.0.0"));
        assertTrue(matches("^1.0.0", "1.9.3"));
        assertFalse(matches("^1.0.0", "2.0.0"));
        assertFalse(matches("^1.2.0", "1.1.9"));
    }

    @Test
    void caret_onZeroMajorStaysBelowNextMinor() {
        assertTrue(matches("^0.2.3", "0.2.9"));
        assertFalse(matches("^0.2.3", "0.3.0"));
        assertTrue(matches("^0.0.3", "0.0.3"));
        assertFalse(matches("^0.0.3", "0.0.4"));
    }

    @Test
    void tilde_staysBelowNextMinor() {
        assertTrue(matches("~1.2.3", "1.2.7"));
        assertFalse(matches("~1.2.3", "1.3.0"));
        assertTrue(matches("~1", "1.8.0"));
    }

    @Test
    void comparatorsAndConjunction() {
        assertTrue(matches(">=1.0.0 <2.0.0", "1.5.0"));
        assertFalse(matches(">=1.0.0 <2.0.0", "2.0.0"));
        assertTrue(matches(">1.0.0", "1.0.1"));
        assertFalse(matches(">1.0.0", "1.0.0"));
        assertTrue(matches("<=1.2.3", "1.2.3"));
        assertTrue(matches(">= 1.2.3", "1.2.4"));
    }

    @Test
    void alternatives() {
        assertTrue(matches("^1.0.0 || ^3.0.0", "3.1.0"));
        assertFalse(matches("^1.0.0 || ^3.0.0", "2.1.0"));
    }

    @Test
    void wildcardsAndExact() {
        assertTrue(matches("*", "9.9.9"));
        assertTrue(matches("1.x", "1.4.0"));
        assertFalse(matches("1.x", "2.0.0"));
        assertTrue(matches("1.2.x", "1.2.8"));
        assertFalse(matches("1.2", "1.3.0"));
        assertTrue(matches("1.2.3", "1.2.3"));
        assertTrue(matches("=1.2.3", "1.2.3"));
        assertFalse(matches("1.2.3", "1.2.4"));
    }

    @Test
    void hyphenRangeIsInclusive() {
        assertTrue(matches("1.2.3 - 2.3.4", "1.2.3"));
        assertTrue(matches("1.2.3 - 2.3.4", "2.3.4"));
        assertFalse(matches("1.2.3 - 2.3.4", "2.3.5"));
        assertTrue(matches("1.0.0 - 2", "2.9.0"));
    }

    @Test
    void prereleaseOnlyMatchesWhenRangeNamesSameCore() {
        assertFalse(matches("^1.0.0", "1.1.0-beta"));
        assertFalse(matches("<2.0.0", "2.0.0-rc.1"));
        assertTrue(matches(">=1.1.0-alpha <2.0.0", "1.1.0-beta"));
        assertFalse(matches(">=1.1.0-alpha <2.0.0", "1.2.0-beta"));
    }

    @Test
    void invalidExpressionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse("banana"));
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse(">=1.0.0 <<2"));
        assertFalse(VersionRange.isValid("1.2.3.4"));
        assertTrue(VersionRange.isValid("^1.0.0"));
    }

    @Test
    void semanticVersionOrdering() {
        assertTrue(SemanticVersion.parse("1.0.0-alpha").compareTo(SemanticVersion.parse("1.0.0-alpha.1")) < 0);
        assertTrue(SemanticVersion.parse("1.0.0-alpha.1").compareTo(SemanticVersion.parse("1.0.0-alpha.beta")) < 0);
        assertTrue(SemanticVersion.parse("1.0.0-beta.2").compareTo(SemanticVersion.parse("1.0.0-beta.11")) < 0);
        assertTrue(SemanticVersion.parse("1.0.0-rc.1").compareTo(SemanticVersion.parse("1.0.0")) < 0);
        assertTrue(SemanticVersion.parse("1.10.0").compareTo(SemanticVersion.parse("1.9.0")) > 0);
        assertTrue(SemanticVersion.parse("1.0.0+build.1").equals(SemanticVersion.parse("1.0.0+build.2")));
        assertFalse(SemanticVersion.isValid("1.0"));
        assertFalse(SemanticVersion.isValid("v1.0.0"));
    }
}
