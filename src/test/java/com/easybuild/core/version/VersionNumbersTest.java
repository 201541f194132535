package com.easybuild.core.version;

import com.easybuild.core.model.IncrementType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VersionNumbersTest {

    @Nested
    @DisplayName("increment")
    class Increment {

        @Test
        void patchBumpsLastComponent() {
            assertEquals("1.2.4", VersionNumbers.increment("1.2.3", IncrementType.PATCH));
        }

        @Test
        void minorResetsPatch() {
            assertEquals("1.3.0", VersionNumbers.increment("1.2.3", IncrementType.MINOR));
        }

        @Test
        void majorResetsMinorAndPatch() {
            assertEquals("2.0.0", VersionNumbers.increment("1.2.3", IncrementType.MAJOR));
        }

        @Test
        @DisplayName("build suffix is dropped")
        void buildSuffixDropped() {
            assertEquals("1.2.4", VersionNumbers.increment("1.2.3+4", IncrementType.PATCH));
        }

        @Test
        @DisplayName("two-part version is read as X.Y.0")
        void twoPartVersionPadded() {
            assertEquals("1.2.1", VersionNumbers.increment("1.2", IncrementType.PATCH));
            assertEquals("1.3.0", VersionNumbers.increment("1.2", IncrementType.MINOR));
        }

        @Test
        @DisplayName("unparseable input gets .1 appended")
        void fallbackAppendsSuffix() {
            assertEquals("abc.1", VersionNumbers.increment("abc", IncrementType.PATCH));
            assertEquals("1.2.3.4.1", VersionNumbers.increment("1.2.3.4", IncrementType.PATCH));
            assertEquals("1.x.3.1", VersionNumbers.increment("1.x.3", IncrementType.PATCH));
        }

        @Test
        void nullAndEmptyDoNotThrow() {
            assertEquals(".1", VersionNumbers.increment(null, IncrementType.PATCH));
            assertEquals(".1", VersionNumbers.increment("", IncrementType.PATCH));
        }

        @Test
        @DisplayName("unknown increment name falls back to patch")
        void unknownTypeNameIsPatch() {
            assertEquals("1.2.4", VersionNumbers.increment("1.2.3", "whatever"));
            assertEquals("2.0.0", VersionNumbers.increment("1.2.3", "MAJOR"));
        }
    }

    @Nested
    @DisplayName("parseExact")
    class ParseExact {

        @Test
        void acceptsTriplet() {
            var triplet = VersionNumbers.parseExact("1.1.0");
            assertTrue(triplet.isPresent());
            assertEquals(10100, triplet.get().androidVersionCode());
        }

        @Test
        void rejectsBuildSuffixAndShortVersions() {
            assertTrue(VersionNumbers.parseExact("1.2.3+4").isEmpty());
            assertTrue(VersionNumbers.parseExact("1.2").isEmpty());
            assertTrue(VersionNumbers.parseExact(null).isEmpty());
        }

        @Test
        void versionCodeFormula() {
            assertEquals(20304, new VersionNumbers.Triplet(2, 3, 4).androidVersionCode());
        }

        @Test
        void versionCodeOverflowThrows() {
            var triplet = new VersionNumbers.Triplet(214749, 0, 0);
            assertThrows(ArithmeticException.class, triplet::androidVersionCode);
        }
    }
}
