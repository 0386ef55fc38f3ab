package com.questrail.echoprobe.port;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PortSpecParserTest {

    private final PortSpecParser parser = new PortSpecParser();

    @Test
    void rangeResolvesInclusiveAscending() throws Exception {
        assertEquals(List.of(8000, 8001, 8002), parser.resolve("8000-8002"));
    }

    @Test
    void singlePortResolvesToItself() throws Exception {
        assertEquals(List.of(80), parser.resolve("80"));
        assertTrue(parser.parse("80").isSingle());
    }

    @Test
    void degenerateRangeResolvesToOnePort() throws Exception {
        assertEquals(List.of(443), parser.resolve("443-443"));
    }

    @Test
    void invertedRangeResolvesToEmptyList() throws Exception {
        PortSpec spec = parser.parse("9000-8000");

        assertTrue(spec.isEmpty());
        assertEquals(List.of(), parser.resolve("9000-8000"));
    }

    @Test
    void surroundingWhitespaceIsIgnored() throws Exception {
        assertEquals(List.of(22), parser.resolve("  22 "));
        assertEquals(List.of(10, 11), parser.resolve(" 10 - 11 "));
    }

    @Test
    void boundaryPortsAreAccepted() throws Exception {
        assertEquals(List.of(0), parser.resolve("0"));
        assertEquals(List.of(65535), parser.resolve("65535"));
    }

    @Test
    void nonNumericSpecIsMalformed() {
        MalformedPortSpecException e =
                assertThrows(MalformedPortSpecException.class, () -> parser.resolve("abc"));
        assertEquals("abc", e.spec());
    }

    @Test
    void malformedSpecsAreRejectedNotDefaulted() {
        for (String bad : List.of("", "   ", "-", "80-", "-80", "1-2-3", "65536", "99999999999",
                "+80", "8o", "80 81", "\u0661\u0662")) {
            assertThrows(MalformedPortSpecException.class, () -> parser.resolve(bad),
                    () -> "expected rejection of '" + bad + "'");
        }
    }

    @Test
    void nullSpecIsMalformed() {
        assertThrows(MalformedPortSpecException.class, () -> parser.parse(null));
    }

    @Test
    void toStringRendersCanonicalForm() throws Exception {
        assertEquals("8000-8002", parser.parse(" 8000 - 8002").toString());
        assertEquals("80", parser.parse("80").toString());
    }

    @Test
    void portSpecRejectsOutOfRangeBounds() {
        assertThrows(IllegalArgumentException.class, () -> new PortSpec(-1, 5));
        assertThrows(IllegalArgumentException.class, () -> new PortSpec(5, 70000));
    }
}
