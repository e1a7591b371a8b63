package com.raditha.tokenizer.mapping;

import com.raditha.tokenizer.model.MappingEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TokenMappingTest {

    private TokenMapping mapping;

    @BeforeEach
    void setUp() {
        mapping = new TokenMapping();
    }

    @Test
    void testForwardAndReverseLookup() {
        mapping.put("1", "111-22-3333");

        assertEquals(Optional.of("111-22-3333"), mapping.valueFor("1"));
        assertEquals(Optional.of("1"), mapping.tokenFor("111-22-3333"));
        assertTrue(mapping.containsToken("1"));
        assertFalse(mapping.containsToken("111-22-3333"));
    }

    @Test
    void testUnknownLookupsAreEmpty() {
        assertTrue(mapping.isEmpty());
        assertTrue(mapping.valueFor("1").isEmpty());
        assertTrue(mapping.tokenFor("Alice").isEmpty());
    }

    @Test
    void testEntriesKeepInsertionOrder() {
        mapping.put("b", "2");
        mapping.put("a", "1");
        mapping.put("c", "3");

        assertEquals(List.of(
                new MappingEntry("b", "2"),
                new MappingEntry("a", "1"),
                new MappingEntry("c", "3")), mapping.entries());
    }

    @Test
    void testLaterRowOverridesToken() {
        mapping.put("1", "old");
        mapping.put("1", "new");

        assertEquals(1, mapping.size());
        assertEquals(Optional.of("new"), mapping.valueFor("1"));
        assertEquals(Optional.of("1"), mapping.tokenFor("new"));
        assertTrue(mapping.tokenFor("old").isEmpty());
    }

    @Test
    void testReverseIndexKeepsFirstTokenForDuplicatedValue() {
        mapping.put("1", "Alice");
        mapping.put("2", "Alice");

        assertEquals(Optional.of("1"), mapping.tokenFor("Alice"));
        assertEquals(Optional.of("Alice"), mapping.valueFor("2"));
    }

    @Test
    void testOverwrittenTokenFallsBackToOtherTokenForValue() {
        mapping.put("1", "Alice");
        mapping.put("2", "Alice");
        mapping.put("1", "Bob");

        assertEquals(Optional.of("2"), mapping.tokenFor("Alice"));
        assertEquals(Optional.of("1"), mapping.tokenFor("Bob"));
    }

    @Test
    void testOverwritingEarlierTokenWithSharedValueMovesReverseIndex() {
        mapping.put("A", "x");
        mapping.put("B", "y");
        mapping.put("A", "y");

        assertEquals(Optional.of("A"), mapping.tokenFor("y"));
        assertTrue(mapping.tokenFor("x").isEmpty());
        assertEquals(List.of(new MappingEntry("A", "y"), new MappingEntry("B", "y")), mapping.entries());
    }

    @Test
    void testOverwritingLaterTokenKeepsEarlierIndex() {
        mapping.put("A", "y");
        mapping.put("B", "x");
        mapping.put("B", "y");

        assertEquals(Optional.of("A"), mapping.tokenFor("y"));
        assertTrue(mapping.tokenFor("x").isEmpty());
    }

    @Test
    void testEmptyStringIsAValue() {
        mapping.put("7", "");
        assertEquals(Optional.of("7"), mapping.tokenFor(""));
    }
}
