package com.williamcallahan.agentknowledge.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class EntryKindTest {

    @Test
    void parsesWireNamesLeniently() {
        assertEquals(EntryKind.BUG, EntryKind.fromWireName("bug"));
        assertEquals(EntryKind.SOLUTION, EntryKind.fromWireName(" Solution "));
        assertEquals(EntryKind.DOC, EntryKind.fromWireName("DOC"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "incident", "bugs"})
    void rejectsMissingOrUnknownKinds(String rawKind) {
        assertThrows(IllegalArgumentException.class, () -> EntryKind.fromWireName(rawKind));
    }

    @Test
    void severityIsOptionalButStrict() {
        assertEquals(Severity.CRITICAL, Severity.parseOptional("Critical").orElseThrow());
        assertEquals(false, Severity.parseOptional(" ").isPresent());
        assertThrows(IllegalArgumentException.class, () -> Severity.parseOptional("sev1"));
    }
}
