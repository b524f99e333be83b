package com.dcruver.kepwaretags.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TagDataTypeTest {

    @Test
    void testParseIgnoresCaseAndWhitespace() {
        assertEquals(TagDataType.INTEGER, TagDataType.parse(" integer "));
        assertEquals(TagDataType.BOOLEAN, TagDataType.parse("BOOLEAN"));
        assertEquals(TagDataType.STRING, TagDataType.parse("String"));
        assertThrows(IllegalArgumentException.class, () -> TagDataType.parse("Float"));
        assertThrows(IllegalArgumentException.class, () -> TagDataType.parse(" "));
    }

    @Test
    void testJsonValuesAcceptNamesAndOrdinals() {
        assertEquals(TagDataType.STRING, TagDataType.fromJson(0));
        assertEquals(TagDataType.INTEGER, TagDataType.fromJson(1));
        assertEquals(TagDataType.BOOLEAN, TagDataType.fromJson(2));
        assertEquals(TagDataType.BOOLEAN, TagDataType.fromJson("Boolean"));
        assertThrows(IllegalArgumentException.class, () -> TagDataType.fromJson(3));
        assertThrows(IllegalArgumentException.class, () -> TagDataType.fromJson(1.5));
        assertThrows(IllegalArgumentException.class, () -> TagDataType.fromJson(true));
    }

    @Test
    void testCsvNamesAreLowerCase() {
        assertEquals("string", TagDataType.STRING.getCsvName());
        assertEquals("integer", TagDataType.INTEGER.getCsvName());
        assertEquals("boolean", TagDataType.BOOLEAN.getCsvName());
    }
}
