package com.dcruver.kepwaretags.export;

import com.dcruver.kepwaretags.domain.Hierarchy;
import com.dcruver.kepwaretags.domain.NodeId;
import com.dcruver.kepwaretags.domain.TagDataType;
import com.dcruver.kepwaretags.domain.TagFlattener;
import com.dcruver.kepwaretags.domain.TagRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Kepware CSV rendering. Assertions work on logical rows unless the line ending is under test.
 */
class CsvExporterTest {

    private final CsvExporter exporter = new CsvExporter();

    @Test
    void testLineScenarioProducesExpectedRows() {
        Hierarchy hierarchy = new Hierarchy();
        NodeId line1 = hierarchy.addFolder(hierarchy.getRootId(), "Line1");
        hierarchy.addTag(line1, "Speed", TagDataType.INTEGER);
        hierarchy.addTag(line1, "Running", TagDataType.BOOLEAN);

        List<TagRecord> tags = new TagFlattener().flatten(hierarchy);
        List<String> rows = exporter.export(tags).lines().toList();

        assertEquals(3, rows.size());
        assertEquals(CsvExporter.HEADER, rows.get(0));
        assertEquals("Line1.Speed,D0000,integer,1,R/W,100,,,,,,,,,,,", rows.get(1));
        assertEquals("Line1.Running,D0000.0,boolean,1,R/W,100,,,,,,,,,,,", rows.get(2));
    }

    @Test
    void testHeaderHasSeventeenColumnsInOrder() {
        String[] columns = CsvExporter.HEADER.split(",", -1);

        assertEquals(17, columns.length);
        assertEquals("Tag Name", columns[0]);
        assertEquals("Address", columns[1]);
        assertEquals("Data Type", columns[2]);
        assertEquals("Negate Value", columns[16]);
    }

    @Test
    void testEveryRowHasSeventeenColumns() {
        String csv = exporter.export(List.of(
            new TagRecord("A", TagDataType.STRING),
            new TagRecord("B", TagDataType.INTEGER),
            new TagRecord("C", TagDataType.BOOLEAN)));

        for (String row : csv.lines().toList()) {
            assertEquals(17, row.split(",", -1).length, row);
        }
    }

    @Test
    void testAddressesFollowListOrderPerType() {
        List<String> rows = exporter.export(List.of(
            new TagRecord("Name", TagDataType.STRING),
            new TagRecord("Count", TagDataType.INTEGER),
            new TagRecord("Label", TagDataType.STRING),
            new TagRecord("Flag", TagDataType.BOOLEAN))).lines().toList();

        assertTrue(rows.get(1).startsWith("Name,S001,string,"));
        assertTrue(rows.get(2).startsWith("Count,D0000,integer,"));
        assertTrue(rows.get(3).startsWith("Label,S002,string,"));
        assertTrue(rows.get(4).startsWith("Flag,D0000.0,boolean,"));
    }

    @Test
    void testEachExportStartsFreshAddresses() {
        List<TagRecord> tags = List.of(new TagRecord("Speed", TagDataType.INTEGER));

        assertEquals(exporter.export(tags), exporter.export(tags));
    }

    @Test
    void testEmptyTagListIsRejected() {
        assertThrows(NoTagsException.class, () -> exporter.export(List.of()));
    }

    @Test
    void testLineEndings() {
        List<TagRecord> tags = List.of(new TagRecord("Speed", TagDataType.INTEGER));

        String crlf = new CsvExporter(LineEnding.CRLF).export(tags);
        assertEquals(CsvExporter.HEADER + "\r\nSpeed,D0000,integer,1,R/W,100,,,,,,,,,,,\r\n", crlf);

        String lf = new CsvExporter(LineEnding.LF).export(tags);
        assertEquals(CsvExporter.HEADER + "\nSpeed,D0000,integer,1,R/W,100,,,,,,,,,,,\n", lf);
    }

    @Test
    void testNamesAreWrittenUnquoted() {
        String csv = exporter.export(List.of(new TagRecord("Line \"A\".Speed", TagDataType.STRING)));

        assertEquals("Line \"A\".Speed,S001,string,1,R/W,100,,,,,,,,,,,", csv.lines().toList().get(1));
    }
}
