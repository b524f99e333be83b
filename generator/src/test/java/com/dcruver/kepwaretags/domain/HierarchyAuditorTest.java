package com.dcruver.kepwaretags.domain;

import com.dcruver.kepwaretags.domain.AuditFinding.FindingType;
import com.dcruver.kepwaretags.domain.AuditFinding.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyAuditorTest {

    private HierarchyAuditor auditor;
    private Hierarchy hierarchy;
    private NodeId root;

    @BeforeEach
    void setUp() {
        auditor = new HierarchyAuditor(new TagFlattener());
        hierarchy = new Hierarchy();
        root = hierarchy.getRootId();
    }

    @Test
    void testCleanHierarchyHasNoFindings() {
        NodeId line1 = hierarchy.addFolder(root, "Line1");
        hierarchy.addTag(line1, "Speed", TagDataType.INTEGER);

        assertTrue(auditor.audit(hierarchy).isEmpty());
    }

    @Test
    void testEmptyHierarchyReportsNoTags() {
        hierarchy.addFolder(root, "Line1");

        List<AuditFinding> findings = auditor.audit(hierarchy);

        assertTrue(hasFinding(findings, FindingType.NO_TAGS));
        assertTrue(hasFinding(findings, FindingType.EMPTY_FOLDER));
        assertEquals(Severity.ERROR, findings.stream()
            .filter(f -> f.getType() == FindingType.NO_TAGS)
            .findFirst().orElseThrow().getSeverity());
    }

    @Test
    void testDuplicateSiblingsAndFullNames() {
        NodeId line1 = hierarchy.addFolder(root, "Line1");
        NodeId other = hierarchy.addFolder(root, "LINE1");
        hierarchy.addTag(line1, "Speed", TagDataType.INTEGER);
        hierarchy.addTag(other, "speed", TagDataType.INTEGER);

        List<AuditFinding> findings = auditor.audit(hierarchy);

        AuditFinding sibling = findings.stream()
            .filter(f -> f.getType() == FindingType.DUPLICATE_SIBLING_NAME)
            .findFirst().orElseThrow();
        assertEquals(other, sibling.getNodeId());
        assertTrue(hasFinding(findings, FindingType.DUPLICATE_FULL_NAME));
        assertEquals(1, findings.stream().filter(f -> f.getType() == FindingType.DUPLICATE_FULL_NAME).count());
    }

    @Test
    void testSiblingDuplicatesMatchNameCheck() {
        hierarchy.addFolder(root, "i");
        NodeId dotted = hierarchy.addFolder(root, "\u0130");

        List<AuditFinding> findings = auditor.audit(hierarchy);

        assertEquals(dotted, findings.stream()
            .filter(f -> f.getType() == FindingType.DUPLICATE_SIBLING_NAME)
            .findFirst().orElseThrow().getNodeId());
        assertTrue(hierarchy.findChild(root, "\u0130").isPresent());
    }

    @Test
    void testUnsafeCharactersAndDots() {
        NodeId folder = hierarchy.addFolder(root, "Line,1");
        NodeId tag = hierarchy.addTag(folder, "Motor.Speed", TagDataType.INTEGER);

        List<AuditFinding> findings = auditor.audit(hierarchy);

        assertEquals(folder, findings.stream()
            .filter(f -> f.getType() == FindingType.UNSAFE_CSV_CHARACTERS)
            .findFirst().orElseThrow().getNodeId());
        AuditFinding dot = findings.stream()
            .filter(f -> f.getType() == FindingType.DOT_IN_NAME)
            .findFirst().orElseThrow();
        assertEquals(tag, dot.getNodeId());
        assertEquals("Line,1/Motor.Speed", dot.getPath());
    }

    @Test
    void testAuditDoesNotChangeHierarchy() {
        NodeId line1 = hierarchy.addFolder(root, "Line1");
        hierarchy.addFolder(root, "line1");
        hierarchy.addTag(line1, "A,B", TagDataType.STRING);
        int size = hierarchy.size();

        auditor.audit(hierarchy);

        assertEquals(size, hierarchy.size());
        assertEquals(2, hierarchy.getChildren(root).size());
    }

    @Test
    void testUnsafeCharacterDetection() {
        assertTrue(HierarchyAuditor.hasUnsafeCsvCharacters("a,b"));
        assertTrue(HierarchyAuditor.hasUnsafeCsvCharacters("say \"hi\""));
        assertTrue(HierarchyAuditor.hasUnsafeCsvCharacters("two\nlines"));
        assertFalse(HierarchyAuditor.hasUnsafeCsvCharacters("Line1.Speed"));
    }

    private static boolean hasFinding(List<AuditFinding> findings, FindingType type) {
        return findings.stream().anyMatch(f -> f.getType() == type);
    }
}
