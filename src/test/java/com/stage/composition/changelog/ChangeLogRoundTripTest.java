package com.stage.composition.changelog;

import com.stage.composition.core.model.CommitEntry;
import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.core.model.Prim;
import com.stage.composition.edit.EditResult;
import com.stage.composition.parse.PrimParser;
import com.stage.composition.security.ActorRole;
import com.stage.composition.security.StageContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeLogRoundTripTest {

    private static final StageContext ALICE = StageContext.of("alice", ActorRole.ARCHITECT);

    private ChangeLedger ledger;
    private ChangeLogWriter writer;
    private ChangeLogParser parser;

    @BeforeEach
    void setUp() {
        ledger = new ChangeLedger(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        writer = new ChangeLogWriter();
        parser = new ChangeLogParser();
    }

    @Test
    @DisplayName("Should create the change-log root in an empty layer")
    void testScaffold() {
        CommitEntry entry = ledger.recordCommit(ALICE, "walls.usda", "", "/Wall", List.of("/Wall"),
                LayerStatus.DRAFT, null);

        EditResult result = writer.append("", entry);

        assertTrue(result.isApplied());
        assertTrue(result.text().startsWith("#usda 1.0\n\nover \"ChangeLog\"\n{\n"));
        assertTrue(new PrimParser().parse(result.text())
                .find("/ChangeLog/Log_" + entry.id()).isPresent());
    }

    @Test
    @DisplayName("Should keep existing content and reuse an existing root")
    void testExistingRoot() {
        String existing = "#usda 1.0\nover \"ChangeLog\"\n{\n}\n\nover \"Wall\"\n{\n    custom string primvars:material = \"oak\"\n}\n";
        CommitEntry entry = ledger.recordCommit(ALICE, "walls.usda", "", "/Wall", List.of("/Wall"),
                LayerStatus.DRAFT, null);

        String text = writer.append(existing, entry).text();

        assertEquals(1, text.split("over \"ChangeLog\"", -1).length - 1);
        assertTrue(text.contains("custom string primvars:material = \"oak\""));
        assertEquals(1, parser.parse(text).size());
    }

    @Test
    @DisplayName("Should read back exactly what was written")
    void testRoundTrip() {
        CommitEntry commit = ledger.recordCommit(ALICE, "walls.usda", "def \"Wall\" {}", "/Wall",
                List.of("/Wall", "/Wall/Door"), LayerStatus.SHARED, "Wall");
        CommitEntry rename = ledger.recordRename(ALICE, "walls.usda", "def \"Partition\" {}", "/Wall", "/Partition");
        CommitEntry promotion = ledger.recordPromotion(ALICE, "walls.usda", "", List.of(),
                LayerStatus.SHARED, LayerStatus.PUBLISHED, null);

        String text = writer.append("", commit).text();
        text = writer.append(text, rename).text();
        text = writer.append(text, promotion).text();
        CommitHistory history = parser.parse(text);

        assertEquals(3, history.size());
        assertEquals(commit, history.get(commit.id()).orElseThrow());
        assertEquals(rename, history.get(rename.id()).orElseThrow());
        assertEquals(promotion, history.get(promotion.id()).orElseThrow());
        assertEquals(List.of(commit.id()), history.roots());
        assertEquals(promotion.id(), history.latest().orElseThrow().id());
    }

    @Test
    @DisplayName("Should read the prims serialized with an entry as roots")
    void testEntryPrims() {
        CommitEntry entry = CommitEntry.builder(ledger.recordCommit(ALICE, "walls.usda", "", "/World/Wall",
                        List.of("/World/Wall"), LayerStatus.DRAFT, null))
                .prims(List.of(Prim.builder().path("/Wall").type("Mesh").build()))
                .build();

        CommitEntry parsed = parser.parse(writer.append("", entry).text()).get(entry.id()).orElseThrow();

        assertEquals(1, parsed.prims().size());
        assertEquals("/Wall", parsed.prims().get(0).getPath());
        assertEquals("Mesh", parsed.prims().get(0).getType());
    }

    @Test
    @DisplayName("Should keep entries before a malformed block")
    void testMalformedTail() {
        CommitEntry entry = ledger.recordCommit(ALICE, "walls.usda", "", "/Wall", List.of(), LayerStatus.DRAFT, null);
        String text = writer.append("", entry).text() + "\ndef \"Log_broken\"\n{\n    custom int entry = 9\n";

        CommitHistory history = parser.parse(text);

        assertEquals(1, history.size());
        assertTrue(history.get("broken").isEmpty());
    }

    @Test
    @DisplayName("Should treat empty and null tokens as absent and derive missing sequences")
    void testLegacyFields() {
        String text = """
                over "ChangeLog"
                {
                    def "Log_legacy"
                    {
                        custom string timestamp = "2024-01-01T00:00:00Z"
                        custom string user = ""
                        custom string sourceStatus = "null"
                        custom string oldName = "Wall"
                        custom string type = "Rename"
                    }
                }
                """;

        CommitEntry entry = parser.parse(text).get("legacy").orElseThrow();

        assertNull(entry.author());
        assertNull(entry.sourceStatus());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z").toEpochMilli(), entry.sequence());
        assertEquals("Wall", entry.oldName());
        assertTrue(entry.isRename());
        assertTrue(parser.parse("").isEmpty());
    }
}
