package com.stage.composition.conflict;

import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Property;
import com.stage.composition.core.model.Provenance;
import com.stage.composition.layer.LayerStack;
import com.stage.composition.parse.PrimParser;
import com.stage.composition.resolve.Stage;
import com.stage.composition.security.ActorRole;
import com.stage.composition.security.StageContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorTest {

    private static final StageContext AS_ALICE = StageContext.of("alice", ActorRole.ARCHITECT);
    private static final StageContext AS_BOB = StageContext.of("bob", ActorRole.ARCHITECT);

    private ConflictDetector detector;
    private Stage stage;
    private Prim wall;

    @BeforeEach
    void setUp() {
        detector = new ConflictDetector(new PrimParser(), "statement.usda");

        LayerStack stack = new LayerStack();
        stack.add(LayerStack.createLayer("walls.usda", LayerStatus.SHARED));
        stack.add(LayerStack.createLayer("other.usda", LayerStatus.DRAFT));
        stack.setOwner("walls.usda", "bob");
        stage = new Stage(stack);
        stage.putText("walls.usda", "def \"Wall\"\n{\n    custom string primvars:material = \"brick\"\n}\n");
        stage.putText("other.usda", "over \"Wall\"\n{\n    custom string primvars:material = \"stone\"\n}\n");
        stage.putText("statement.usda", """
                over "ChangeLog"
                {
                }
                over "Wall"
                {
                    custom string primvars:material = "oak"
                }
                """);

        wall = Prim.builder().path("/Wall")
                .property("material", Property.of("primvars:material", "brick"))
                .provenance(Provenance.of("walls.usda", "/Wall", LayerStatus.SHARED))
                .build();
    }

    private static List<ConflictType> types(List<Conflict> conflicts) {
        return conflicts.stream().map(Conflict::type).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should report nothing when the value does not change")
    void testUnchangedValue() {
        assertTrue(detector.detect(wall, "material", "brick", stage, AS_ALICE).isEmpty());
        assertTrue(detector.detect(wall, "missing", null, stage, AS_ALICE).isEmpty());
    }

    @Test
    @DisplayName("Should report every conflict kind in check order")
    void testAllConflicts() {
        List<Conflict> conflicts = detector.detect(wall, "material", "glass", stage, AS_ALICE);

        assertEquals(List.of(ConflictType.OWNERSHIP, ConflictType.SOURCE_DEFINITION,
                ConflictType.STAGED_OVERRIDE, ConflictType.MULTI_LAYER_DEFINITION), types(conflicts));

        Conflict ownership = conflicts.get(0);
        assertEquals("layer", ownership.source());
        assertEquals("walls.usda", ownership.file());
        assertEquals("bob", ownership.owner());
        assertEquals("brick", ownership.currentValue());

        Conflict source = conflicts.get(1);
        assertEquals("brick", source.currentValue());
        assertEquals("bob", source.owner());

        Conflict staged = conflicts.get(2);
        assertEquals("statement", staged.source());
        assertEquals(Conflict.STAGED_OWNER, staged.owner());
        assertEquals("oak", staged.currentValue());

        Conflict multi = conflicts.get(3);
        assertEquals("multiple_layers", multi.source());
        assertNull(multi.file());
        assertEquals(List.of(
                new Conflict.LayerDefinition("walls.usda", "bob", "brick"),
                new Conflict.LayerDefinition("other.usda", Conflict.UNKNOWN_OWNER, "stone")), multi.layers());
    }

    @Test
    @DisplayName("Should not report ownership to the owner")
    void testOwnerEditing() {
        List<Conflict> conflicts = detector.detect(wall, "material", "glass", stage, AS_BOB);

        assertEquals(List.of(ConflictType.SOURCE_DEFINITION, ConflictType.STAGED_OVERRIDE,
                ConflictType.MULTI_LAYER_DEFINITION), types(conflicts));
    }

    @Test
    @DisplayName("Should look up the source prim by path only")
    void testSourceLookupByPath() {
        stage.putText("statement.usda", "");
        stage.getLayerStack().remove("other.usda");
        stage.putText("walls.usda", """
                def Xform "World"
                {
                    def Xform "A"
                    {
                        def Mesh "Wall"
                        {
                            custom string primvars:material = "brick"
                        }
                    }
                    def Xform "B"
                    {
                    }
                }
                """);
        Prim stray = Prim.builder().path("/World/B/Wall")
                .property("material", Property.of("primvars:material", "brick"))
                .provenance(Provenance.of("walls.usda", "/World/B/Wall", LayerStatus.SHARED))
                .build();
        Prim declared = Prim.builder().path("/World/A/Wall")
                .property("material", Property.of("primvars:material", "brick"))
                .provenance(Provenance.of("walls.usda", "/World/A/Wall", LayerStatus.SHARED))
                .build();

        assertTrue(detector.detect(stray, "material", "glass", stage, AS_BOB).isEmpty());

        List<Conflict> conflicts = detector.detect(declared, "material", "glass", stage, AS_BOB);
        assertEquals(List.of(ConflictType.SOURCE_DEFINITION), types(conflicts));
        assertEquals("brick", conflicts.get(0).currentValue());
    }

    @Test
    @DisplayName("Should treat the empty string as a value of its own")
    void testEmptyStringCandidate() {
        List<Conflict> conflicts = detector.detect(wall, "material", "", stage, AS_BOB);

        assertEquals(List.of(ConflictType.SOURCE_DEFINITION, ConflictType.STAGED_OVERRIDE,
                ConflictType.MULTI_LAYER_DEFINITION), types(conflicts));
        assertEquals("brick", conflicts.get(0).currentValue());

        Prim blank = Prim.builder().path("/Wall")
                .property("material", Property.of("primvars:material", ""))
                .provenance(Provenance.of("walls.usda", "/Wall", LayerStatus.SHARED))
                .build();
        assertTrue(detector.detect(blank, "material", "", stage, AS_ALICE).isEmpty());
        assertFalse(detector.detect(blank, "material", null, stage, AS_BOB).isEmpty());
    }

    @Test
    @DisplayName("Should use the unknown owner for unowned source layers")
    void testUnownedSource() {
        stage.putText("statement.usda", "");
        stage.putText("walls.usda", "def \"Other\"\n{\n}\n");
        Prim prim = Prim.builder().path("/Wall")
                .provenance(Provenance.of("other.usda", null, LayerStatus.DRAFT))
                .build();

        List<Conflict> conflicts = detector.detect(prim, "material", "glass", stage, AS_ALICE);

        assertEquals(1, conflicts.size());
        assertEquals(ConflictType.SOURCE_DEFINITION, conflicts.get(0).type());
        assertEquals(Conflict.UNKNOWN_OWNER, conflicts.get(0).owner());
        assertEquals("stone", conflicts.get(0).currentValue());
    }

    @Test
    @DisplayName("Should ignore layers that fail to parse")
    void testMalformedLayerIgnored() {
        stage.putText("statement.usda", "over \"Wall\" {");
        stage.putText("other.usda", "def \"Wall\" {");

        List<Conflict> conflicts = detector.detect(wall, "material", "glass", stage, AS_BOB);

        assertEquals(List.of(ConflictType.SOURCE_DEFINITION), types(conflicts));
    }

    @Test
    @DisplayName("Should expose stable conflict codes")
    void testCodes() {
        assertEquals("ownership", ConflictType.OWNERSHIP.code());
        assertEquals("multi_layer_definition", ConflictType.MULTI_LAYER_DEFINITION.code());
    }
}
