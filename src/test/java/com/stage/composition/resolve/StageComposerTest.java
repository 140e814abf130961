package com.stage.composition.resolve;

import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Provenance;
import com.stage.composition.layer.LayerStack;
import com.stage.composition.merge.LayerMerger;
import com.stage.composition.parse.PrimParser;
import com.stage.composition.security.ActorRole;
import com.stage.composition.security.StageContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StageComposerTest {

    private static final String ALICE = """
            def Xform "Alice"
            {
                custom string primvars:displayName = "A"
                def "Room"
                {
                }
            }
            """;

    private static final String ALICE_V2 = """
            def Xform "Alice"
            {
                custom string primvars:displayName = "A2"
                def "Room"
                {
                    custom string primvars:paint = "blue"
                }
                def "Hall"
                {
                }
            }
            def "Annex"
            {
            }
            """;

    private static final StageContext AS_ALICE = StageContext.of("alice", ActorRole.ARCHITECT);
    private static final StageContext AS_BOB = StageContext.of("bob", ActorRole.STRUCTURAL_ENGINEER);
    private static final StageContext AS_MANAGER = StageContext.forRole(ActorRole.PROJECT_MANAGER);

    private Stage stage;
    private StageComposer composer;

    @BeforeEach
    void setUp() {
        PrimParser parser = new PrimParser();
        composer = new StageComposer(parser, new LayerMerger(parser), new ReferenceResolver(), "statement.usda");

        LayerStack stack = new LayerStack();
        stack.add(LayerStack.createLayer("shared.usda", LayerStatus.PUBLISHED));
        stack.add(LayerStack.createLayer("alice.usda", LayerStatus.DRAFT));
        stack.add(LayerStack.createLayer("bob.usda", LayerStatus.SHARED));
        stack.setOwner("alice.usda", "alice");
        stack.setOwner("bob.usda", "bob");

        stage = new Stage(stack);
        stage.putText("shared.usda", "def \"Site\"\n{\n}\n");
        stage.putText("alice.usda", ALICE);
        stage.putText("bob.usda", "def \"Bob\"\n{\n}\n");
        assertTrue(composer.stageFromStack(stage).isEmpty());
    }

    private static List<String> rootNames(ResolutionResult result) {
        return result.roots().stream().map(Prim::getName).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Staging")
    class StagingTests {

        @Test
        @DisplayName("Should stage every visible layer stamped with its provenance")
        void testStageFromStack() {
            assertEquals(3, stage.getStagedPrims().size());
            Prim room = stage.getStagedPrims().get(1).getChildren().get(0);
            assertEquals(Provenance.of("alice.usda", "/Alice/Room", LayerStatus.DRAFT), room.getProvenance().orElseThrow());
        }

        @Test
        @DisplayName("Should skip hidden, unloaded, malformed and change-log layers")
        void testSkippedLayers() {
            LayerStack stack = stage.getLayerStack();
            stack.setVisible("bob.usda", false);
            stack.add(LayerStack.createLayer("statement.usda"));
            stack.add(LayerStack.createLayer("unloaded.usda"));
            stack.add(LayerStack.createLayer("broken.usda"));
            stage.putText("statement.usda", "over \"ChangeLog\"\n{\n}\n");
            stage.putText("broken.usda", "def \"Broken\" {");

            List<String> warnings = composer.stageFromStack(stage);

            assertEquals(2, warnings.size());
            assertEquals("Layer 'unloaded.usda' is in the stack but not loaded", warnings.get(0));
            assertTrue(warnings.get(1).startsWith("Layer 'broken.usda' skipped"));
            assertEquals(List.of("Site", "Alice"),
                    stage.getStagedPrims().stream().map(Prim::getName).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should let stronger layers override weaker ones")
        void testStrongerLayerWins() {
            stage.getLayerStack().add(LayerStack.createLayer("fix.usda", LayerStatus.SHARED));
            stage.putText("fix.usda", "over \"Alice\"\n{\n    custom string primvars:displayName = \"Fixed\"\n}\n");

            composer.stageFromStack(stage);

            Prim alice = stage.getStagedPrims().get(1);
            assertEquals("Fixed", alice.getPropertyText("displayName").orElseThrow());
            assertEquals("fix.usda", alice.getProvenance().orElseThrow().sourceFile());
        }
    }

    @Nested
    @DisplayName("Visibility")
    class VisibilityTests {

        @Test
        @DisplayName("Should hide layers owned by someone else")
        void testOwnerVisibility() {
            assertEquals(List.of("Site", "Alice"), rootNames(composer.compose(stage, AS_ALICE)));
            assertEquals(List.of("Site", "Bob"), rootNames(composer.compose(stage, AS_BOB)));
        }

        @Test
        @DisplayName("Should show everything to the project manager")
        void testManagerSeesAll() {
            assertEquals(List.of("Site", "Alice", "Bob"), rootNames(composer.compose(stage, AS_MANAGER)));
        }

        @Test
        @DisplayName("Should cache per context and drop the cache on change")
        void testCompositionCache() {
            ResolutionResult first = composer.compose(stage, AS_ALICE);
            assertSame(first, composer.compose(stage, AS_ALICE));

            ResolutionResult forBob = composer.compose(stage, AS_BOB);
            assertNotSame(first, forBob);

            stage.putText("bob.usda", "def \"Bob\"\n{\n}\n");
            assertFalse(stage.hasCachedComposition());
        }
    }

    @Nested
    @DisplayName("References across layers")
    class ReferenceTests {

        private Stage referencing;

        @BeforeEach
        void setUp() {
            LayerStack stack = new LayerStack();
            stack.add(LayerStack.createLayer("A.usda", LayerStatus.PUBLISHED));
            stack.add(LayerStack.createLayer("B.usda", LayerStatus.SHARED));
            stack.setOwner("B.usda", "alice");

            referencing = new Stage(stack);
            referencing.putText("A.usda", """
                    def Xform "World"
                    {
                        custom token primvars:status = "Published"
                    }
                    """);
            referencing.putText("B.usda", """
                    over "World" (
                        prepend references = @A.usda@</World>
                    )
                    {
                    }
                    """);
            assertTrue(composer.stageFromStack(referencing).isEmpty());
        }

        @Test
        @DisplayName("Should drop the referencing root for an actor who does not own it")
        void testHiddenFromOthers() {
            assertTrue(composer.compose(referencing, AS_BOB).roots().isEmpty());
        }

        @Test
        @DisplayName("Should resolve the referencing root to the target layer for the owner")
        void testResolvedForOwner() {
            ResolutionResult result = composer.compose(referencing, AS_ALICE);

            assertTrue(result.warnings().isEmpty());
            Prim world = result.find("/World").orElseThrow();
            assertEquals("A.usda", world.getProvenance().orElseThrow().sourceFile());
            assertEquals(LayerStatus.PUBLISHED, world.getProvenance().orElseThrow().sourceLayerStatus());
            assertEquals("Published", world.getPropertyText("status").orElseThrow());
        }

        @Test
        @DisplayName("Should resolve the referencing root for a privileged role")
        void testResolvedForManager() {
            Prim world = composer.compose(referencing, AS_MANAGER).find("/World").orElseThrow();

            assertEquals(Provenance.of("A.usda", "/World", LayerStatus.PUBLISHED), world.getProvenance().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Refresh")
    class RefreshTests {

        @Test
        @DisplayName("Should merge a whole layer into the staged tree")
        void testRefreshLayer() {
            stage.putText("alice.usda", ALICE_V2);

            ResolutionResult result = composer.refresh(stage, "alice.usda", null, AS_ALICE);

            assertEquals("A2", result.find("/Alice").orElseThrow().getPropertyText("displayName").orElseThrow());
            assertEquals("blue", result.find("/Alice/Room").orElseThrow().getPropertyText("paint").orElseThrow());
            Prim hall = result.find("/Alice/Hall").orElseThrow();
            assertEquals("alice.usda", hall.getProvenance().orElseThrow().sourceFile());
            assertTrue(result.find("/Annex").isPresent());
        }

        @Test
        @DisplayName("Should prune roots that left the layer")
        void testRefreshPrunes() {
            stage.putText("alice.usda", "def \"Annex\"\n{\n}\n");

            ResolutionResult result = composer.refresh(stage, "alice.usda", null, AS_MANAGER);

            assertTrue(result.find("/Alice").isEmpty());
            assertTrue(result.find("/Annex").isPresent());
            assertTrue(result.find("/Bob").isPresent());
        }

        @Test
        @DisplayName("Should merge only the given prim at its own level")
        void testRefreshSinglePrim() {
            stage.putText("alice.usda", ALICE_V2);

            ResolutionResult result = composer.refresh(stage, "alice.usda", "/Alice/Room", AS_ALICE);

            assertEquals("blue", result.find("/Alice/Room").orElseThrow().getPropertyText("paint").orElseThrow());
            assertEquals("A", result.find("/Alice").orElseThrow().getPropertyText("displayName").orElseThrow());
            assertTrue(result.find("/Alice/Hall").isEmpty());
            assertTrue(result.find("/Annex").isEmpty());
            assertTrue(result.find("/Room").isEmpty());
        }

        @Test
        @DisplayName("Should leave the stage alone for unknown files and prims")
        void testRefreshSkips() {
            List<Prim> before = List.copyOf(stage.getStagedPrims());

            composer.refresh(stage, "nope.usda", null, AS_ALICE);
            composer.refresh(stage, "alice.usda", "/Alice/Nope", AS_ALICE);

            assertEquals(before, stage.getStagedPrims());
        }
    }
}
