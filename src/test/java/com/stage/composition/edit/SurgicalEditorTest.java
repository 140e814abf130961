package com.stage.composition.edit;

import com.stage.composition.core.ValidationException;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Specifier;
import com.stage.composition.parse.ParsedDocument;
import com.stage.composition.parse.PrimParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SurgicalEditorTest {

    private static final String LAYER = """
            #usda 1.0
            # hand-written comment survives edits
            def Xform "World"
            {
                custom token primvars:status = "WIP"
                def Mesh "Wall"
                {
                    float opacity = 1
                }
            }
            """;

    private SurgicalEditor editor;
    private PrimParser parser;

    @BeforeEach
    void setUp() {
        parser = new PrimParser();
        editor = new SurgicalEditor(parser);
    }

    @Nested
    @DisplayName("Insert")
    class InsertTests {

        @Test
        @DisplayName("Should splice a prim before the parent's closing brace")
        void testInsertUnderExistingParent() {
            EditResult result = editor.insert(LAYER, "/World/Wall", "def \"Door\"\n{\n}");

            assertTrue(result.isApplied());
            ParsedDocument doc = parser.parse(result.text());
            assertTrue(doc.find("/World/Wall/Door").isPresent());
            assertTrue(result.text().contains("# hand-written comment survives edits"));
            assertEquals("1", doc.find("/World/Wall").orElseThrow().getPropertyText("opacity").orElseThrow());
        }

        @Test
        @DisplayName("Should wrap missing ancestors in over blocks")
        void testInsertSynthesizesOvers() {
            EditResult result = editor.insert(LAYER, "/World/Wall/Frame/Hinge", "def \"Pin\"\n{\n}");

            ParsedDocument doc = parser.parse(result.text());
            assertTrue(doc.find("/World/Wall/Frame/Hinge/Pin").isPresent());
            assertEquals(Specifier.OVERRIDE, doc.find("/World/Wall/Frame").orElseThrow().getSpecifier());
            assertEquals(Specifier.OVERRIDE, doc.find("/World/Wall/Frame/Hinge").orElseThrow().getSpecifier());
        }

        @Test
        @DisplayName("Should append a wrapped block when no root matches")
        void testInsertUnderUnknownRoot() {
            EditResult result = editor.insert(LAYER, "/Other", "def \"Pin\"\n{\n}");

            ParsedDocument doc = parser.parse(result.text());
            assertTrue(result.text().startsWith(LAYER));
            assertTrue(doc.find("/Other/Pin").isPresent());
            assertEquals(2, doc.roots().size());
        }

        @Test
        @DisplayName("Should build every ancestor when inserting into empty text")
        void testInsertIntoEmptyText() {
            EditResult result = editor.insert("", "/Level1/Level2", "define Thing \"Leaf\" { }");

            assertEquals("\nover \"Level1\" {\nover \"Level2\" {\ndefine Thing \"Leaf\" { }\n}\n}", result.text());
            ParsedDocument doc = parser.parse(result.text());
            assertEquals(1, doc.roots().size());
            assertEquals(Specifier.OVERRIDE, doc.find("/Level1").orElseThrow().getSpecifier());
            assertEquals(Specifier.OVERRIDE, doc.find("/Level1/Level2").orElseThrow().getSpecifier());
            Prim leaf = doc.find("/Level1/Level2/Leaf").orElseThrow();
            assertEquals(Specifier.DEFINE, leaf.getSpecifier());
            assertEquals("Thing", leaf.getType());
        }

        @Test
        @DisplayName("Should reject a missing prim text")
        void testInsertRequiresPrimText() {
            NullPointerException e = assertThrows(NullPointerException.class, () -> editor.insert(LAYER, "/", null));
            assertEquals("primText is required", e.getMessage());
            assertThrows(NullPointerException.class, () -> editor.insert(LAYER, "/World", null));
        }

        @Test
        @DisplayName("Should append at the end for a root parent")
        void testInsertAtRoot() {
            EditResult result = editor.insert(LAYER, "/", "def \"Sky\"\n{\n}\n");

            assertEquals(LAYER + "\ndef \"Sky\"\n{\n}\n", result.text());
            assertEquals(result.text(), editor.insert(LAYER, null, "def \"Sky\"\n{\n}\n").text());
        }

        @Test
        @DisplayName("Should leave malformed text untouched with a warning")
        void testInsertIntoMalformed() {
            String broken = "def \"A\" {\n";
            EditResult result = editor.insert(broken, "/A", "def \"B\" {}");

            assertFalse(result.isApplied());
            assertEquals(broken, result.text());
            assertTrue(result.warning().orElseThrow().contains("Unbalanced braces"));
        }
    }

    @Nested
    @DisplayName("Remove")
    class RemoveTests {

        @Test
        @DisplayName("Should delete the whole prim block")
        void testRemove() {
            EditResult result = editor.remove(LAYER, "/World/Wall");

            assertTrue(result.isApplied());
            Prim world = parser.parse(result.text()).find("/World").orElseThrow();
            assertTrue(world.getChildren().isEmpty());
            assertEquals("WIP", world.getPropertyText("status").orElseThrow());
            assertFalse(result.text().contains("opacity"));
        }

        @Test
        @DisplayName("Should warn when the prim does not exist")
        void testRemoveMissing() {
            EditResult result = editor.remove(LAYER, "/World/Nope");

            assertFalse(result.isApplied());
            assertEquals(LAYER, result.text());
            assertEquals("Prim not found for removal: /World/Nope", result.warning().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Update property")
    class UpdatePropertyTests {

        @Test
        @DisplayName("Should replace an existing value in place")
        void testUpdateInPlace() {
            EditResult result = editor.updateProperty(LAYER, "/World", "status", "Shared");

            assertEquals(LAYER.replace("primvars:status = \"WIP\"", "primvars:status = \"Shared\""), result.text());
        }

        @Test
        @DisplayName("Should insert a declaration matching the body indentation")
        void testInsertDeclaration() {
            EditResult result = editor.updateProperty(LAYER, "/World/Wall", "displayName", "Left wall");

            String expected = LAYER.replace(
                    "        float opacity = 1\n",
                    "        float opacity = 1\n        custom string primvars:displayName = \"Left wall\"\n");
            assertEquals(expected, result.text());
        }

        @Test
        @DisplayName("Should be idempotent")
        void testIdempotent() {
            String once = editor.updateProperty(LAYER, "/World/Wall", "displayName", "Left").text();
            String twice = editor.updateProperty(once, "/World/Wall", "displayName", "Left").text();

            assertEquals(once, twice);
        }

        @Test
        @DisplayName("Should not touch declarations in child bodies")
        void testOwnBodyOnly() {
            EditResult result = editor.updateProperty(LAYER, "/World", "opacity", "0.5", "float");

            assertTrue(result.text().contains("        float opacity = 1\n"));
            assertTrue(result.text().contains("    custom float primvars:opacity = 0.5\n"));
        }

        @Test
        @DisplayName("Should write non-string types verbatim and keep qualified names")
        void testTypedValues() {
            String text = editor.updateProperty(LAYER, "/World/Wall", "opacity", "0.25").text();
            assertTrue(text.contains("custom string primvars:opacity = \"0.25\""));

            String qualified = editor.updateProperty(LAYER, "/World/Wall", "xformOp:scale", "2", "float").text();
            assertTrue(qualified.contains("custom float xformOp:scale = 2"));
        }

        @Test
        @DisplayName("Should replace a declaration sharing its line with the opening brace")
        void testUpdateOneLineBody() {
            String text = "def Xform \"A\" { custom token primvars:status = \"WIP\" }\n";

            EditResult result = editor.updateProperty(text, "/A", "status", "Published", "token");

            assertEquals("def Xform \"A\" { custom token primvars:status = \"Published\" }\n", result.text());
            assertEquals(result.text(),
                    editor.updateProperty(result.text(), "/A", "status", "Published", "token").text());
            assertEquals("Published", parser.parse(result.text()).find("/A").orElseThrow()
                    .getPropertyText("status").orElseThrow());
        }

        @Test
        @DisplayName("Should indent a new declaration one level below a one-line header")
        void testInsertIntoOneLineBody() {
            String text = "def Xform \"A\" { custom token primvars:status = \"WIP\" }\n";

            EditResult result = editor.updateProperty(text, "/A", "opacity", "0.5", "float");

            assertEquals("def Xform \"A\" { custom token primvars:status = \"WIP\"\n"
                    + "    custom float primvars:opacity = 0.5\n}\n", result.text());
        }

        @Test
        @DisplayName("Should keep a trailing comment after the replaced value")
        void testUpdateKeepsTrailingComment() {
            String text = "def Xform \"A\"\n{\n    custom token primvars:status = \"WIP\" # set by review\n}\n";

            EditResult result = editor.updateProperty(text, "/A", "status", "Shared", "token");

            assertEquals(text.replace("\"WIP\"", "\"Shared\""), result.text());
        }

        @Test
        @DisplayName("Should ignore declarations inside comments and strings")
        void testUpdateSkipsCommentedDeclaration() {
            String text = "def Xform \"A\"\n{\n"
                    + "    # custom token primvars:status = \"Old\"\n"
                    + "    custom string primvars:note = \"token primvars:status = x\"\n"
                    + "    custom token primvars:status = \"WIP\"\n}\n";

            EditResult result = editor.updateProperty(text, "/A", "status", "Shared", "token");

            assertEquals(text.replace("= \"WIP\"", "= \"Shared\""), result.text());
        }

        @Test
        @DisplayName("Should warn for unknown prims and reject invalid names")
        void testUpdateErrors() {
            EditResult missing = editor.updateProperty(LAYER, "/Nope", "status", "Shared");
            assertFalse(missing.isApplied());
            assertTrue(missing.warning().orElseThrow().startsWith("Prim not found: /Nope"));

            assertThrows(ValidationException.class,
                    () -> editor.updateProperty(LAYER, "/World", "bad name", "x"));
        }

        @Test
        @DisplayName("Should fall back to a name lookup")
        void testUpdateByName() {
            EditResult result = editor.updateProperty(LAYER, "/Elsewhere/Wall", "status", "Shared");

            Prim wall = parser.parse(result.text()).find("/World/Wall").orElseThrow();
            assertEquals("Shared", wall.getPropertyText("status").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Rename")
    class RenameTests {

        private static final String WITH_REFERENCES = """
                def Xform "World"
                {
                    def "Wall"
                    {
                    }
                    def "WallLeft"
                    {
                    }
                }
                def "User" (
                    prepend references = @scene.usda@</World/Wall>
                )
                {
                }
                def "Other" (
                    prepend references = @scene.usda@</World/WallLeft>
                )
                {
                }
                """;

        @Test
        @DisplayName("Should rename the prim and rewrite exact references")
        void testRename() {
            RenameResult result = editor.rename(WITH_REFERENCES, "/World/Wall", "Partition");

            assertTrue(result.isRenamed());
            assertEquals("/World/Partition", result.newPath());
            ParsedDocument doc = parser.parse(result.text());
            assertTrue(doc.find("/World/Partition").isPresent());
            assertTrue(doc.find("/World/Wall").isEmpty());
            assertEquals("/World/Partition", doc.find("/User").orElseThrow().getReference().targetPath());
            assertEquals("/World/WallLeft", doc.find("/Other").orElseThrow().getReference().targetPath());
        }

        @Test
        @DisplayName("Should reject invalid new names")
        void testRenameInvalid() {
            assertThrows(ValidationException.class, () -> editor.rename(WITH_REFERENCES, "/World/Wall", "Bad Name"));
            assertThrows(ValidationException.class, () -> editor.rename(WITH_REFERENCES, "/World/Wall", "9Wall"));
        }

        @Test
        @DisplayName("Should return the original path when the prim is missing")
        void testRenameMissing() {
            RenameResult result = editor.rename(WITH_REFERENCES, "/World/Door", "Gate");

            assertFalse(result.isRenamed());
            assertEquals("/World/Door", result.newPath());
            assertEquals(WITH_REFERENCES, result.text());
        }
    }
}
