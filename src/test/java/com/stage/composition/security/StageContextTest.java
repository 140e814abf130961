package com.stage.composition.security;

import com.stage.composition.core.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class StageContextTest {

    @ParameterizedTest
    @CsvSource({
            "Project Manager, PROJECT_MANAGER",
            "field engineer, FIELD_ENGINEER",
            "FIELD_PERSON, FIELD_PERSON",
            "Architect, ARCHITECT",
            "structural_engineer, STRUCTURAL_ENGINEER"
    })
    @DisplayName("Should parse roles by display or constant name")
    void testFromString(String value, ActorRole expected) {
        assertEquals(expected, ActorRole.fromString(value));
    }

    @Test
    @DisplayName("Should reject unknown roles")
    void testUnknownRole() {
        assertThrows(ValidationException.class, () -> ActorRole.fromString("Intern"));
        assertThrows(ValidationException.class, () -> ActorRole.fromString(null));
    }

    @Test
    @DisplayName("Should grant privileges by role")
    void testRolePrivileges() {
        assertTrue(ActorRole.PROJECT_MANAGER.isPrivileged());
        assertFalse(ActorRole.FIELD_ENGINEER.isPrivileged());
        assertTrue(ActorRole.FIELD_ENGINEER.hasFullEditAccess());
        assertFalse(ActorRole.ARCHITECT.hasFullEditAccess());
        assertTrue(ActorRole.FIELD_PERSON.isReadOnly());
    }

    @Test
    @DisplayName("Should hide layers owned by someone else unless privileged")
    void testHiddenOwner() {
        StageContext alice = StageContext.of("alice", ActorRole.ARCHITECT);
        StageContext manager = StageContext.forRole(ActorRole.PROJECT_MANAGER);

        assertFalse(alice.isHiddenOwner("alice"));
        assertTrue(alice.isHiddenOwner("bob"));
        assertFalse(alice.isHiddenOwner(null));
        assertFalse(alice.isHiddenOwner(" "));
        assertFalse(manager.isHiddenOwner("bob"));
        assertEquals("Project Manager", manager.identity());
    }
}
