package de.bsommerfeld.sixdegrees.core.domain;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoleCategoryTest {

    @Test
    void fromCode_shouldResolveEveryDeclaredCode() {
        for (RoleCategory role : RoleCategory.values()) {
            assertEquals(role, RoleCategory.fromCode(role.code()).orElseThrow());
        }
    }

    @Test
    void fromCode_shouldBeEmptyForUnknownCode() {
        assertTrue(RoleCategory.fromCode("key_grip").isEmpty());
        assertTrue(RoleCategory.fromCode(null).isEmpty());
    }

    @Test
    void fromCode_shouldBeCaseSensitive() {
        assertTrue(RoleCategory.fromCode("Actor").isEmpty());
    }

    @Test
    void codes_shouldBeUnique() {
        Set<String> codes = new HashSet<>();
        for (RoleCategory role : RoleCategory.values()) {
            assertTrue(codes.add(role.code()), "Duplicate code " + role.code());
        }
    }

    @Test
    void phrase_shouldNeverBeBlank() {
        for (RoleCategory role : RoleCategory.values()) {
            assertFalse(role.phrase().isBlank(), role.name());
        }
        assertEquals("were themselves", RoleCategory.SELF.phrase());
    }
}
