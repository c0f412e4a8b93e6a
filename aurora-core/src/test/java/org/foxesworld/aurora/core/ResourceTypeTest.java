package org.foxesworld.aurora.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceTypeTest {

    @Test
    void looksUpByDiskId() {
        assertEquals(ResourceType.UTC, ResourceType.fromId(2027));
        assertEquals(ResourceType.TPC, ResourceType.fromId(3007));
        assertEquals(ResourceType.TWODA, ResourceType.fromId(2017));
        assertEquals(ResourceType.INVALID, ResourceType.fromId(12345));
        assertEquals(ResourceType.INVALID, ResourceType.fromId(-1));
    }

    @Test
    void looksUpByExtensionIgnoringCaseAndDot() {
        assertEquals(ResourceType.TGA, ResourceType.fromExtension("TGA"));
        assertEquals(ResourceType.TGA, ResourceType.fromExtension(".tga"));
        assertEquals(ResourceType.TWODA, ResourceType.fromExtension("2da"));
        assertTrue(ResourceType.fromExtension("").isInvalid());
        assertTrue(ResourceType.fromExtension(null).isInvalid());
        assertTrue(ResourceType.fromExtension("exe").isInvalid());
    }

    @Test
    void idsAndExtensionsAreUnique() {
        for (ResourceType t : ResourceType.values()) {
            if (t.isInvalid()) continue;
            assertEquals(t, ResourceType.fromId(t.id()), "id of " + t);
            assertEquals(t, ResourceType.fromExtension(t.extension()), "extension of " + t);
        }
    }

    @Test
    void capsuleKinds() {
        assertEquals(ResourceType.Kind.CAPSULE, ResourceType.MOD.kind());
        assertEquals(ResourceType.Kind.CAPSULE, ResourceType.RIM.kind());
        assertEquals(ResourceType.Kind.IMAGE, ResourceType.TPC.kind());
        assertEquals(ResourceType.Kind.AUDIO, ResourceType.WAV.kind());
    }
}
