package org.foxesworld.aurora.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceIdentifierTest {

    @Test
    void equalityIgnoresNameCase() {
        ResourceIdentifier a = new ResourceIdentifier("C_Bantha", ResourceType.UTC);
        ResourceIdentifier b = new ResourceIdentifier("c_bantha", ResourceType.UTC);
        ResourceIdentifier c = new ResourceIdentifier("C_BANTHA", ResourceType.UTC);

        assertEquals(a, b);
        assertEquals(b, c);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a.hashCode(), c.hashCode());

        Set<ResourceIdentifier> set = new HashSet<>();
        set.add(a);
        assertTrue(set.contains(c));
    }

    @Test
    void differentTypesAreDifferentIdentifiers() {
        assertNotEquals(new ResourceIdentifier("m01aa", ResourceType.ARE),
                new ResourceIdentifier("m01aa", ResourceType.GIT));
    }

    @Test
    void keepsOriginalSpelling() {
        ResourceIdentifier id = new ResourceIdentifier("Dan13_Door", ResourceType.UTD);
        assertEquals("Dan13_Door", id.name());
        assertEquals("dan13_door", id.foldedName());
        assertEquals("Dan13_Door.utd", id.filename());
        assertEquals("dan13_door.utd", id.toString());
    }

    @Test
    void fromPathSplitsAtLastDot() {
        ResourceIdentifier id = ResourceIdentifier.fromPath("some.dotted.name.2DA");
        assertEquals("some.dotted.name", id.name());
        assertEquals(ResourceType.TWODA, id.type());

        ResourceIdentifier fromPath = ResourceIdentifier.fromPath(Path.of("override", "sub", "x.utc"));
        assertEquals(new ResourceIdentifier("x", ResourceType.UTC), fromPath);
    }

    @Test
    void fromPathHandlesBackslashesAndUnknownTypes() {
        assertEquals(new ResourceIdentifier("models", ResourceType.BIF), ResourceIdentifier.fromPath("data\\models.bif"));
        assertTrue(ResourceIdentifier.fromPath("readme.unknownext").type().isInvalid());
        ResourceIdentifier noExt = ResourceIdentifier.fromPath("README");
        assertEquals("README", noExt.name());
        assertTrue(noExt.type().isInvalid());
    }

    @Test
    void withTypeKeepsName() {
        ResourceIdentifier tpc = new ResourceIdentifier("lbl_map", ResourceType.TPC);
        assertEquals(new ResourceIdentifier("LBL_MAP", ResourceType.TXI), tpc.withType(ResourceType.TXI));
    }
}
