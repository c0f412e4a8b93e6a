package org.foxesworld.aurora.engine.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ReadPropsTest {

    private static final String KEY = "aurora.test.readprops";

    @AfterEach
    void clear() {
        System.clearProperty(KEY);
    }

    @Test
    void csvPropertySplitsAndTrims() {
        System.setProperty(KEY, " saves , , movies,");
        assertEquals(Set.of("saves", "movies"), ReadProps.readCsvProperty(KEY, Set.of("x")));
    }

    @Test
    void csvPropertyFallsBackWhenBlank() {
        assertEquals(Set.of("x"), ReadProps.readCsvProperty(KEY, Set.of("x")));
        System.setProperty(KEY, " , ");
        assertEquals(Set.of("x"), ReadProps.readCsvProperty(KEY, Set.of("x")));
    }

    @Test
    void intPropertyRejectsBadValues() {
        assertEquals(7, ReadProps.readIntProperty(KEY, 7));
        System.setProperty(KEY, "abc");
        assertEquals(7, ReadProps.readIntProperty(KEY, 7));
        System.setProperty(KEY, "-3");
        assertEquals(7, ReadProps.readIntProperty(KEY, 7));
        System.setProperty(KEY, " 250 ");
        assertEquals(250, ReadProps.readIntProperty(KEY, 7));
    }
}
