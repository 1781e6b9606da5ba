package com.slicereport.core.fs;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NaturalOrderComparatorTest {

    @Test
    void ordersNumbersByValue() {
        List<String> names = new ArrayList<>(List.of(
            "vert_slice_10.bmp", "vert_slice_2.bmp", "vert_slice_001.bmp", "Vert_slice_3.bmp"));

        names.sort(NaturalOrderComparator.INSTANCE);

        assertEquals(List.of("vert_slice_001.bmp", "vert_slice_2.bmp", "Vert_slice_3.bmp", "vert_slice_10.bmp"), names);
    }

    @Test
    void numberedFoldersSortNumerically() {
        List<String> folders = new ArrayList<>(List.of("10", "02", "1", "01"));

        folders.sort(NaturalOrderComparator.INSTANCE);

        assertEquals(List.of("1", "01", "02", "10"), folders);
    }

    @Test
    void consistentWithEquals() {
        assertEquals(0, NaturalOrderComparator.INSTANCE.compare("a_1", "a_1"));
        assertTrue(NaturalOrderComparator.INSTANCE.compare("a", "a_1") < 0);
    }
}
