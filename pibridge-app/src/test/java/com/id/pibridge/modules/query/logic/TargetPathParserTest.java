package com.id.pibridge.modules.query.logic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetPathParserTest {

    @Test
    void shouldExpandAttributeTargets() {
        var target = "Base;Seg1;Seg2";
        var base = TargetPathParser.getBasePath(target);

        var paths = TargetPathParser.getTargets(target).stream()
                .map(leaf -> TargetPathParser.fullPath(base, leaf, false))
                .toList();

        assertEquals(List.of("Base|Seg1", "Base|Seg2"), paths);
    }

    @Test
    void shouldExpandPointTargets() {
        var target = "\\\\piserver;sinusoid";

        var path = TargetPathParser.fullPath(TargetPathParser.getBasePath(target), "sinusoid", true);

        assertEquals("\\\\piserver\\sinusoid", path);
    }

    @Test
    void shouldHaveNoLeavesWithoutSeparator() {
        assertEquals("Base", TargetPathParser.getBasePath("Base"));
        assertTrue(TargetPathParser.getTargets("Base").isEmpty());
        assertTrue(TargetPathParser.getTargets(null).isEmpty());
    }

    @Test
    void shouldSkipEmptyLeaves() {
        assertTrue(TargetPathParser.getTargets(";").isEmpty());
        assertEquals(List.of("A", "B"), TargetPathParser.getTargets("Base;A;;B;"));
    }
}
