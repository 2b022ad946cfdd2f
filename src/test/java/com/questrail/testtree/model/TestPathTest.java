package com.questrail.testtree.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TestPathTest
{
    @Test
    void childAppendsSegment()
    {
        TestPath p = TestPath.of("Calculator", "math").child("add");
        assertEquals(List.of("Calculator", "math", "add"), p.segments());
        assertEquals(3, p.depth());
        assertEquals("add", p.lastSegment());
        assertEquals("Calculator/math/add", p.toString());
    }

    @Test
    void parseIgnoresEmptySegments()
    {
        assertEquals(TestPath.of("a", "b"), TestPath.parse("/a//b/"));
        assertTrue(TestPath.parse("").isRoot());
    }

    @Test
    void startsWithComparesWholeSegments()
    {
        TestPath p = TestPath.of("a", "bc", "d");
        assertTrue(p.startsWith(TestPath.of("a", "bc")));
        assertTrue(p.startsWith(TestPath.root()));
        assertFalse(p.startsWith(TestPath.of("a", "b")));
        assertFalse(TestPath.of("a").startsWith(p));
    }

    @Test
    void parentOfRootIsRoot()
    {
        assertEquals(TestPath.of("a"), TestPath.of("a", "b").parent());
        assertSame(TestPath.root(), TestPath.root().parent());
    }

    @Test
    void rejectsInvalidSegments()
    {
        assertThrows(IllegalArgumentException.class, () -> TestPath.of("a/b"));
        assertThrows(IllegalArgumentException.class, () -> TestPath.of(""));
        assertThrows(NullPointerException.class, () -> TestPath.root().child(null));
        assertThrows(IllegalStateException.class, () -> TestPath.root().lastSegment());
    }

    @Test
    void joinUsesDelimiter()
    {
        assertEquals("Calculator.math", TestPath.of("Calculator", "math").join("."));
    }

    @Test
    void ordersBySegmentsThenDepth()
    {
        assertTrue(TestPath.of("a", "b").compareTo(TestPath.of("a", "c")) < 0);
        assertTrue(TestPath.of("a").compareTo(TestPath.of("a", "b")) < 0);
        assertEquals(0, TestPath.of("a", "b").compareTo(TestPath.parse("a/b")));
    }
}
