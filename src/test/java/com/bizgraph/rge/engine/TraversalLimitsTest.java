package com.bizgraph.rge.engine;

import com.bizgraph.rge.api.InvalidDepthException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TraversalLimitsTest {

    @Test
    public void testDefaults() {
        assertEquals(3, TraversalLimits.DEFAULT.defaultMaxDepth());
        assertEquals(6, TraversalLimits.DEFAULT.maxDepthCeiling());
        assertEquals(6, TraversalLimits.DEFAULT.validateDepth(6));
        assertEquals(1, TraversalLimits.DEFAULT.validateDepth(1));
    }

    @Test
    public void testCeilingIsReportedInMessage() {
        try {
            TraversalLimits.DEFAULT.validateDepth(9);
            fail();
        } catch (InvalidDepthException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("6"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDefaultAboveCeilingRejected() {
        new TraversalLimits(4, 3, 100);
    }
}
