package org.noteg.lang.interpreter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest {

    private static final Value ONE = new Value.NumberValue(1);
    private static final Value TWO = new Value.NumberValue(2);

    @Test
    void lookup_findsBindingInEnclosingScope() {
        var root = Environment.root();
        root.define("a", ONE);
        var child = root.child();

        assertEquals(ONE, child.lookup("a").get());
        assertTrue(child.lookupLocal("a").isEmpty());
    }

    @Test
    void define_inChildShadowsWithoutTouchingParent() {
        var root = Environment.root();
        root.define("a", ONE);
        var child = root.child();
        child.define("a", TWO);

        assertEquals(TWO, child.lookup("a").get());
        assertEquals(ONE, root.lookup("a").get());
    }

    @Test
    void define_overwritesLocalBinding() {
        var root = Environment.root();
        root.define("a", ONE);
        root.define("a", TWO);

        assertEquals(TWO, root.lookup("a").get());
        assertEquals(TWO, root.lookupLocal("a").get());
    }

    @Test
    void lookup_missingNameIsNone() {
        assertTrue(Environment.root().child().lookup("nothing").isEmpty());
    }
}
