package com.carlae.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import org.junit.Test;
import com.carlae.lang.Carlae;
import com.carlae.lang.CarlaeError;
import com.carlae.lang.Interpreter;

public class CarlaeTest {
    private final Interpreter interp = new Interpreter();

    @Test
    public void testPromptPrintsErrorClassName() {
        assertEquals("out> CarlaeNameError", Carlae.errorOutput(failure("(unknown-name)")));
        assertEquals("out> CarlaeSyntaxError", Carlae.errorOutput(failure(")(spam)(")));
        assertEquals("out> CarlaeEvaluationError", Carlae.errorOutput(failure("(1 2)")));
    }

    private CarlaeError failure(String code) {
        try {
            interp.run(code);
        } catch (CarlaeError e) {
            return e;
        }
        fail("expected an error for: " + code);
        return null;
    }
}
