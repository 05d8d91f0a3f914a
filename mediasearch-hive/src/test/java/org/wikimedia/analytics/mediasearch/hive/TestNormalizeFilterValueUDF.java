package org.wikimedia.analytics.mediasearch.hive;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

import static org.junit.Assert.assertEquals;

@RunWith(JUnitParamsRunner.class)
public class TestNormalizeFilterValueUDF {

    @Test
    @Parameters({
        "cc-by, cc-by",
        "image/png, image/png",
    })
    public void testEvaluate(String value, String expected) {
        assertEquals(expected, new NormalizeFilterValueUDF().evaluate(value));
    }

    @Test
    public void testEvaluateBlankAndNull() {
        NormalizeFilterValueUDF udf = new NormalizeFilterValueUDF();
        assertEquals("reset", udf.evaluate(""));
        assertEquals("reset", udf.evaluate("  "));
        assertEquals("reset", udf.evaluate(null));
    }
}
