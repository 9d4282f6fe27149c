package org.livo.warehouse.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class LikePatternUtilTest {

    @Test
    void wildcardsAreEscaped() {
        assertEquals("50\\%\\_off", LikePatternUtil.escape("50%_off"));
        assertEquals("a\\\\b", LikePatternUtil.escape("a\\b"));
        assertEquals("JNE-001", LikePatternUtil.escape("JNE-001"));
        assertNull(LikePatternUtil.escape(null));
    }

    @Test
    void containsWrapsTheEscapedTerm() {
        assertEquals("%x\\_y%", LikePatternUtil.contains("x_y"));
    }
}
