package com.novelsource.common.util;

import com.novelsource.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextUtilsTest extends TestBase {

    @Test
    void testStripAuthorPrefix() {
        assertEquals("Frank Herbert", TextUtils.stripAuthorPrefix("作者：Frank Herbert"));
        assertEquals("天蚕土豆", TextUtils.stripAuthorPrefix(" 作者:天蚕土豆 "));
        assertEquals("Frank Herbert", TextUtils.stripAuthorPrefix("By: Frank Herbert"));
        assertEquals("Frank Herbert", TextUtils.stripAuthorPrefix("by Frank Herbert"));
        assertEquals("Byron", TextUtils.stripAuthorPrefix("Byron"), "A name starting with 'by' is not a label");
        assertEquals("", TextUtils.stripAuthorPrefix(null));
    }

    @Test
    void testTruncateCountsCodePoints() {
        assertEquals("abc", TextUtils.truncate("abcdef", 3));
        assertEquals("short", TextUtils.truncate("short", 10));
        assertEquals("😀😀", TextUtils.truncate("😀😀😀", 2), "Surrogate pairs are not split");
    }

    @Test
    void testCollapseWhitespace() {
        assertEquals("a b c", TextUtils.collapseWhitespace("  a \n b　　c "));
    }
}
