/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.codetree.core.treesitter;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    // a(1) é(2) €(3) 😀(4, two chars) b(1)
    private final SourceText text = new SourceText("aé€😀b");

    @Test
    void mapsByteOffsetsToCharOffsets() {
        assertEquals(0, text.charOffset(0));
        assertEquals(1, text.charOffset(1));
        assertEquals(2, text.charOffset(3));
        assertEquals(3, text.charOffset(6));
        assertEquals(5, text.charOffset(10));
        assertEquals(6, text.charOffset(11));
    }

    @Test
    void clampsOutOfRangeOffsets() {
        assertEquals(0, text.charOffset(-4));
        assertEquals(6, text.charOffset(500));
    }

    @Test
    void decodesByteRanges() {
        assertEquals("é", text.text(1, 3));
        assertEquals("😀b", text.text(6, 11));
        assertEquals("", text.text(3, 3));
        assertEquals("", text.text(5, 2));
        assertEquals("", text.text(0, 99));
    }

    @Test
    void asciiIsIdentity() {
        String code = "class C { int x; }";
        SourceText ascii = new SourceText(code);
        assertEquals(code.getBytes(StandardCharsets.UTF_8).length, code.length());
        for (int i = 0; i <= code.length(); i++) {
            assertEquals(i, ascii.charOffset(i));
        }
        assertEquals(code, ascii.content());
    }
}
