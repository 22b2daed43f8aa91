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

import java.nio.charset.StandardCharsets;

/**
 * Source text together with its UTF-8 encoding.
 * tree-sitter reports byte offsets, nodes are addressed by {@code char} offsets.
 */
final class SourceText {

    private final String content;
    private final byte[] bytes;
    private final int[] charOffsets;

    SourceText(String content) {
        this.content = content;
        this.bytes = content.getBytes(StandardCharsets.UTF_8);
        this.charOffsets = mapOffsets(content, bytes.length);
    }

    String content() {
        return content;
    }

    /**
     * Decoded text between two byte offsets, empty for an invalid range.
     */
    String text(int startByte, int endByte) {
        if (startByte >= 0 && endByte <= bytes.length && startByte < endByte) {
            return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        }
        return "";
    }

    int charOffset(int byteOffset) {
        if (byteOffset <= 0) {
            return 0;
        }
        return byteOffset >= charOffsets.length ? content.length() : charOffsets[byteOffset];
    }

    private static int[] mapOffsets(String content, int byteLength) {
        int[] offsets = new int[byteLength + 1];
        int b = 0;
        int c = 0;
        while (c < content.length() && b < byteLength) {
            int codePoint = content.codePointAt(c);
            int width = utf8Width(codePoint);
            for (int k = 0; k < width && b + k < byteLength; k++) {
                offsets[b + k] = c;
            }
            b += width;
            c += Character.charCount(codePoint);
        }
        offsets[byteLength] = content.length();
        return offsets;
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80 || codePoint <= 0xFFFF && Character.isSurrogate((char) codePoint)) {
            // lone surrogates are encoded as a single '?'
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
