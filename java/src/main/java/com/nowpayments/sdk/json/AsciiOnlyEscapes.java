package com.nowpayments.sdk.json;

import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;

/**
 * Escapes every character outside printable ASCII as a lowercase
 * {@code \\uXXXX} sequence. {@code \n}, {@code \t} and the other short escapes,
 * {@code \"} and {@code \\} keep their usual form.
 */
final class AsciiOnlyEscapes extends CharacterEscapes {

    private static final long serialVersionUID = 1L;

    private final int[] asciiEscapes;

    AsciiOnlyEscapes() {
        int[] esc = CharacterEscapes.standardAsciiEscapesForJSON();
        for (int i = 0; i < 0x20; i++) {
            if (esc[i] == CharacterEscapes.ESCAPE_STANDARD) {
                esc[i] = CharacterEscapes.ESCAPE_CUSTOM;
            }
        }
        esc[0x7F] = CharacterEscapes.ESCAPE_CUSTOM;
        this.asciiEscapes = esc;
    }

    @Override
    public int[] getEscapeCodesForAscii() {
        return asciiEscapes;
    }

    @Override
    public SerializableString getEscapeSequence(int ch) {
        if (ch >= 0x20 && ch < 0x7F) {
            return null;
        }
        return new SerializedString(String.format("\\u%04x", ch));
    }
}
