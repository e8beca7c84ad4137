package com.questrail.wfs.osc.codec.impl;

/**
 * OscPadding
 * -----------------------------------------------------------------------------
 * 4-byte alignment arithmetic for OSC strings and blobs.
 */
final class OscPadding
{
    private OscPadding() {}

    /**
     * Rounds {@code length} up to the next multiple of four.
     */
    static int align4(int length)
    {
        return (length + 3) & ~3;
    }

    /**
     * Bytes a string of {@code byteLength} UTF-8 bytes occupies on the wire:
     * the bytes, at least one null terminator, then padding to a multiple of four.
     */
    static int paddedStringLength(int byteLength)
    {
        return align4(byteLength + 1);
    }
}
