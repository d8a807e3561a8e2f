package com.questrail.spatial.protocol.ewkb.codec;

/**
 * Raised when an EWKB type word, at any nesting depth, does not name one of
 * the seven supported base shapes.
 */
public final class UnrecognizedShapeCodeException extends EwkbCodecException
{
    private final long typeWord;

    public UnrecognizedShapeCodeException(long typeWord) {
        super("Unrecognized EWKB shape code in type word 0x" + Long.toHexString(typeWord));
        this.typeWord = typeWord;
    }

    /**
     * Returns the full unsigned type word as read from the wire.
     */
    public long typeWord() {
        return typeWord;
    }
}
