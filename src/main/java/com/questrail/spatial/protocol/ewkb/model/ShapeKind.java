package com.questrail.spatial.protocol.ewkb.model;

import java.util.Optional;

/**
 * ShapeKind
 * -----------------------------------------------------------------------------
 * The seven base shapes of the OGC simple feature model, with the code each
 * one carries in the low bits of an EWKB type word.
 */
public enum ShapeKind
{
    POINT(1),
    LINE_STRING(2),
    POLYGON(3),
    MULTI_POINT(4),
    MULTI_LINE_STRING(5),
    MULTI_POLYGON(6),
    GEOMETRY_COLLECTION(7);

    private static final ShapeKind[] BY_CODE = new ShapeKind[8];

    static {
        for (ShapeKind kind : values()) {
            BY_CODE[kind.code] = kind;
        }
    }

    private final int code;

    ShapeKind(int code) {
        this.code = code;
    }

    /**
     * Returns the base shape code (1–7).
     */
    public int code() {
        return code;
    }

    /**
     * Looks up the shape for a base shape code.
     *
     * @return the shape, or {@link Optional#empty()} for any code outside 1–7
     */
    public static Optional<ShapeKind> fromCode(long code) {
        if (code < 1 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[(int) code]);
    }
}
