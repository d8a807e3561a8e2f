package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Coordinate;
import com.questrail.spatial.api.Dimensionality;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Construction-time checks shared by the geometry records.
 */
final class ModelChecks
{
    private ModelChecks() {}

    static List<Coordinate> coordinates(Dimensionality dimensionality, List<Coordinate> coordinates, String what)
    {
        Objects.requireNonNull(coordinates, what);
        for (Coordinate c : coordinates) {
            Objects.requireNonNull(c, what + " element");
            requireSame(dimensionality, c.dimensionality(), what);
        }
        return List.copyOf(coordinates);
    }

    static List<List<Coordinate>> rings(Dimensionality dimensionality, List<List<Coordinate>> rings)
    {
        Objects.requireNonNull(rings, "rings");
        List<List<Coordinate>> copy = new ArrayList<>(rings.size());
        for (List<Coordinate> ring : rings) {
            copy.add(coordinates(dimensionality, ring, "ring"));
        }
        return List.copyOf(copy);
    }

    static <G extends Geometry> List<G> elements(Dimensionality dimensionality, List<G> elements, String what)
    {
        Objects.requireNonNull(elements, what);
        for (G g : elements) {
            Objects.requireNonNull(g, what + " element");
            requireSame(dimensionality, g.dimensionality(), what);
        }
        return List.copyOf(elements);
    }

    static Dimensionality firstOf(List<? extends Coordinate> coordinates)
    {
        return coordinates.isEmpty() ? Dimensionality.XY : coordinates.get(0).dimensionality();
    }

    static Dimensionality firstOfRings(List<? extends List<? extends Coordinate>> rings)
    {
        for (List<? extends Coordinate> ring : rings) {
            if (ring != null && !ring.isEmpty()) {
                return ring.get(0).dimensionality();
            }
        }
        return Dimensionality.XY;
    }

    private static void requireSame(Dimensionality expected, Dimensionality actual, String what)
    {
        if (expected != actual) {
            throw new IllegalArgumentException(
                    "Mixed dimensionality: " + what + " is " + actual + " inside a " + expected + " geometry"
            );
        }
    }
}
