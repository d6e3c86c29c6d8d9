package com.visualcompiler.core.model;

/**
 * Canvas position of a block. Purely cosmetic; carried through unchanged.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record Position(double x, double y) {

    /**
     * Returns the canvas origin.
     *
     * @return position (0, 0)
     */
    public static Position origin() {
        return new Position(0, 0);
    }
}
