package com.clustermap.model;

/** Image pixel, 0-based column and row. */
public class Pixel {
    public final int x;
    public final int y;

    public Pixel(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public String toString() { return "(" + x + ", " + y + ")"; }
}
