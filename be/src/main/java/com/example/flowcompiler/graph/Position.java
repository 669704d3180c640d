package com.example.flowcompiler.graph;

/**
 * Canvas coordinate of a node. Presentation only; never read by the compiler.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);
}
