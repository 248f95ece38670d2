package com.example.pdfoutline.model;

/**
 * Axis-aligned rectangle in page space. Origin is the top-left corner of the page,
 * y grows downwards.
 */
public class BoundingBox {
    private final float x0;
    private final float y0;
    private final float x1;
    private final float y1;

    public BoundingBox(float x0, float y0, float x1, float y1) {
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
    }

    public float getX0() {
        return x0;
    }

    public float getY0() {
        return y0;
    }

    public float getX1() {
        return x1;
    }

    public float getY1() {
        return y1;
    }

    public float getCenterX() {
        return (x0 + x1) / 2f;
    }

    public float getCenterY() {
        return (y0 + y1) / 2f;
    }

    public boolean contains(float x, float y) {
        return x >= x0 && x <= x1 && y >= y0 && y <= y1;
    }

    public BoundingBox union(BoundingBox other) {
        if (other == null) return this;
        return new BoundingBox(Math.min(x0, other.x0), Math.min(y0, other.y0),
                Math.max(x1, other.x1), Math.max(y1, other.y1));
    }

    @Override
    public String toString() {
        return String.format("[%.2f, %.2f, %.2f, %.2f]", x0, y0, x1, y1);
    }
}
