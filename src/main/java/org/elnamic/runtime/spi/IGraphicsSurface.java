package org.elnamic.runtime.spi;

/**
 * A stateful turtle-graphics surface. The evaluator only issues commands; rendering is
 * entirely up to the implementation. Angles are in degrees, 0 pointing east and positive
 * angles turning counterclockwise.
 */
public interface IGraphicsSurface {

    /** Receives pointer events with surface coordinates. */
    @FunctionalInterface
    interface PointerListener {
        void onPointer(double x, double y);
    }

    /** Receives key presses. */
    @FunctionalInterface
    interface KeyListener {
        void onKey(String key);
    }

    void forward(double distance);

    void backward(double distance);

    void right(double degrees);

    void left(double degrees);

    void goTo(double x, double y);

    void setX(double x);

    void setY(double y);

    void setHeading(double degrees);

    void penUp();

    void penDown();

    void color(String color);

    void backgroundColor(String color);

    void width(double width);

    void speed(double speed);

    /**
     * Draws an arc around a center {@code radius} units to the left of the cursor.
     * @param radius The radius; negative radii curve to the right.
     * @param extent The arc angle in degrees, or {@code null} for a full circle.
     */
    void circle(double radius, Double extent);

    void dot(double size);

    double xcor();

    double ycor();

    double heading();

    void clear();

    void reset();

    void done();

    /**
     * Blocks until the user clicks the surface, then returns.
     */
    void exitOnClick();

    void onClick(PointerListener listener);

    void onRelease(PointerListener listener);

    void onDrag(PointerListener listener);

    void onKey(KeyListener listener);
}
