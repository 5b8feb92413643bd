package org.elnamic.runtime.services;

import org.elnamic.runtime.spi.IGraphicsSurface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A graphics surface without a window. It keeps the full turtle state, records the line
 * segments a visible renderer would draw and logs every command at DEBUG level.
 * {@link #exitOnClick()} returns at once since there is nothing to click; registered
 * listeners can be triggered with {@link #click(double, double)} and {@link #pressKey(String)}.
 */
public class HeadlessTurtleSurface implements IGraphicsSurface {

    private static final Logger LOG = LoggerFactory.getLogger(HeadlessTurtleSurface.class);

    /**
     * A drawn line.
     *
     * @param x1 Start x.
     * @param y1 Start y.
     * @param x2 End x.
     * @param y2 End y.
     * @param color The pen color.
     * @param width The pen width.
     */
    public record Segment(double x1, double y1, double x2, double y2, String color, double width) {
    }

    private final List<Segment> segments = new ArrayList<>();
    private final List<PointerListener> clickListeners = new ArrayList<>();
    private final List<PointerListener> releaseListeners = new ArrayList<>();
    private final List<PointerListener> dragListeners = new ArrayList<>();
    private final List<KeyListener> keyListeners = new ArrayList<>();

    private double x;
    private double y;
    private double heading;
    private boolean penDown;
    private String color;
    private String backgroundColor;
    private double width;
    private double speed;

    public HeadlessTurtleSurface() {
        resetState();
    }

    private void resetState() {
        x = 0;
        y = 0;
        heading = 0;
        penDown = true;
        color = "black";
        backgroundColor = "white";
        width = 1;
        speed = 3;
    }

    @Override
    public void forward(double distance) {
        double radians = Math.toRadians(heading);
        moveTo(x + distance * Math.cos(radians), y + distance * Math.sin(radians));
    }

    @Override
    public void backward(double distance) {
        forward(-distance);
    }

    @Override
    public void right(double degrees) {
        setHeading(heading - degrees);
    }

    @Override
    public void left(double degrees) {
        setHeading(heading + degrees);
    }

    @Override
    public void goTo(double newX, double newY) {
        moveTo(newX, newY);
    }

    @Override
    public void setX(double newX) {
        moveTo(newX, y);
    }

    @Override
    public void setY(double newY) {
        moveTo(x, newY);
    }

    @Override
    public void setHeading(double degrees) {
        heading = ((degrees % 360) + 360) % 360;
        LOG.debug("heading {}", heading);
    }

    @Override
    public void penUp() {
        penDown = false;
    }

    @Override
    public void penDown() {
        penDown = true;
    }

    @Override
    public void color(String newColor) {
        color = newColor;
    }

    @Override
    public void backgroundColor(String newColor) {
        backgroundColor = newColor;
    }

    @Override
    public void width(double newWidth) {
        width = newWidth;
    }

    @Override
    public void speed(double newSpeed) {
        speed = newSpeed;
    }

    @Override
    public void circle(double radius, Double extent) {
        double degrees = extent != null ? extent : 360.0;
        double radians = Math.toRadians(heading);
        double centerX = x - radius * Math.sin(radians);
        double centerY = y + radius * Math.cos(radians);
        double turn = Math.toRadians(degrees) * Math.signum(radius);

        double dx = x - centerX;
        double dy = y - centerY;
        double endX = centerX + dx * Math.cos(turn) - dy * Math.sin(turn);
        double endY = centerY + dx * Math.sin(turn) + dy * Math.cos(turn);
        LOG.debug("circle radius={} extent={}", radius, degrees);
        moveTo(endX, endY);
        setHeading(heading + degrees * Math.signum(radius));
    }

    @Override
    public void dot(double size) {
        LOG.debug("dot size={} at ({}, {}) in {}", size, x, y, color);
    }

    @Override
    public double xcor() {
        return x;
    }

    @Override
    public double ycor() {
        return y;
    }

    @Override
    public double heading() {
        return heading;
    }

    @Override
    public void clear() {
        segments.clear();
    }

    @Override
    public void reset() {
        segments.clear();
        resetState();
    }

    @Override
    public void done() {
        LOG.debug("done: {} segment(s) drawn", segments.size());
    }

    @Override
    public void exitOnClick() {
        LOG.debug("exitonclick: no display attached, returning immediately");
    }

    @Override
    public void onClick(PointerListener listener) {
        clickListeners.add(listener);
    }

    @Override
    public void onRelease(PointerListener listener) {
        releaseListeners.add(listener);
    }

    @Override
    public void onDrag(PointerListener listener) {
        dragListeners.add(listener);
    }

    @Override
    public void onKey(KeyListener listener) {
        keyListeners.add(listener);
    }

    /**
     * Delivers a click followed by a release to the registered listeners.
     * @param atX The pointer x coordinate.
     * @param atY The pointer y coordinate.
     */
    public void click(double atX, double atY) {
        clickListeners.forEach(l -> l.onPointer(atX, atY));
        releaseListeners.forEach(l -> l.onPointer(atX, atY));
    }

    public void drag(double toX, double toY) {
        dragListeners.forEach(l -> l.onPointer(toX, toY));
    }

    public void pressKey(String key) {
        keyListeners.forEach(l -> l.onKey(key));
    }

    public List<Segment> segments() {
        return Collections.unmodifiableList(segments);
    }

    public boolean isPenDown() {
        return penDown;
    }

    public String color() {
        return color;
    }

    public String backgroundColor() {
        return backgroundColor;
    }

    public double width() {
        return width;
    }

    public double speed() {
        return speed;
    }

    private void moveTo(double newX, double newY) {
        if (penDown) {
            segments.add(new Segment(x, y, newX, newY, color, width));
        }
        LOG.debug("move ({}, {}) -> ({}, {}) pen={}", x, y, newX, newY, penDown ? "down" : "up");
        x = newX;
        y = newY;
    }
}
