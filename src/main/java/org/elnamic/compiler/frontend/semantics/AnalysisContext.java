package org.elnamic.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Tracks the enclosing constructs while the analyzer walks the tree, so handlers can decide
 * whether {@code break} and {@code return} are legal where they appear.
 */
public class AnalysisContext {

    /**
     * The kinds of constructs that affect control-flow legality.
     */
    public enum Frame {
        LOOP,
        SWITCH,
        FUNCTION
    }

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Set<String> propositionNames = new HashSet<>();

    public void enter(Frame frame) {
        frames.push(frame);
    }

    public void leave() {
        frames.pop();
    }

    /**
     * @return {@code true} if a loop or switch encloses the current node within the current function.
     */
    public boolean isBreakAllowed() {
        for (Frame frame : frames) {
            if (frame == Frame.FUNCTION) return false;
            if (frame == Frame.LOOP || frame == Frame.SWITCH) return true;
        }
        return false;
    }

    public boolean isInsideFunction() {
        return frames.contains(Frame.FUNCTION);
    }

    /**
     * Records a theorem or axiom name.
     * @param name The declared name.
     * @return {@code false} if the name was declared before.
     */
    public boolean declareProposition(String name) {
        return propositionNames.add(name);
    }
}
