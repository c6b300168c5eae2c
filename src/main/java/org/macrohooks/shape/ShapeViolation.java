package org.macrohooks.shape;

/**
 * Describes why an invocation's arguments do not have the shape its rule requires.
 *
 * @param expected What the rule required, e.g. "a binding vector of 1 to 2 elements".
 * @param received What was found instead, e.g. "vector of 3".
 */
public record ShapeViolation(String expected, String received) {

    @Override
    public String toString() {
        return String.format("expected %s, received %s", expected, received);
    }
}
