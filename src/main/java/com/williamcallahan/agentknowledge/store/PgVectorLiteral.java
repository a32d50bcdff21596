package com.williamcallahan.agentknowledge.store;

/**
 * Renders vectors in pgvector's text input format, e.g. {@code [0.1,0.2,0.3]}.
 *
 * <p>Values are bound as strings and cast with {@code ?::vector}, so no driver-side type is needed.</p>
 */
final class PgVectorLiteral {

    private PgVectorLiteral() {}

    static String format(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Vector must not be empty");
        }
        StringBuilder literal = new StringBuilder(vector.length * 10 + 2);
        literal.append('[');
        for (int index = 0; index < vector.length; index++) {
            float component = vector[index];
            if (!Float.isFinite(component)) {
                throw new IllegalArgumentException("Vector component at index " + index + " is not finite");
            }
            if (index > 0) {
                literal.append(',');
            }
            literal.append(Float.toString(component));
        }
        return literal.append(']').toString();
    }
}
