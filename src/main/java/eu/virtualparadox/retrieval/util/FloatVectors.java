package eu.virtualparadox.retrieval.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Helpers for dense float vectors: stored-field encoding and validity checks.
 */
public final class FloatVectors {

    private FloatVectors() {
        // prevent instantiation
    }

    /**
     * Encodes a vector as little-endian IEEE 754 floats.
     */
    public static byte[] toBytes(final float[] vector) {
        final ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (final float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    /**
     * Decodes a vector written by {@link #toBytes(float[])}.
     *
     * @return the vector, or {@code null} if the payload is missing or not a whole number of floats
     */
    public static float[] fromBytes(final byte[] bytes, final int offset, final int length) {
        if (bytes == null || length == 0 || length % Float.BYTES != 0) {
            return null;
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, length).order(ByteOrder.LITTLE_ENDIAN);
        final float[] vector = new float[length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    /**
     * @return {@code true} if the vector is non-empty and contains only finite values
     */
    public static boolean isWellFormed(final float[] vector) {
        if (vector == null || vector.length == 0) {
            return false;
        }
        for (final float v : vector) {
            if (!Float.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
