package com.semsearch.store;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Vector arithmetic shared by indexing, storage and retrieval.
 */
public final class Vectors {
    private Vectors() {
    }

    /**
     * Returns a unit-length copy of {@code vector}. A zero vector is returned unchanged (the norm is floored at 1).
     */
    public static float[] normalize(float[] vector) {
        double norm = 0d;
        for (float value : vector) {
            norm += (double) value * value;
        }
        norm = Math.sqrt(norm);
        if (norm == 0d) {
            norm = 1d;
        }
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / norm);
        }
        return out;
    }

    /**
     * Dot product over the shared prefix. Equals cosine similarity when both sides are normalized.
     */
    public static float similarity(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double dot = 0d;
        for (int i = 0; i < len; i++) {
            dot += (double) a[i] * b[i];
        }
        return (float) dot;
    }

    public static float cosineDistance(float[] a, float[] b) {
        return 1f - similarity(a, b);
    }

    public static boolean allFinite(float[] vector) {
        for (float value : vector) {
            if (!Float.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Little-endian float32 encoding used for the embedding column of the store file.
     */
    public static byte[] toBlob(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] fromBlob(byte[] blob) {
        if (blob == null) {
            return new float[0];
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] out = new float[blob.length / Float.BYTES];
        for (int i = 0; i < out.length; i++) {
            out[i] = buffer.getFloat();
        }
        return out;
    }
}
