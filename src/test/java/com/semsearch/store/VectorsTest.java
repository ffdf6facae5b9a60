package com.semsearch.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorsTest {

    @Test
    void shouldNormalizeToUnitLengthWithoutTouchingInput() {
        float[] input = { 3f, 4f };

        float[] normalized = Vectors.normalize(input);

        assertNotSame(input, normalized);
        assertArrayEquals(new float[] { 3f, 4f }, input);
        assertEquals(0.6f, normalized[0], 1e-6);
        assertEquals(0.8f, normalized[1], 1e-6);
        assertEquals(1.0f, Vectors.similarity(normalized, normalized), 1e-6);
    }

    @Test
    void shouldLeaveZeroVectorAsZeros() {
        assertArrayEquals(new float[] { 0f, 0f, 0f }, Vectors.normalize(new float[3]));
    }

    @Test
    void shouldComputeSymmetricSimilarityAndDistance() {
        float[] a = Vectors.normalize(new float[] { 1f, 2f, 3f });
        float[] b = Vectors.normalize(new float[] { -2f, 0.5f, 1f });

        assertEquals(Vectors.similarity(a, b), Vectors.similarity(b, a), 1e-7);
        assertEquals(1f - Vectors.similarity(a, b), Vectors.cosineDistance(a, b), 1e-7);
        assertEquals(0f, Vectors.cosineDistance(a, a), 1e-6);
    }

    @Test
    void shouldRoundTripLittleEndianBlob() {
        float[] vector = { 0.1f, -2.5f, 1e-3f, 42f };

        byte[] blob = Vectors.toBlob(vector);

        assertEquals(16, blob.length);
        // 0.1f = 0x3DCCCCCD, low byte first
        assertEquals((byte) 0xCD, blob[0]);
        assertEquals((byte) 0x3D, blob[3]);
        float[] decoded = Vectors.fromBlob(blob);
        for (int i = 0; i < vector.length; i++) {
            assertEquals(vector[i], decoded[i], 1e-5);
        }
        assertEquals(0, Vectors.fromBlob(null).length);
    }

    @Test
    void shouldDetectNonFiniteValues() {
        assertTrue(Vectors.allFinite(new float[] { 1f, -1f }));
        assertFalse(Vectors.allFinite(new float[] { 1f, Float.NaN }));
        assertFalse(Vectors.allFinite(new float[] { Float.NEGATIVE_INFINITY }));
    }
}
