package io.mnemo.core.vector;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

public final class Embeddings {
    private static final double MIN_NORM = 1e-12;

    private Embeddings() {
    }

    /**
     * Returns a unit-length copy of {@code embedding}. A zero vector is returned unchanged.
     */
    public static float[] normalize(float[] embedding) {
        if (embedding == null) {
            return null;
        }
        double sum = 0.0;
        for (float value : embedding) {
            sum += (double) value * value;
        }
        double norm = Math.sqrt(sum);
        float[] normalized = new float[embedding.length];
        if (norm < MIN_NORM || !Double.isFinite(norm)) {
            System.arraycopy(embedding, 0, normalized, 0, embedding.length);
            return normalized;
        }
        for (int i = 0; i < embedding.length; i++) {
            normalized[i] = (float) (embedding[i] / norm);
        }
        return normalized;
    }

    /**
     * Inner product of two unit vectors, i.e. their cosine similarity.
     */
    public static double dot(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return Double.isFinite(dot) ? dot : 0.0;
    }

    /**
     * Converts an L2 distance between unit vectors back to cosine similarity.
     */
    public static double similarityFromL2(double distance) {
        return 1.0 - (distance * distance) / 2.0;
    }

    public static byte[] toBlob(float[] embedding) {
        ByteBuffer buffer = ByteBuffer.allocate(embedding.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : embedding) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] fromBlob(byte[] blob) {
        if (blob == null) {
            return new float[0];
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] embedding = new float[blob.length / Float.BYTES];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = buffer.getFloat();
        }
        return embedding;
    }
}
