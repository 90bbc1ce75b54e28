package io.mnemo.core.vector;

import java.io.IOException;

/**
 * Computes embeddings for text. Implemented outside this library; the store only keeps and
 * compares the vectors it is given.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    float[] embed(String text) throws IOException;
}
