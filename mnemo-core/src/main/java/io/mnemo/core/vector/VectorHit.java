package io.mnemo.core.vector;

/**
 * A nearest-neighbour match. {@code similarity} is the cosine similarity between the query and
 * the stored vector, both unit length.
 */
public record VectorHit(long id, double similarity) {
}
