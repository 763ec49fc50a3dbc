package com.openforge.recall.candidate;

/**
 * Two vectors from different embedding spaces were compared.
 *
 * This is a programming / deployment error (wrong collection, wrong model),
 * never a data-quality issue, so it is the one failure the retrieval path
 * lets propagate.
 */
public class VectorDimensionMismatchException extends RuntimeException {

    private final int left;
    private final int right;

    public VectorDimensionMismatchException(int left, int right) {
        super("Vector dimension mismatch: %d vs %d".formatted(left, right));
        this.left  = left;
        this.right = right;
    }

    public int left()  { return left; }
    public int right() { return right; }
}
