package com.purchasingpower.kgengine.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends RuntimeException {

    private final int leftDimension;
    private final int rightDimension;

    public DimensionMismatchException(int leftDimension, int rightDimension) {
        super("Vectors must have the same dimension: " + leftDimension + " != " + rightDimension);
        this.leftDimension = leftDimension;
        this.rightDimension = rightDimension;
    }
}
