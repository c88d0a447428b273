package com.salesinsight.domain.model;

public enum MatrixCell {
    AX, AY, AZ,
    BX, BY, BZ,
    CX, CY, CZ;

    public static MatrixCell of(AbcClass abc, XyzClass xyz) {
        return valueOf(abc.name() + xyz.name());
    }
}
