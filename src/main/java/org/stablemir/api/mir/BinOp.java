package org.stablemir.api.mir;

public enum BinOp {
    ADD,
    ADD_UNCHECKED,
    SUB,
    SUB_UNCHECKED,
    MUL,
    MUL_UNCHECKED,
    DIV,
    REM,
    BIT_XOR,
    BIT_AND,
    BIT_OR,
    SHL,
    SHL_UNCHECKED,
    SHR,
    SHR_UNCHECKED,
    EQ,
    LT,
    LE,
    NE,
    GE,
    GT,
    OFFSET
}
