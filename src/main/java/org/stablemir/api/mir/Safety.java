package org.stablemir.api.mir;

public enum Safety { UNSAFE, NORMAL }
