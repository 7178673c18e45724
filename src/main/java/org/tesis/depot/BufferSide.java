package org.tesis.depot;

public enum BufferSide {
    LEFT, BOTTOM, RIGHT, TOP
}
