package org.iceforge.pivot.model;

public enum Axis {
    ROW,
    COLUMN
}
