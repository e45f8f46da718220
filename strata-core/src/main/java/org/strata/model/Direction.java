package org.strata.model;

public enum Direction {
    UPGRADE,
    DOWNGRADE
}
