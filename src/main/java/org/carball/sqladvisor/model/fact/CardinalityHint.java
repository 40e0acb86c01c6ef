package org.carball.sqladvisor.model.fact;

public enum CardinalityHint {
    SCALAR,
    SET
}
