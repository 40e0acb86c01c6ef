package org.carball.sqladvisor.model.fact;

public enum RowCountEstimate {
    SMALL,
    LARGE
}
