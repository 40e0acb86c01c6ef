package org.carball.sqladvisor.model.fact;

public enum AttributeKind {
    BOOLEAN,
    NUMBER,
    ENUM
}
