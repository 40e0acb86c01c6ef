package org.carball.sqladvisor.config;

public enum OutputFormat {
    TEXT,
    MARKDOWN,
    JSON
}
