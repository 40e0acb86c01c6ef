package org.carball.sqladvisor.capability;

import lombok.Data;

@Data
public class CapabilityRow {
    private String name;
    private String category;
    private String environment;
    private String status;
    private String note;
}
