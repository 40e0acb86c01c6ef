package org.carball.sqladvisor.capability;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CapabilityDocument {
    private String version;
    private List<CapabilityRow> capabilities = new ArrayList<>();
}
