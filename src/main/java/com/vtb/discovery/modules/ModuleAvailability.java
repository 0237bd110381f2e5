package com.vtb.discovery.modules;

import lombok.Value;

@Value
public class ModuleAvailability {
    boolean available;
    String reason;

    public static ModuleAvailability available() {
        return new ModuleAvailability(true, null);
    }

    public static ModuleAvailability unavailable(String reason) {
        return new ModuleAvailability(false, reason);
    }
}
