package io.ucmsdk.core.model;

/** The remote management APIs a facade can be bound to. */
public enum Backend {
    AXL("AXL"),
    RISPORT("RisPort70"),
    CUPI("CUPI"),
    UDS("UDS");

    private final String displayName;

    Backend(String displayName) {
        this.displayName = displayName;
    }

    /** Name used in log lines and diagnostics. */
    public String displayName() {
        return displayName;
    }
}
