package com.factory.edge.connector;

/**
 * OPC UA StatusCode attached to a reading. The two high bits carry the
 * severity: 00 good, 01 uncertain, 10 bad.
 */
public record QualityCode(long code) {

    public static final QualityCode GOOD = new QualityCode(0L);

    private static final long SEVERITY_MASK = 0xC0000000L;
    private static final long SEVERITY_UNCERTAIN = 0x40000000L;
    private static final long SEVERITY_BAD = 0x80000000L;

    public boolean isGood() {
        return (code & SEVERITY_MASK) == 0;
    }

    public boolean isUncertain() {
        return (code & SEVERITY_MASK) == SEVERITY_UNCERTAIN;
    }

    public boolean isBad() {
        return (code & SEVERITY_MASK) == SEVERITY_BAD;
    }

    public String status() {
        if (isBad()) {
            return "BAD";
        }
        return isUncertain() ? "UNCERTAIN" : "GOOD";
    }
}
