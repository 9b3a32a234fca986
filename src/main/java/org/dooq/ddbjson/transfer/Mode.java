package org.dooq.ddbjson.transfer;

public enum Mode {
    FROM_DDB("from-ddb"),
    TO_DDB("to-ddb");

    private final String label;

    Mode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
