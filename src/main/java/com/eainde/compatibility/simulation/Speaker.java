package com.eainde.compatibility.simulation;

/**
 * The two fixed roles of a simulated conversation. {@link #USER_A} always speaks first.
 */
public enum Speaker {
    USER_A("user_a"),
    USER_B("user_b");

    private final String tag;

    Speaker(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
