package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Classification level a peer set was drawn from. */
public enum PeerGroup {
    INDUSTRY,
    SECTOR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
