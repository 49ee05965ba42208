package com.fitplan.backend.sheet.layout;

public enum EntryRole {
    PRIMARY,
    PARTNER
}
