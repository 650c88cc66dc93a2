package com.smarttodo.enums;

public enum EntryType {
    MESSAGE("Message"),
    EMAIL("Email"),
    NOTE("Note"),
    MEETING("Meeting"),
    CALL("Phone Call"),
    DOCUMENT("Document");

    private final String label;

    EntryType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
