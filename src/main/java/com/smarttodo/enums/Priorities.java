package com.smarttodo.enums;

/**
 * Task priority ordinals: 1 = High, 2 = Medium, 3 = Low.
 */
public final class Priorities {

    public static final int HIGH = 1;
    public static final int MEDIUM = 2;
    public static final int LOW = 3;

    private Priorities() {
    }

    public static boolean isValid(int priority) {
        return priority >= HIGH && priority <= LOW;
    }

    public static String label(int priority) {
        switch (priority) {
            case HIGH:
                return "High";
            case MEDIUM:
                return "Medium";
            case LOW:
                return "Low";
            default:
                return "Unknown";
        }
    }
}
