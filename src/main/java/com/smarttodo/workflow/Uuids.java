package com.smarttodo.workflow;

import java.util.UUID;

final class Uuids {

    private Uuids() {
    }

    /**
     * @return the parsed id, or null when {@code raw} is not a UUID
     */
    static UUID parse(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return UUID.fromString(raw.strip());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
