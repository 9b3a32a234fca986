package org.dooq.ddbjson.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tells JSON Lines input apart from a single, possibly multi-line, JSON document.
 */
public final class Framing {

    private static final Logger LOGGER = Logger.getLogger(Framing.class.getName());

    private Framing() {
    }

    /**
     * True iff the probe holds exactly one complete JSON value. Applied to the first line of an input,
     * a true answer means the input is JSON Lines.
     */
    @Contract("null -> false")
    public static boolean looksLikeSingleJsonValue(@Nullable String probe) {
        if (probe == null || probe.isBlank()) return false;

        try {
            JsonSupport.parse(probe.strip());
            return true;
        } catch (JsonProcessingException ex) {
            LOGGER.log(Level.FINEST, "Probe is not a complete JSON value: " + ex.getOriginalMessage());
            return false;
        }
    }
}
