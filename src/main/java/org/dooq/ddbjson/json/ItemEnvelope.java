package org.dooq.ddbjson.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dooq.ddbjson.model.Document;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The optional {@code {"Item": {...}}} wrapper, decided by shape alone.
 */
public final class ItemEnvelope {

    private ItemEnvelope() {
    }

    /**
     * True iff the node is an object with the single key {@code Item} whose value is itself an object.
     */
    @Contract("null -> false")
    public static boolean isWrapped(@Nullable JsonNode node) {
        if (node == null || !node.isObject() || node.size() != 1) return false;

        JsonNode item = node.get(Document.ITEM_KEY);

        return item != null && item.isObject();
    }

    /**
     * Anything that is not exactly an envelope comes back as is.
     */
    public static @NotNull JsonNode unwrap(@NotNull JsonNode node) {
        return isWrapped(node) ? node.get(Document.ITEM_KEY) : node;
    }

    @Contract("_ -> new")
    public static @NotNull ObjectNode wrap(@NotNull JsonNode item) {
        ObjectNode envelope = JsonSupport.nodes().objectNode();
        envelope.set(Document.ITEM_KEY, item);
        return envelope;
    }
}
