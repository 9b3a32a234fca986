package org.dooq.ddbjson.transfer;

import org.dooq.ddbjson.json.EnvelopePolicy;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * @param mode           conversion direction
 * @param pretty         two-space indented output instead of one document per line
 * @param wrapItem       write {@code {"Item": ...}} around items, to-ddb only
 * @param envelopePolicy how a top level {@code Item} key is read, from-ddb only
 */
public record TransferOptions(@NotNull Mode mode, boolean pretty, boolean wrapItem,
                              @NotNull EnvelopePolicy envelopePolicy) {

    public static final String PRETTY_PROPERTY = "ddbjson.pretty";
    public static final String WITHOUT_ITEM_PROPERTY = "ddbjson.without-item";
    public static final String ITEM_AS_FIELD_PROPERTY = "ddbjson.item-as-field";

    public TransferOptions {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(envelopePolicy, "envelopePolicy");
    }

    @Contract("_ -> new")
    public static @NotNull TransferOptions defaults(@NotNull Mode mode) {
        return new TransferOptions(mode, false, true, EnvelopePolicy.UNWRAP);
    }

    public static @NotNull TransferOptions fromSystemProperties(@NotNull Mode mode) {
        return new TransferOptions(mode,
                flag(PRETTY_PROPERTY),
                !flag(WITHOUT_ITEM_PROPERTY),
                flag(ITEM_AS_FIELD_PROPERTY) ? EnvelopePolicy.AS_FIELD : EnvelopePolicy.UNWRAP);
    }

    private static boolean flag(String property) {
        return System.getProperty(property, "false").equalsIgnoreCase("true");
    }

    public @NotNull TransferOptions withPretty(boolean pretty) {
        return new TransferOptions(mode, pretty, wrapItem, envelopePolicy);
    }

    public @NotNull TransferOptions withWrapItem(boolean wrapItem) {
        return new TransferOptions(mode, pretty, wrapItem, envelopePolicy);
    }

    public @NotNull TransferOptions withEnvelopePolicy(@NotNull EnvelopePolicy envelopePolicy) {
        return new TransferOptions(mode, pretty, wrapItem, envelopePolicy);
    }
}
