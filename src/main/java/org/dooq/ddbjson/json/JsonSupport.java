package org.dooq.ddbjson.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.jetbrains.annotations.NotNull;

/**
 * Shared Jackson setup: one document per parse, compact or two-space indented output, decimals never in exponent form.
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    private static final ObjectWriter COMPACT = MAPPER.writer();

    private static final ObjectWriter PRETTY = MAPPER.writer(new DefaultPrettyPrinter()
            .withSeparators(Separators.createDefaultInstance()
                    .withObjectFieldValueSpacing(Separators.Spacing.NONE))
            .withObjectIndenter(INDENTER)
            .withArrayIndenter(INDENTER));

    private JsonSupport() {
    }

    public static @NotNull JsonNodeFactory nodes() {
        return MAPPER.getNodeFactory();
    }

    /**
     * @throws JsonProcessingException on malformed input, trailing tokens or empty input
     */
    public static @NotNull JsonNode parse(@NotNull String text) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(text);

        if (node == null || node.isMissingNode()) {
            throw new JsonProcessingException("No JSON content") {
            };
        }

        return node;
    }

    public static @NotNull String write(@NotNull JsonNode node, boolean pretty) throws JsonProcessingException {
        return (pretty ? PRETTY : COMPACT).writeValueAsString(node);
    }
}
