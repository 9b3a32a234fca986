package org.dooq.ddbjson.transfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.dooq.ddbjson.ConversionException;
import org.dooq.ddbjson.DynamoJson;
import org.dooq.ddbjson.ItemConverter;
import org.dooq.ddbjson.json.Framing;
import org.dooq.ddbjson.json.JsonSupport;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves documents from a reader to a writer, converting each one.
 * <p>
 * The input is either one JSON document, which may span many lines, or JSON Lines. Files named
 * {@code *.jsonl} are JSON Lines; otherwise the first line decides: if it is a complete JSON value
 * on its own, every line is a document. Blank lines of JSON Lines input are skipped, output keeps
 * the input order and every output document ends with a newline.
 *
 * @author alex
 */
public class DynamoJsonTransfer {

    public static boolean DEBUG = System.getProperty("ddbjson.debug", "false").equalsIgnoreCase("true");

    private static final Logger LOGGER = Logger.getLogger(DynamoJsonTransfer.class.getName());

    private final TransferOptions options;
    private final ItemConverter converter;

    public DynamoJsonTransfer(@NotNull TransferOptions options) {
        this(options, DynamoJson.getConverter());
    }

    public DynamoJsonTransfer(@NotNull TransferOptions options, @NotNull ItemConverter converter) {
        this.options = options;
        this.converter = converter;
    }

    public @NotNull TransferOptions getOptions() {
        return options;
    }

    /**
     * @return number of documents written
     */
    public long transfer(@NotNull Path input, @NotNull Path output) throws IOException {
        try (var reader = Files.newBufferedReader(input);
             var writer = Files.newBufferedWriter(output)) {

            if (input.getFileName().toString().endsWith(".jsonl")) {
                return transferLines(reader, writer, null);
            }

            return transfer(reader, writer);
        }
    }

    /**
     * @return number of documents written
     */
    public long transfer(@NotNull Reader input, @NotNull Writer output) throws IOException {
        BufferedReader reader = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);

        String firstLine = reader.readLine();

        if (firstLine != null && Framing.looksLikeSingleJsonValue(firstLine)) {
            return transferLines(reader, output, firstLine);
        }

        var content = new StringWriter();

        if (firstLine != null) {
            content.write(firstLine);
            content.write('\n');
        }

        reader.transferTo(content);

        return transferDocument(content.toString(), output);
    }

    private long transferLines(BufferedReader reader, Writer output, @Nullable String firstLine) throws IOException {

        if (DEBUG) {
            LOGGER.log(Level.INFO, "Converting JSON Lines input, mode " + options.mode().label());
        }

        long lineNumber = 0;
        long written = 0;

        String line = firstLine != null ? firstLine : reader.readLine();

        while (line != null) {
            lineNumber++;

            if (!line.isBlank()) {
                write(convert(line, lineNumber), output);
                written++;
            }

            line = reader.readLine();
        }

        output.flush();

        return written;
    }

    private long transferDocument(String content, Writer output) throws IOException {

        if (DEBUG) {
            LOGGER.log(Level.INFO, "Converting single JSON document, mode " + options.mode().label());
        }

        write(convert(content, 0), output);
        output.flush();

        return 1;
    }

    private JsonNode convert(String text, long lineNumber) {
        JsonNode input;

        try {
            input = JsonSupport.parse(text);
        } catch (JsonProcessingException ex) {
            throw new TransferException(lineNumber, "Invalid JSON: " + ex.getOriginalMessage(), ex);
        }

        try {
            return convert(input);
        } catch (ConversionException ex) {
            LOGGER.log(Level.FINE, "Conversion failed", ex);
            throw new TransferException(lineNumber, ex.getMessage(), ex);
        }
    }

    /**
     * One document in the configured direction, without any framing.
     */
    public @NotNull JsonNode convert(@NotNull JsonNode input) {
        return switch (options.mode()) {
            case FROM_DDB -> DynamoJson.fromTagged(input, options.envelopePolicy(), converter);
            case TO_DDB -> DynamoJson.toTagged(input, options.wrapItem(), converter);
        };
    }

    private void write(JsonNode document, Writer output) throws IOException {
        output.write(JsonSupport.write(document, options.pretty()));
        output.write('\n');
    }
}
