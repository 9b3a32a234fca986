package org.dooq.tests;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.dooq.ddbjson.DynamoJson;
import org.dooq.ddbjson.ItemConverter;
import org.dooq.ddbjson.json.JsonSupport;
import org.dooq.ddbjson.json.NormalJson;
import org.dooq.ddbjson.model.NormalValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RoundTripTests {

    private final ItemConverter converter = DynamoJson.getConverter();

    private static NormalValue.Mapping sample() {
        Map<String, NormalValue> address = new LinkedHashMap<>();
        address.put("city", new NormalValue.Text("Lisbon"));
        address.put("zip", NormalValue.Null.INSTANCE);

        Map<String, NormalValue> entries = new LinkedHashMap<>();
        entries.put("name", new NormalValue.Text("Alex"));
        entries.put("age", NormalValue.Int.of(33));
        entries.put("balance", new NormalValue.Float(10.0));
        entries.put("ratio", new NormalValue.Float(0.125));
        entries.put("huge", new NormalValue.Int(new BigInteger("98765432109876543210")));
        entries.put("active", NormalValue.Bool.TRUE);
        entries.put("hobbies", NormalValue.Sequence.of(new NormalValue.Text("football"), NormalValue.Int.of(2),
                NormalValue.Sequence.of()));
        entries.put("address", new NormalValue.Mapping(address));
        entries.put("nothing", NormalValue.Null.INSTANCE);

        return new NormalValue.Mapping(entries);
    }

    @Test
    void writeAndRead() {
        var item = sample();

        var document = converter.marshallItem(item, true);

        System.out.println(document);

        Assertions.assertTrue(document.wrapped());
        Assertions.assertEquals(item.entries().size(), document.item().size());

        var result = converter.unmarshallItem(document.unwrap());

        Assertions.assertEquals(item, result);
    }

    @Test
    void writeAndReadThroughJsonText() throws JsonProcessingException {
        var item = sample();
        var text = JsonSupport.write(NormalJson.write(item), false);

        var tagged = DynamoJson.toTagged(text, true);
        var back = DynamoJson.fromTagged(tagged);

        Assertions.assertEquals(text, back);
    }

    @Test
    void intLikeFloatsSurvive() throws JsonProcessingException {
        for (var literal : List.of("4.0", "0.0", "-1.0", "100.0", "1.5", "12345678.5", "0.0005", "1700000000.25")) {
            var json = "{\"value\":" + literal + "}";
            Assertions.assertEquals(json, DynamoJson.fromTagged(DynamoJson.toTagged(json, true)), literal);
        }
    }

    @Test
    void setShapeIsNotRestored() throws JsonProcessingException {
        var normal = DynamoJson.fromTagged("{\"tags\":{\"SS\":[\"x\",\"y\"]}}");
        var tagged = DynamoJson.toTagged(normal, false);

        Assertions.assertEquals("{\"tags\":{\"L\":[{\"S\":\"x\"},{\"S\":\"y\"}]}}", tagged);
    }

    @Test
    void deeplyNestedObjects() throws JsonProcessingException {
        for (int depth : new int[]{1, 16, 31, 32}) {
            var json = nestedObjects(depth);
            Assertions.assertEquals(json, DynamoJson.fromTagged(DynamoJson.toTagged(json, true)), "depth " + depth);
        }
    }

    @Test
    void deeplyNestedArrays() throws JsonProcessingException {
        for (int depth : new int[]{1, 16, 31, 32}) {
            var json = "{\"a\":" + "[".repeat(depth) + "1" + "]".repeat(depth) + "}";
            Assertions.assertEquals(json, DynamoJson.fromTagged(DynamoJson.toTagged(json, false)), "depth " + depth);
        }
    }

    @Test
    void mixedNesting() throws JsonProcessingException {
        var json = "{\"a\":[{\"b\":[{\"c\":[1,2.5,\"x\",null,true]}]},[],{}]}";

        Assertions.assertEquals(json, DynamoJson.fromTagged(DynamoJson.toTagged(json, true)));
    }

    private static String nestedObjects(int depth) {
        var builder = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            builder.append("{\"level").append(i).append("\":");
        }
        builder.append("\"bottom\"");
        builder.append("}".repeat(depth));
        return builder.toString();
    }
}
