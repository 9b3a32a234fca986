package org.dooq.tests;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.dooq.ddbjson.DynamoJson;
import org.dooq.ddbjson.ItemConverter;
import org.dooq.ddbjson.json.EnvelopePolicy;
import org.dooq.ddbjson.json.JsonSupport;
import org.dooq.ddbjson.transfer.DynamoJsonTransfer;
import org.dooq.ddbjson.transfer.Mode;
import org.dooq.ddbjson.transfer.TransferOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

public class CustomConverterTests {

    private final ItemConverter converter = new CustomStringConverter();

    @Test
    void overriddenWriteReachesNestedValues() throws JsonProcessingException {
        var normal = JsonSupport.parse("{\"name\":\"Alex\",\"hobbies\":[\"football\"],\"address\":{\"city\":\"x\"},\"age\":33}");

        var result = DynamoJson.toTagged(normal, false, converter);

        System.out.println(result);

        Assertions.assertEquals(JsonSupport.parse("""
                {"name":{"S":"custom"},
                 "hobbies":{"L":[{"S":"custom"}]},
                 "address":{"M":{"city":{"S":"custom"}}},
                 "age":{"N":"33"}}
                """), result);
    }

    @Test
    void overriddenParseReachesSets() throws JsonProcessingException {
        var tagged = JsonSupport.parse("{\"b\":{\"B\":\"AQI=\"},\"bs\":{\"BS\":[\"AQ==\"]}}");

        var result = DynamoJson.fromTagged(tagged, EnvelopePolicy.UNWRAP, converter);

        Assertions.assertEquals(JsonSupport.parse("{\"b\":\"binary:AQI=\",\"bs\":[\"binary:AQ==\"]}"), result);
    }

    @Test
    void defaultConverterUntouched() throws JsonProcessingException {
        Assertions.assertEquals("{\"name\":{\"S\":\"Alex\"}}", DynamoJson.toTagged("{\"name\":\"Alex\"}", false));
    }

    @Test
    void transferWithCustomConverter() throws IOException {
        var options = TransferOptions.defaults(Mode.TO_DDB);
        var output = new StringWriter();

        new DynamoJsonTransfer(options, converter).transfer(new StringReader("{\"a\":\"b\"}\n"), output);

        Assertions.assertEquals("{\"Item\":{\"a\":{\"S\":\"custom\"}}}\n", output.toString());
    }
}
