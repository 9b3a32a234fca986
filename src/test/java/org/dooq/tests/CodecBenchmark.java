package org.dooq.tests;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.dooq.ddbjson.DynamoJson;
import org.dooq.ddbjson.json.JsonSupport;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.UncheckedIOException;
import java.util.concurrent.TimeUnit;

public class CodecBenchmark {

    public static void main(String[] args) throws RunnerException {

        Options opt = new OptionsBuilder()
                .include(CodecBenchmark.class.getSimpleName())
                .threads(4)
                .forks(1)
                .build();

        new Runner(opt).run();
    }

    static JsonNode normal = parse("""
            {"name":"Alex","age":33,"sex":true,"flags":[true],
             "hobbies":["football","basketball"],"scores":[1,2,3],
             "map":{"key":1.2},"manager":null}
            """);

    static JsonNode tagged = DynamoJson.toTagged(normal, true);

    private static JsonNode parse(String json) {
        try {
            return JsonSupport.parse(json);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    @BenchmarkMode(Mode.AverageTime)
    public JsonNode marshallBenchmark() {
        return DynamoJson.toTagged(normal, true);
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    @BenchmarkMode(Mode.AverageTime)
    public JsonNode unmarshallBenchmark() {
        return DynamoJson.fromTagged(tagged);
    }
}
