package org.dxworks.flowframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static final List<String> SAMPLES = List.of(
            "grades.pseudo", "factorial.pseudo", "sign.pseudo", "counter.pseudo",
            "table.pseudo", "weekday.pseudo", "parity.pseudo", "tree.pseudo");

    public static Path samplePath(String name) {
        return Paths.get("src/test/resources/samples/pseudo", name);
    }

    public static String sample(String name) {
        try {
            return Files.readString(samplePath(name), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
