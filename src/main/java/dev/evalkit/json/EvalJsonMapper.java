package dev.evalkit.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.SneakyThrows;

/**
 * Centralized Jackson configuration for evalkit.
 *
 * <p>Serialization ({@link #toJson}) is used for score reports. Parsing ({@link #readTree}) is the
 * single entry point the parsing heuristics use to decide whether model output is JSON.
 */
public final class EvalJsonMapper {

    private static volatile ObjectMapper instance;
    private static volatile ObjectReader strictTreeReader;

    private EvalJsonMapper() {}

    public static ObjectMapper get() {
        if (instance == null) {
            synchronized (EvalJsonMapper.class) {
                if (instance == null) {
                    var mapper = createMapper();
                    strictTreeReader =
                            mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
                    instance = mapper;
                }
            }
        }
        return instance;
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setDefaultPropertyInclusion(JsonInclude.Include.NON_ABSENT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return get().writeValueAsString(o);
    }

    /**
     * Parse model output as exactly one JSON value. Text after the first value is an error, so
     * {@code "{} {}"} is not JSON. Blank text yields a missing node rather than an exception.
     *
     * @throws JsonProcessingException if the text is not a single well-formed JSON value
     */
    public static JsonNode readTree(String text) throws JsonProcessingException {
        get();
        return strictTreeReader.readTree(text);
    }
}
