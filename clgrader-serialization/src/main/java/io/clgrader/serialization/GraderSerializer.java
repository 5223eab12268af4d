package io.clgrader.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clgrader.core.assessment.Assessment;
import io.clgrader.core.result.ResultNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Utility class for reading assessments and writing result trees as JSON.
///
/// ### Usage
/// {@snippet :
/// Assessment assessment = GraderSerializer.readAssessment(Path.of("assessment.json"));
///
/// GradingResult result = env.grade(assessment, resolver);
/// if (result instanceof GradingResult.Completed completed) {
///     String report = GraderSerializer.toJson(completed.tree());
/// }
/// }
///
/// @implNote Thread-safe. The `ObjectMapper` is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see GraderJacksonModule for the registered type handlers
public final class GraderSerializer {

    private GraderSerializer() {}

    /// Reads an assessment from its JSON configuration.
    ///
    /// @param json JSON string, not null
    /// @return the assessment, never null
    /// @throws IllegalArgumentException if the JSON is malformed or invalid; the message
    ///     names the JSON path of the problem
    public static Assessment assessmentFromJson(String json) {
        try {
            return createMapper().readValue(json, Assessment.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to read assessment: " + e.getOriginalMessage(), e);
        }
    }

    /// Reads an assessment from a UTF-8 JSON file.
    ///
    /// @param file path to the configuration, not null
    /// @return the assessment, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is malformed or invalid
    public static Assessment readAssessment(Path file) throws IOException {
        return assessmentFromJson(Files.readString(file));
    }

    /// Serializes a result tree to pretty-printed JSON.
    ///
    /// @param result the tree, not null
    /// @return JSON string, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ResultNode result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize result: " + e.getMessage(), e);
        }
    }

    /// Reads a result tree written by {@link #toJson(ResultNode)}.
    ///
    /// @param json JSON string, not null
    /// @return the tree, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static ResultNode resultFromJson(String json) {
        try {
            return createMapper().readValue(json, ResultNode.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize result: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for grader types.
    ///
    /// Registers:
    /// - `GraderJacksonModule` for assessments and result trees
    /// - `JavaTimeModule` for `Duration` fields
    /// - Durations written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new GraderJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
