package io.clgrader.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.clgrader.core.evaluation.AssertionResult;
import io.clgrader.core.evaluation.PredicateDiagnostic;
import io.clgrader.core.result.ResultNode;
import java.io.IOException;
import java.io.Serial;

/// Writes a result tree for report generators.
///
/// ```
/// field         written
/// ——————————————+——————————————————————————————————————————————————
/// name, kind    │ always
/// status        │ when set (absent only on unaggregated interior nodes)
/// weight        │ always
/// earned,       │ always
/// possible,     │
/// score         │
/// gradingMode   │ when set
/// visible       │ always
/// elapsed       │ always, ISO-8601 duration
/// diagnostics   │ when not empty
/// assertions    │ when not empty; label, passed, diagnostics[]
/// children      │ when not empty
/// ```
///
/// @implNote Package-private. Registered by {@link GraderJacksonModule}.
/// @see ResultNodeDeserializer for the inverse operation
class ResultNodeSerializer extends StdSerializer<ResultNode> {

    @Serial private static final long serialVersionUID = -6047329950361804211L;

    ResultNodeSerializer() {
        super(ResultNode.class);
    }

    @Override
    public void serialize(ResultNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", node.getName());
        gen.writeStringField("kind", node.getKind().name());
        if (node.getStatus() != null) {
            gen.writeStringField("status", node.getStatus().name());
        }
        gen.writeNumberField("weight", node.getWeight());
        gen.writeNumberField("earned", node.getEarned());
        gen.writeNumberField("possible", node.getPossible());
        gen.writeNumberField("score", node.getScore());
        if (node.getGradingMode() != null) {
            gen.writeStringField("gradingMode", node.getGradingMode().name());
        }
        gen.writeBooleanField("visible", node.isVisible());
        provider.defaultSerializeField("elapsed", node.getElapsed(), gen);

        if (!node.getDiagnostics().isEmpty()) {
            provider.defaultSerializeField("diagnostics", node.getDiagnostics(), gen);
        }
        if (!node.getAssertions().isEmpty()) {
            gen.writeArrayFieldStart("assertions");
            for (AssertionResult assertion : node.getAssertions()) {
                writeAssertion(assertion, gen);
            }
            gen.writeEndArray();
        }
        if (!node.getChildren().isEmpty()) {
            gen.writeArrayFieldStart("children");
            for (ResultNode child : node.getChildren()) {
                serialize(child, gen, provider);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    private void writeAssertion(AssertionResult assertion, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("label", assertion.label());
        gen.writeBooleanField("passed", assertion.passed());
        gen.writeArrayFieldStart("diagnostics");
        for (PredicateDiagnostic diagnostic : assertion.diagnostics()) {
            gen.writeStartObject();
            gen.writeStringField("subject", diagnostic.subject());
            gen.writeStringField("expected", diagnostic.expected());
            gen.writeStringField("actual", diagnostic.actual());
            gen.writeBooleanField("passed", diagnostic.passed());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
