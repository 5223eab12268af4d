package io.clgrader.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.clgrader.core.assessment.GradingMode;
import io.clgrader.core.evaluation.AssertionResult;
import io.clgrader.core.evaluation.PredicateDiagnostic;
import io.clgrader.core.result.NodeKind;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import java.io.IOException;
import java.io.Serial;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/// Reads a result tree written by {@link ResultNodeSerializer}.
///
/// Scores are taken as written; nothing is re-aggregated.
///
/// @implNote Package-private. Registered by {@link GraderJacksonModule}.
class ResultNodeDeserializer extends StdDeserializer<ResultNode> {

    @Serial private static final long serialVersionUID = 2719150366842240917L;

    ResultNodeDeserializer() {
        super(ResultNode.class);
    }

    @Override
    public ResultNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return readNode(mapper, mapper.readTree(p));
    }

    private ResultNode readNode(ObjectMapper mapper, JsonNode root) throws IOException {
        ResultNode.Builder b =
                ResultNode.builder()
                        .name(root.get("name").asText())
                        .kind(NodeKind.valueOf(root.get("kind").asText()))
                        .weight(root.path("weight").asInt(1))
                        .earned(root.path("earned").asLong())
                        .possible(root.path("possible").asLong())
                        .score(root.path("score").asDouble())
                        .visible(root.path("visible").asBoolean(true));

        if (root.hasNonNull("status")) {
            b.status(ResultStatus.valueOf(root.get("status").asText()));
        }
        if (root.hasNonNull("gradingMode")) {
            b.gradingMode(GradingMode.valueOf(root.get("gradingMode").asText()));
        }
        if (root.hasNonNull("elapsed")) {
            b.elapsed(mapper.treeToValue(root.get("elapsed"), Duration.class));
        }
        for (JsonNode diagnostic : root.path("diagnostics")) {
            b.diagnostic(diagnostic.asText());
        }
        for (JsonNode assertion : root.path("assertions")) {
            b.assertion(readAssertion(assertion));
        }
        for (JsonNode child : root.path("children")) {
            b.child(readNode(mapper, child));
        }
        return b.build();
    }

    private AssertionResult readAssertion(JsonNode node) {
        List<PredicateDiagnostic> diagnostics = new ArrayList<>();
        for (JsonNode d : node.path("diagnostics")) {
            diagnostics.add(
                    new PredicateDiagnostic(
                            d.get("subject").asText(),
                            d.get("expected").asText(),
                            d.get("actual").asText(),
                            d.get("passed").asBoolean()));
        }
        return new AssertionResult(
                node.get("label").asText(), node.get("passed").asBoolean(), diagnostics);
    }
}
