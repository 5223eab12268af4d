package io.clgrader.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.clgrader.core.assessment.Assessment;
import io.clgrader.core.result.ResultNode;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the grader's serializers in one place.
///
/// - `Assessment` - `AssessmentDeserializer`, reads the JSON configuration format
/// - `ResultNode` - `ResultNodeSerializer` / `ResultNodeDeserializer`
///
/// Assessments are read only; the configuration file is the source of truth for them.
///
/// @see GraderSerializer for the convenience factory API
public class GraderJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5129647082934119750L;

    public GraderJacksonModule() {
        super("GraderJacksonModule");

        addDeserializer(Assessment.class, new AssessmentDeserializer());

        addSerializer(ResultNode.class, new ResultNodeSerializer());
        addDeserializer(ResultNode.class, new ResultNodeDeserializer());
    }
}
