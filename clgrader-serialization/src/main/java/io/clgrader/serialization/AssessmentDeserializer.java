package io.clgrader.serialization;

import static io.clgrader.serialization.JsonFields.array;
import static io.clgrader.serialization.JsonFields.arguments;
import static io.clgrader.serialization.JsonFields.checkKeys;
import static io.clgrader.serialization.JsonFields.error;
import static io.clgrader.serialization.JsonFields.has;
import static io.clgrader.serialization.JsonFields.optArguments;
import static io.clgrader.serialization.JsonFields.optBoolean;
import static io.clgrader.serialization.JsonFields.optDouble;
import static io.clgrader.serialization.JsonFields.optInt;
import static io.clgrader.serialization.JsonFields.optLong;
import static io.clgrader.serialization.JsonFields.optMillis;
import static io.clgrader.serialization.JsonFields.optText;
import static io.clgrader.serialization.JsonFields.optWeight;
import static io.clgrader.serialization.JsonFields.pairs;
import static io.clgrader.serialization.JsonFields.stringList;
import static io.clgrader.serialization.JsonFields.text;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.clgrader.core.assessment.ArgumentSpec;
import io.clgrader.core.assessment.Assessment;
import io.clgrader.core.assessment.Benchmark;
import io.clgrader.core.assessment.Expectation;
import io.clgrader.core.assessment.GradingMode;
import io.clgrader.core.assessment.IntegrationStep;
import io.clgrader.core.assessment.IntegrationTestGroup;
import io.clgrader.core.assessment.LeakPolicy;
import io.clgrader.core.assessment.PerformanceTestGroup;
import io.clgrader.core.assessment.PermutationMode;
import io.clgrader.core.assessment.ProfilingConfig;
import io.clgrader.core.assessment.ProgramReference;
import io.clgrader.core.assessment.ProgramTests;
import io.clgrader.core.assessment.Section;
import io.clgrader.core.assessment.StatusPredicate;
import io.clgrader.core.assessment.StepAction;
import io.clgrader.core.assessment.StressTest;
import io.clgrader.core.assessment.TestCase;
import io.clgrader.core.assessment.TestTable;
import io.clgrader.core.assessment.TextPredicate;
import io.clgrader.core.assessment.UnitTestGroup;
import io.clgrader.core.util.ArgumentTokenizer;
import java.io.IOException;
import java.io.Serial;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Reads an {@link Assessment} from the grader's JSON configuration format.
///
/// ### Layout
/// ```
/// {
///   "title": "...", "author": "...",
///   "grading": { "mode": "weighted" | "absolute" },
///   "env": [["KEY", "value"]], "default_timeout_ms": 5000,
///   "sections": [ {
///     "title": "...", "weight": 2, "is_public": true, "grading_mode": "absolute",
///     "env": ..., "default_timeout_ms": ...,
///     "unit_tests":        { "setup": [...], "teardown": [...], "files": ..., "tests": [...] },
///     "integration_tests": { "stop_if_fail": true, "steps": [...] },
///     "performance_tests": { "benchmarks": [...] }
///   } ]
/// }
/// ```
/// `env` and `files` accept an object or an array of `[key, value]` pairs. `args` accepts
/// a shell-style string or an array. A unit test block takes its cases from
/// `detailed_tests`, from a `table` (header row followed by data rows), or from both, in
/// that order; table rows are expanded into ordinary cases here.
///
/// Unknown fields are rejected so that a misspelt key never silently drops a test. The
/// top-level `input`, `report` and `logging_mode` entries belong to the command-line front
/// end and are accepted but not read.
///
/// @implNote Package-private. Registered by {@link GraderJacksonModule}.
class AssessmentDeserializer extends StdDeserializer<Assessment> {

    @Serial private static final long serialVersionUID = 3182563402751843571L;

    private static final Set<String> ASSESSMENT_KEYS =
            Set.of(
                    "title",
                    "author",
                    "grading",
                    "env",
                    "default_timeout_ms",
                    "sections",
                    "input",
                    "report",
                    "logging_mode");
    private static final Set<String> SECTION_KEYS =
            Set.of(
                    "title",
                    "weight",
                    "is_public",
                    "grading_mode",
                    "env",
                    "default_timeout_ms",
                    "unit_tests",
                    "integration_tests",
                    "performance_tests");
    private static final Set<String> UNIT_GROUP_KEYS =
            Set.of(
                    "title",
                    "env",
                    "inherit_parent_env",
                    "files",
                    "setup",
                    "teardown",
                    "abort_on_setup_failure",
                    "tests");
    private static final Set<String> PROGRAM_KEYS =
            Set.of("title", "program_name", "table", "detailed_tests");
    private static final Set<String> EXPECTATION_KEYS =
            Set.of(
                    "stdout",
                    "stdout_regex",
                    "stderr",
                    "stderr_regex",
                    "trim",
                    "status",
                    "status_between",
                    "files");
    private static final Set<String> TEST_KEYS =
            union(
                    EXPECTATION_KEYS,
                    "name",
                    "weight",
                    "args",
                    "permutations",
                    "permute_args",
                    "permutation_mode",
                    "stdin",
                    "timeout_ms",
                    "env");
    private static final Set<String> INTEGRATION_GROUP_KEYS =
            Set.of("title", "env", "inherit_parent_env", "files", "stop_if_fail", "steps");
    private static final Set<String> STEP_KEYS =
            union(
                    EXPECTATION_KEYS,
                    "name",
                    "weight",
                    "command",
                    "program_name",
                    "args",
                    "stdin",
                    "timeout_ms");
    private static final Set<String> PERFORMANCE_GROUP_KEYS =
            Set.of("title", "env", "inherit_parent_env", "files", "benchmarks");
    private static final Set<String> BENCHMARK_KEYS =
            Set.of(
                    "name",
                    "weight",
                    "program_name",
                    "args",
                    "stdin",
                    "expected_max_time_ms",
                    "expected_max_memory_kb",
                    "timeout_ms",
                    "stress_test",
                    "profiling");
    private static final Set<String> STRESS_KEYS =
            Set.of("iterations", "generator", "generator_args", "stability_threshold");
    private static final Set<String> PROFILING_KEYS =
            Set.of("tool", "leak_exit_status", "leak_pattern", "memory_leaks");

    /// Program a unit test block targets when it names none.
    static final String DEFAULT_PROGRAM = "p1";

    AssessmentDeserializer() {
        super(Assessment.class);
    }

    @Override
    public Assessment deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return readAssessment(root);
    }

    static Assessment readAssessment(JsonNode root) throws JsonMappingException {
        String path = "$";
        checkKeys(root, path, ASSESSMENT_KEYS);
        Assessment.Builder assessment =
                Assessment.builder()
                        .title(text(root, path, "title"))
                        .author(optText(root, path, "author"))
                        .environment(pairs(root, path, "env"))
                        .defaultTimeout(optMillis(root, path, "default_timeout_ms"));

        if (has(root, "grading")) {
            JsonNode grading = root.get("grading");
            checkKeys(grading, path + ".grading", Set.of("mode"));
            String mode = optText(grading, path + ".grading", "mode");
            if (mode != null) {
                assessment.gradingMode(gradingMode(mode, path + ".grading.mode"));
            }
        }

        JsonNode sections = array(root, path, "sections");
        if (sections.isEmpty()) {
            throw error(path + ".sections", "at least one section is expected");
        }
        for (int i = 0; i < sections.size(); i++) {
            assessment.section(readSection(sections.get(i), path + ".sections[" + i + "]", i + 1));
        }
        return build(path, assessment::build);
    }

    private static Section readSection(JsonNode node, String path, int number)
            throws JsonMappingException {
        checkKeys(node, path, SECTION_KEYS);
        String title = optText(node, path, "title");
        Section.Builder section =
                Section.builder()
                        .name(title != null ? title : "Section " + number)
                        .environment(pairs(node, path, "env"))
                        .defaultTimeout(optMillis(node, path, "default_timeout_ms"));
        Integer weight = optWeight(node, path);
        if (weight != null) {
            section.weight(weight);
        }
        Boolean visible = optBoolean(node, path, "is_public");
        if (visible != null) {
            section.visible(visible);
        }
        String mode = optText(node, path, "grading_mode");
        if (mode != null) {
            section.gradingMode(gradingMode(mode, path + ".grading_mode"));
        }

        boolean any = false;
        if (has(node, "unit_tests")) {
            section.group(readUnitGroup(node.get("unit_tests"), path + ".unit_tests"));
            any = true;
        }
        if (has(node, "integration_tests")) {
            section.group(
                    readIntegrationGroup(node.get("integration_tests"), path + ".integration_tests"));
            any = true;
        }
        if (has(node, "performance_tests")) {
            section.group(
                    readPerformanceGroup(node.get("performance_tests"), path + ".performance_tests"));
            any = true;
        }
        if (!any) {
            throw error(path, "at least one type of test is expected in a section");
        }
        return build(path, section::build);
    }

    private static UnitTestGroup readUnitGroup(JsonNode node, String path)
            throws JsonMappingException {
        checkKeys(node, path, UNIT_GROUP_KEYS);
        String title = optText(node, path, "title");
        UnitTestGroup.Builder group =
                UnitTestGroup.builder()
                        .name(title != null ? title : "Unit tests")
                        .environment(pairs(node, path, "env"))
                        .files(pairs(node, path, "files"));
        Boolean inherit = optBoolean(node, path, "inherit_parent_env");
        if (inherit != null) {
            group.inheritParentEnvironment(inherit);
        }
        Boolean abort = optBoolean(node, path, "abort_on_setup_failure");
        if (abort != null) {
            group.abortOnSetupFailure(abort);
        }
        for (String command : commandLines(node, path, "setup")) {
            group.setup(command);
        }
        for (String command : commandLines(node, path, "teardown")) {
            group.teardown(command);
        }

        JsonNode tests = array(node, path, "tests");
        if (tests.isEmpty()) {
            throw error(path + ".tests", "must contain at least one test");
        }
        for (int i = 0; i < tests.size(); i++) {
            group.program(readProgramTests(tests.get(i), path + ".tests[" + i + "]"));
        }
        return build(path, group::build);
    }

    private static List<String> commandLines(JsonNode node, String path, String field)
            throws JsonMappingException {
        List<String> commands = stringList(node, path, field);
        for (int i = 0; i < commands.size(); i++) {
            try {
                if (ArgumentTokenizer.split(commands.get(i)).isEmpty()) {
                    throw error(path + "." + field + "[" + i + "]", "empty command");
                }
            } catch (IllegalArgumentException e) {
                throw error(path + "." + field + "[" + i + "]", e.getMessage(), e);
            }
        }
        return commands;
    }

    private static ProgramTests readProgramTests(JsonNode node, String path)
            throws JsonMappingException {
        checkKeys(node, path, PROGRAM_KEYS);
        String program = optText(node, path, "program_name");
        List<TestCase> cases = new ArrayList<>();
        if (has(node, "detailed_tests")) {
            JsonNode detailed = array(node, path, "detailed_tests");
            for (int i = 0; i < detailed.size(); i++) {
                cases.add(readTestCase(detailed.get(i), path + ".detailed_tests[" + i + "]"));
            }
        }
        if (has(node, "table")) {
            cases.addAll(readTable(node.get("table"), path + ".table"));
        }
        if (cases.isEmpty()) {
            throw error(path, "expected a non-empty table or detailed_tests");
        }
        ProgramReference reference =
                ProgramReference.of(program != null ? program : DEFAULT_PROGRAM);
        return build(path, () -> new ProgramTests(optText(node, path, "title"), reference, cases));
    }

    private static TestCase readTestCase(JsonNode node, String path) throws JsonMappingException {
        checkKeys(node, path, TEST_KEYS);
        TestCase.Builder testCase =
                TestCase.builder()
                        .name(optText(node, path, "name"))
                        .stdin(optText(node, path, "stdin"))
                        .timeout(optMillis(node, path, "timeout_ms"))
                        .environment(pairs(node, path, "env"))
                        .expectation(readExpectation(node, path, true));
        Integer weight = optWeight(node, path);
        if (weight != null) {
            testCase.weight(weight);
        }
        testCase.arguments(readArgumentSpec(node, path));
        return build(path, testCase::build);
    }

    private static ArgumentSpec readArgumentSpec(JsonNode node, String path)
            throws JsonMappingException {
        int forms =
                (has(node, "args") ? 1 : 0)
                        + (has(node, "permutations") ? 1 : 0)
                        + (has(node, "permute_args") ? 1 : 0);
        if (forms > 1) {
            throw error(path, "use only one of args, permutations and permute_args");
        }
        PermutationMode mode = PermutationMode.ALL_OF;
        String modeText = optText(node, path, "permutation_mode");
        if (modeText != null) {
            mode = enumValue(PermutationMode.class, modeText, path + ".permutation_mode");
        }
        if (has(node, "permutations")) {
            JsonNode permutations = array(node, path, "permutations");
            List<List<String>> variants = new ArrayList<>(permutations.size());
            for (int i = 0; i < permutations.size(); i++) {
                variants.add(arguments(permutations.get(i), path + ".permutations[" + i + "]"));
            }
            PermutationMode chosen = mode;
            return build(path + ".permutations", () -> ArgumentSpec.variants(variants, chosen));
        }
        if (has(node, "permute_args")) {
            List<String> arguments = arguments(node.get("permute_args"), path + ".permute_args");
            PermutationMode chosen = mode;
            return build(
                    path + ".permute_args", () -> ArgumentSpec.permutationsOf(arguments, chosen));
        }
        return ArgumentSpec.single(optArguments(node, path, "args"));
    }

    private static List<TestCase> readTable(JsonNode node, String path)
            throws JsonMappingException {
        if (!node.isArray() || node.size() < 2) {
            throw error(path, "a table with a header followed by the tests is expected");
        }
        List<String> header = JsonFields.strings(requireArray(node.get(0), path + "[0]"), path + "[0]");
        List<List<Object>> rows = new ArrayList<>(node.size() - 1);
        for (int r = 1; r < node.size(); r++) {
            JsonNode row = requireArray(node.get(r), path + "[" + r + "]");
            List<Object> cells = new ArrayList<>(row.size());
            for (JsonNode cell : row) {
                cells.add(cellValue(cell));
            }
            rows.add(cells);
        }
        return build(path, () -> new TestTable(header, rows).expand());
    }

    private static JsonNode requireArray(JsonNode node, String path) throws JsonMappingException {
        if (node == null || !node.isArray()) {
            throw error(path, "expected an array");
        }
        return node;
    }

    private static Object cellValue(JsonNode cell) {
        if (cell.isTextual()) {
            return cell.asText();
        }
        if (cell.isIntegralNumber()) {
            return cell.canConvertToInt() ? (Object) cell.intValue() : (Object) cell.longValue();
        }
        if (cell.isNumber()) {
            return cell.doubleValue();
        }
        if (cell.isBoolean()) {
            return cell.booleanValue();
        }
        return cell.isNull() ? "null" : cell.toString();
    }

    /// Reads expectation fields.
    ///
    /// @param required whether at least one expectation field must be present
    /// @return the expectation, or null when none is given and none is required
    private static Expectation readExpectation(JsonNode node, String path, boolean required)
            throws JsonMappingException {
        boolean trim = Boolean.TRUE.equals(optBoolean(node, path, "trim"));
        Expectation.Builder expectation = Expectation.builder();
        boolean any = false;

        TextPredicate stdout = textPredicate(node, path, "stdout", trim);
        if (stdout != null) {
            expectation.stdout(stdout);
            any = true;
        }
        TextPredicate stderr = textPredicate(node, path, "stderr", trim);
        if (stderr != null) {
            expectation.stderr(stderr);
            any = true;
        }

        Integer status = optInt(node, path, "status");
        if (has(node, "status") && has(node, "status_between")) {
            throw error(path, "use only one of status and status_between");
        }
        if (status != null) {
            expectation.status(status);
            any = true;
        }
        if (has(node, "status_between")) {
            JsonNode range = array(node, path, "status_between");
            if (range.size() != 2
                    || !range.get(0).canConvertToInt()
                    || !range.get(1).canConvertToInt()
                    || !range.get(0).isIntegralNumber()
                    || !range.get(1).isIntegralNumber()) {
                throw error(path + ".status_between", "expected [min, max]");
            }
            int min = range.get(0).intValue();
            int max = range.get(1).intValue();
            expectation.status(build(path + ".status_between", () -> StatusPredicate.between(min, max)));
            any = true;
        }

        Map<String, String> files = pairs(node, path, "files");
        for (Map.Entry<String, String> file : files.entrySet()) {
            expectation.file(file.getKey(), file.getValue());
            any = true;
        }

        if (!any) {
            if (required) {
                throw error(path, "at least one of stdout, stderr, status or files is expected");
            }
            return null;
        }
        return expectation.build();
    }

    private static TextPredicate textPredicate(
            JsonNode node, String path, String stream, boolean trim) throws JsonMappingException {
        String exact = optText(node, path, stream);
        String regex = optText(node, path, stream + "_regex");
        if (exact != null && regex != null) {
            throw error(path, "use only one of " + stream + " and " + stream + "_regex");
        }
        if (regex != null) {
            return build(path + "." + stream + "_regex", () -> TextPredicate.matches(regex));
        }
        if (exact != null) {
            return trim ? TextPredicate.trimmed(exact) : TextPredicate.exact(exact);
        }
        return null;
    }

    private static IntegrationTestGroup readIntegrationGroup(JsonNode node, String path)
            throws JsonMappingException {
        checkKeys(node, path, INTEGRATION_GROUP_KEYS);
        String title = optText(node, path, "title");
        IntegrationTestGroup.Builder group =
                IntegrationTestGroup.builder()
                        .name(title != null ? title : "Integration tests")
                        .environment(pairs(node, path, "env"))
                        .files(pairs(node, path, "files"));
        Boolean inherit = optBoolean(node, path, "inherit_parent_env");
        if (inherit != null) {
            group.inheritParentEnvironment(inherit);
        }
        Boolean stopIfFail = optBoolean(node, path, "stop_if_fail");
        if (stopIfFail != null) {
            group.stopIfFail(stopIfFail);
        }
        JsonNode steps = array(node, path, "steps");
        if (steps.isEmpty()) {
            throw error(path + ".steps", "must contain at least one step");
        }
        for (int i = 0; i < steps.size(); i++) {
            group.step(readStep(steps.get(i), path + ".steps[" + i + "]", i + 1));
        }
        return build(path, group::build);
    }

    private static IntegrationStep readStep(JsonNode node, String path, int number)
            throws JsonMappingException {
        checkKeys(node, path, STEP_KEYS);
        String name = optText(node, path, "name");
        String command = optText(node, path, "command");
        String program = optText(node, path, "program_name");
        if ((command == null) == (program == null)) {
            throw error(path, "exactly one of command and program_name is expected");
        }
        StepAction action;
        if (command != null) {
            if (has(node, "args") || has(node, "stdin")) {
                throw error(path, "args and stdin apply to program steps only");
            }
            action = new StepAction.Shell(command);
        } else {
            action =
                    new StepAction.Run(
                            ProgramReference.of(program),
                            optArguments(node, path, "args"),
                            optText(node, path, "stdin"));
        }
        Integer weight = optWeight(node, path);
        Expectation expectation = readExpectation(node, path, false);
        Duration timeout = optMillis(node, path, "timeout_ms");
        return build(
                path,
                () ->
                        new IntegrationStep(
                                name != null ? name : "Step " + number,
                                action,
                                expectation,
                                weight != null ? weight : 1,
                                timeout));
    }

    private static PerformanceTestGroup readPerformanceGroup(JsonNode node, String path)
            throws JsonMappingException {
        checkKeys(node, path, PERFORMANCE_GROUP_KEYS);
        String title = optText(node, path, "title");
        PerformanceTestGroup.Builder group =
                PerformanceTestGroup.builder()
                        .name(title != null ? title : "Performance tests")
                        .environment(pairs(node, path, "env"))
                        .files(pairs(node, path, "files"));
        Boolean inherit = optBoolean(node, path, "inherit_parent_env");
        if (inherit != null) {
            group.inheritParentEnvironment(inherit);
        }
        JsonNode benchmarks = array(node, path, "benchmarks");
        if (benchmarks.isEmpty()) {
            throw error(path + ".benchmarks", "must contain at least one benchmark");
        }
        for (int i = 0; i < benchmarks.size(); i++) {
            group.benchmark(readBenchmark(benchmarks.get(i), path + ".benchmarks[" + i + "]", i + 1));
        }
        return build(path, group::build);
    }

    private static Benchmark readBenchmark(JsonNode node, String path, int number)
            throws JsonMappingException {
        checkKeys(node, path, BENCHMARK_KEYS);
        String name = optText(node, path, "name");
        String program = optText(node, path, "program_name");
        if (!has(node, "expected_max_time_ms")) {
            throw error(path, "missing required field 'expected_max_time_ms'");
        }
        Benchmark.Builder benchmark =
                Benchmark.builder()
                        .name(name != null ? name : "Benchmark " + number)
                        .program(ProgramReference.of(program != null ? program : DEFAULT_PROGRAM))
                        .arguments(optArguments(node, path, "args"))
                        .stdin(optText(node, path, "stdin"))
                        .expectedMaxTime(optMillis(node, path, "expected_max_time_ms"))
                        .timeout(optMillis(node, path, "timeout_ms"));
        Integer weight = optWeight(node, path);
        if (weight != null) {
            benchmark.weight(weight);
        }
        Long maxMemoryKb = optLong(node, path, "expected_max_memory_kb");
        if (maxMemoryKb != null) {
            if (maxMemoryKb <= 0) {
                throw error(path + ".expected_max_memory_kb", "must be positive");
            }
            benchmark.expectedMaxMemoryBytes(maxMemoryKb * 1024);
        }
        if (has(node, "stress_test")) {
            benchmark.stressTest(readStressTest(node.get("stress_test"), path + ".stress_test"));
        }
        if (has(node, "profiling")) {
            benchmark.profiling(readProfiling(node.get("profiling"), path + ".profiling"));
        }
        return build(path, benchmark::build);
    }

    private static StressTest readStressTest(JsonNode node, String path)
            throws JsonMappingException {
        checkKeys(node, path, STRESS_KEYS);
        Integer iterations = optInt(node, path, "iterations");
        if (iterations == null) {
            throw error(path, "missing required field 'iterations'");
        }
        String generator = text(node, path, "generator");
        List<String> generatorArguments = optArguments(node, path, "generator_args");
        Double threshold = optDouble(node, path, "stability_threshold");
        return build(
                path,
                () ->
                        new StressTest(
                                iterations,
                                ProgramReference.of(generator),
                                generatorArguments,
                                threshold != null ? threshold : 1.0));
    }

    private static ProfilingConfig readProfiling(JsonNode node, String path)
            throws JsonMappingException {
        checkKeys(node, path, PROFILING_KEYS);
        if (!has(node, "tool")) {
            throw error(path, "missing required field 'tool'");
        }
        List<String> tool = arguments(node.get("tool"), path + ".tool");
        Integer leakExitStatus = optInt(node, path, "leak_exit_status");
        String leakPattern = optText(node, path, "leak_pattern");
        String policy = optText(node, path, "memory_leaks");
        LeakPolicy leakPolicy =
                policy != null
                        ? enumValue(LeakPolicy.class, policy, path + ".memory_leaks")
                        : LeakPolicy.REPORT;
        return build(path, () -> new ProfilingConfig(tool, leakExitStatus, leakPattern, leakPolicy));
    }

    private static GradingMode gradingMode(String value, String path) throws JsonMappingException {
        return enumValue(GradingMode.class, value, path);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String path)
            throws JsonMappingException {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw error(path, "unknown value '" + value + "'", e);
        }
    }

    /// Runs a model constructor, reporting its validation errors against `path`.
    private static <T> T build(String path, ModelFactory<T> factory) throws JsonMappingException {
        try {
            return factory.create();
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw error(path, e.getMessage(), e);
        }
    }

    private static Set<String> union(Set<String> base, String... more) {
        List<String> all = new ArrayList<>(base);
        all.addAll(List.of(more));
        return Set.copyOf(all);
    }

    @FunctionalInterface
    private interface ModelFactory<T> {
        T create() throws JsonMappingException;
    }
}
