package io.clgrader.core.assessment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Root of an instructor-authored assessment.
///
/// Built once by a configuration loader and then only read by the engine.
///
/// ### Contracts
/// - **Invariant**: section order is declaration order and is preserved in results
/// - **Invariant**: section names should be unique; {@link #findDuplicateSectionName()}
///   reports a violation, which the engine treats as fatal
///
/// @implNote **Immutable** and safe to share across threads.
public final class Assessment {

    private final String title;
    private final String author;
    private final GradingMode gradingMode;
    private final Map<String, String> environment;
    private final Duration defaultTimeout;
    private final List<Section> sections;

    private Assessment(Builder builder) {
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.author = builder.author;
        this.gradingMode = Objects.requireNonNull(builder.gradingMode, "gradingMode must not be null");
        this.environment = Map.copyOf(builder.environment);
        this.defaultTimeout = builder.defaultTimeout;
        this.sections = List.copyOf(builder.sections);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public GradingMode getGradingMode() {
        return gradingMode;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    /// Returns the global invocation timeout.
    ///
    /// @return the timeout, null to use the grader configuration's default
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public List<Section> getSections() {
        return sections;
    }

    /// Returns the first section name that occurs more than once.
    ///
    /// @return the duplicated name, or empty when all names are unique
    public Optional<String> findDuplicateSectionName() {
        Set<String> seen = new HashSet<>();
        for (Section section : sections) {
            if (!seen.add(section.getName())) {
                return Optional.of(section.getName());
            }
        }
        return Optional.empty();
    }

    public static final class Builder {
        private String title;
        private String author;
        private GradingMode gradingMode = GradingMode.WEIGHTED;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private Duration defaultTimeout;
        private final List<Section> sections = new ArrayList<>();

        private Builder() {}

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder gradingMode(GradingMode gradingMode) {
            this.gradingMode = gradingMode;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment.putAll(environment);
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder section(Section section) {
            this.sections.add(section);
            return this;
        }

        public Assessment build() {
            return new Assessment(this);
        }
    }
}
