package io.clgrader.core.process;

import io.clgrader.core.assessment.ProgramReference;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// {@link ProgramResolver} backed by a fixed map of names to command templates.
///
/// Programs registered positionally through {@link Builder#program(CommandTemplate)} are
/// also reachable as `p<n>` and `program<n>`, numbered from 1.
///
/// {@snippet :
/// ProgramResolver resolver = StaticProgramResolver.builder()
///     .program(CommandTemplate.of("./student/bin/calc"))
///     .alias("reference", CommandTemplate.of("/opt/course/calc"))
///     .build();
/// resolver.resolve(ProgramReference.of("p1")); // ./student/bin/calc
/// }
public final class StaticProgramResolver implements ProgramResolver {

    private final Map<String, CommandTemplate> programs;

    private StaticProgramResolver(Map<String, CommandTemplate> programs) {
        this.programs = Map.copyOf(programs);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a resolver for positional programs only.
    ///
    /// @param programs programs in order, reachable as `p1`, `p2`, ...
    /// @return the resolver, never null
    public static StaticProgramResolver of(List<CommandTemplate> programs) {
        Builder builder = builder();
        programs.forEach(builder::program);
        return builder.build();
    }

    @Override
    public Optional<CommandTemplate> resolve(ProgramReference reference) {
        return Optional.ofNullable(programs.get(reference.name()));
    }

    public static final class Builder {
        private final Map<String, CommandTemplate> programs = new LinkedHashMap<>();
        private int positional;

        private Builder() {}

        public Builder program(CommandTemplate template) {
            positional++;
            programs.put("p" + positional, template);
            programs.put("program" + positional, template);
            return this;
        }

        public Builder alias(String name, CommandTemplate template) {
            programs.put(name, template);
            return this;
        }

        public StaticProgramResolver build() {
            return new StaticProgramResolver(programs);
        }
    }
}
