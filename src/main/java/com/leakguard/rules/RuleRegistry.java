package com.leakguard.rules;

import com.leakguard.config.Config;
import com.leakguard.config.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Ordered, immutable set of detection rules.
 *
 * <p>Iteration order is registration order: built-in rules first, then rules added from
 * configuration in file order. Patterns are compiled once when the registry is built and the
 * registry is safe to share between scanning threads.</p>
 */
public final class RuleRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RuleRegistry.class);

    private final List<Rule> rules;

    private RuleRegistry(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Registry holding the bundled rules only.
     */
    public static RuleRegistry defaults() {
        return builder().build();
    }

    /**
     * Built-in rules, followed by the configured extra rules, minus the disabled ones.
     */
    public static RuleRegistry fromConfig(Config config) {
        return builder()
                .addAll(config.getRules())
                .disableAll(config.getDisabledRules())
                .build();
    }

    /**
     * A builder pre-seeded with the built-in rules.
     */
    public static Builder builder() {
        return new Builder(BuiltInRules.definitions());
    }

    /**
     * A builder with no rules at all.
     */
    public static Builder emptyBuilder() {
        return new Builder(List.of());
    }

    public List<Rule> rules() {
        return rules;
    }

    public List<String> ruleNames() {
        return rules.stream().map(Rule::getName).collect(Collectors.toList());
    }

    public int size() {
        return rules.size();
    }

    public static final class Builder {
        private final List<RuleDefinition> definitions = new ArrayList<>();
        private final Set<String> disabled = new LinkedHashSet<>();

        private Builder(List<RuleDefinition> seed) {
            definitions.addAll(seed);
        }

        public Builder add(String name, String pattern) {
            definitions.add(new RuleDefinition(name, pattern));
            return this;
        }

        public Builder addAll(Collection<RuleDefinition> extra) {
            if (extra != null) {
                for (RuleDefinition d : extra) {
                    if (d == null) {
                        throw new RuleDefinitionException("Rule definition must not be empty");
                    }
                    add(d.getName(), d.getPattern());
                }
            }
            return this;
        }

        public Builder disable(String name) {
            disabled.add(name);
            return this;
        }

        public Builder disableAll(Collection<String> names) {
            if (names != null) {
                names.forEach(this::disable);
            }
            return this;
        }

        /**
         * Compiles every definition.
         *
         * @throws RuleDefinitionException on a blank or duplicate name, a missing or invalid
         *                                 pattern, or a disabled name that matches no rule
         */
        public RuleRegistry build() {
            Set<String> seen = new HashSet<>();
            List<Rule> compiled = new ArrayList<>();

            for (RuleDefinition d : definitions) {
                String name = d.getName();
                if (name == null || name.isBlank()) {
                    throw new RuleDefinitionException("Rule name must not be blank (pattern: " + d.getPattern() + ")");
                }
                if (!seen.add(name)) {
                    throw new RuleDefinitionException("Duplicate rule name: " + name);
                }
                if (d.getPattern() == null || d.getPattern().isEmpty()) {
                    throw new RuleDefinitionException("Rule '" + name + "' has no pattern");
                }
                if (disabled.contains(name)) {
                    continue;
                }
                compiled.add(new Rule(name, compile(name, d.getPattern())));
            }

            for (String name : disabled) {
                if (!seen.contains(name)) {
                    throw new RuleDefinitionException("Cannot disable unknown rule: " + name);
                }
            }

            logger.debug("Rule registry built. Active: {}, Disabled: {}", compiled.size(), disabled.size());
            return new RuleRegistry(compiled);
        }

        private static Pattern compile(String name, String regex) {
            try {
                return Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new RuleDefinitionException(
                        "Invalid pattern for rule '" + name + "': " + e.getDescription(), e);
            }
        }
    }
}
