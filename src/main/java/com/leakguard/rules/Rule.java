package com.leakguard.rules;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * A named detection pattern. Instances are created by {@link RuleRegistry} and never mutated.
 */
@Value
public class Rule {
    String name;
    Pattern pattern;

    /**
     * True when the pattern occurs anywhere in the line.
     */
    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }
}
