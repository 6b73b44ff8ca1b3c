package com.leakguard.rules;

/**
 * Raised while building a {@link RuleRegistry} from invalid definitions.
 * The registry is unusable for the whole run, so callers abort before scanning.
 */
public class RuleDefinitionException extends RuntimeException {

    public RuleDefinitionException(String message) {
        super(message);
    }

    public RuleDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
