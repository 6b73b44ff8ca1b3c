package com.leakguard.rules;

import com.leakguard.config.RuleDefinition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The bundled detection rules, in evaluation order.
 *
 * <p>Several rules overlap on purpose ("Generic Token" and "Auth0 Secret Pattern" accept broad
 * token shapes). The scanner reports only the first matching rule of a line, so the order below
 * decides which name an ambiguous line is reported under and must not be rearranged.</p>
 */
public final class BuiltInRules {
    private BuiltInRules() {}

    public static final String AWS_KEY = "AWS Key";
    public static final String AWS_SECRET = "AWS Secret";
    public static final String PRIVATE_KEY = "Private Key";
    public static final String SSH_KEY = "SSH Key";
    public static final String GITHUB_TOKEN = "GitHub Token";
    public static final String API_KEY = "API Key";
    public static final String GENERIC_SECRET = "Generic Secret";
    public static final String PASSWORD_ASSIGNMENT = "Password Assignment";
    public static final String AUTHORIZATION_HEADER = "Authorization Header";
    public static final String CONNECTION_STRING = "Connection String";
    public static final String GENERIC_TOKEN = "Generic Token";
    public static final String AUTH0_CLIENT_SECRET = "Auth0 Client Secret";
    public static final String AUTH0_SECRET_PATTERN = "Auth0 Secret Pattern";
    public static final String STRIPE_LIVE_KEY = "Stripe Live Key";

    // Lockfiles (package-lock.json, yarn.lock) carry base64 digests after these prefixes
    private static final String NO_INTEGRITY_PREFIX =
            "(?<!sha1-)(?<!sha256-)(?<!sha384-)(?<!sha512-)";

    private static final List<RuleDefinition> DEFINITIONS = List.of(
            new RuleDefinition(AWS_KEY,
                    "AKIA[0-9A-Z]{16}"),
            new RuleDefinition(AWS_SECRET,
                    NO_INTEGRITY_PREFIX + "(?<![A-Za-z0-9+/])[A-Za-z0-9+/]{40}(?![A-Za-z0-9+/=])"),
            new RuleDefinition(PRIVATE_KEY,
                    "-----BEGIN (?:RSA|DSA|EC|OPENSSH) PRIVATE KEY-----"),
            new RuleDefinition(SSH_KEY,
                    "ssh-rsa AAAA[0-9A-Za-z+/]+={0,3}"),
            new RuleDefinition(GITHUB_TOKEN,
                    "(?i)github[_\\-\\s.]*token[^A-Za-z0-9]{0,5}[0-9a-z]{35,40}"),
            new RuleDefinition(API_KEY,
                    "(?i)api[_\\-\\s.]*key[^A-Za-z0-9]{0,5}[0-9a-z]{16,45}"),
            new RuleDefinition(GENERIC_SECRET,
                    "(?i)secret[^A-Za-z0-9]{0,5}[0-9a-z]{16,45}"),
            new RuleDefinition(PASSWORD_ASSIGNMENT,
                    "(?i)(?:password|passwd|pwd)[\"']?\\s*[:=]\\s*\\S+"),
            new RuleDefinition(AUTHORIZATION_HEADER,
                    "(?i)authorization[\"']?\\s*[:=]\\s*[\"']?bearer\\s+[A-Za-z0-9\\-._~+/]+=*"),
            new RuleDefinition(CONNECTION_STRING,
                    "[A-Za-z][A-Za-z0-9+.\\-]*://[^\\s:/@]{3,20}:[^\\s:/@]{3,20}@[^\\s/]+"),
            new RuleDefinition(GENERIC_TOKEN,
                    "\\b[a-z0-9]{32,64}\\b"),
            new RuleDefinition(AUTH0_CLIENT_SECRET,
                    "(?i)client[_\\-\\s.]*secret[\"']?\\s*[:=]\\s*[\"']?[A-Za-z0-9_]{64}"),
            new RuleDefinition(AUTH0_SECRET_PATTERN,
                    "\\b[A-Za-z0-9_]{64}\\b"),
            new RuleDefinition(STRIPE_LIVE_KEY,
                    "sk_live_[0-9a-zA-Z]{10,}")
    );

    /**
     * Fresh copies of the bundled definitions, in evaluation order.
     */
    public static List<RuleDefinition> definitions() {
        return DEFINITIONS.stream()
                .map(d -> new RuleDefinition(d.getName(), d.getPattern()))
                .collect(Collectors.toList());
    }
}
