package com.leakguard.scanner;

import com.leakguard.rules.Rule;
import com.leakguard.rules.RuleRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies the rule registry to the lines of one file.
 *
 * <p>Each non-comment line is tested against the rules in registration order and yields at most
 * one {@link Finding}, named after the first rule that matches.</p>
 */
public class ContentScanner {
    private final RuleRegistry registry;
    private final CommentFilter commentFilter;

    public ContentScanner(RuleRegistry registry, CommentFilter commentFilter) {
        this.registry = registry;
        this.commentFilter = commentFilter;
    }

    public List<Finding> scan(ScanTarget target) {
        List<Finding> findings = new ArrayList<>();
        // \n, \r\n and \r all end a line; a trailing terminator does not add an empty line
        List<String> lines = target.getContent().lines().collect(Collectors.toList());

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (commentFilter.isComment(line)) {
                continue;
            }
            Rule rule = firstMatch(line);
            if (rule != null) {
                findings.add(new Finding(target.getPath(), i + 1, rule.getName()));
            }
        }
        return findings;
    }

    private Rule firstMatch(String line) {
        for (Rule rule : registry.rules()) {
            if (rule.matches(line)) {
                return rule;
            }
        }
        return null;
    }
}
