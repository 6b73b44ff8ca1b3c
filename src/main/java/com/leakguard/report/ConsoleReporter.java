package com.leakguard.report;

import com.leakguard.scanner.Finding;

import java.io.PrintWriter;
import java.util.List;

/**
 * Human-readable report, one {@code <path>:<line> - Potential <rule>} line per finding.
 */
public class ConsoleReporter {
    static final String ALERT = "WARNING: Potential secrets detected!";
    static final String HINT = "Review the lines above. Remove the secrets, or confirm that they are safe to commit.";

    private final PrintWriter out;

    public ConsoleReporter(PrintWriter out) {
        this.out = out;
    }

    public void report(List<Finding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        out.println(ALERT);
        for (Finding finding : findings) {
            out.println(format(finding));
        }
        out.println(HINT);
        out.flush();
    }

    public static String format(Finding finding) {
        return String.format("%s:%d - Potential %s",
                finding.getPath(), finding.getLineNumber(), finding.getRuleName());
    }
}
