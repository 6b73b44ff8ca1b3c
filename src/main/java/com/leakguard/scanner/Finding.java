package com.leakguard.scanner;

import lombok.Value;

@Value
public class Finding {
    String path;
    int lineNumber;  // 1-based
    String ruleName; // e.g., "AWS Key", "Password Assignment"
}
