package com.leakguard.scanner;

import lombok.Value;

/**
 * Decoded text of one file, owned by the scan of that file.
 */
@Value
public class ScanTarget {
    String path;    // as given by the caller; used verbatim in findings
    String content;
}
