package com.leakguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RuleDefinition {
    @JsonProperty("name")
    private String name; // e.g., "Slack Token"

    @JsonProperty("pattern")
    private String pattern; // java.util.regex syntax, matched with find()
}
