package com.leakguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class Config {
    @JsonProperty("config")
    private ScanConfig scanConfig = new ScanConfig();

    // Appended after the built-in rules, in file order
    @JsonProperty("rules")
    private List<RuleDefinition> rules = new ArrayList<>();

    @JsonProperty("disabled_rules")
    private List<String> disabledRules = new ArrayList<>();

    public ScanConfig getScanConfig() {
        if (scanConfig == null) {
            scanConfig = new ScanConfig();
        }
        return scanConfig;
    }

    public List<RuleDefinition> getRules() {
        if (rules == null) {
            rules = new ArrayList<>();
        }
        return rules;
    }

    public List<String> getDisabledRules() {
        if (disabledRules == null) {
            disabledRules = new ArrayList<>();
        }
        return disabledRules;
    }
}
