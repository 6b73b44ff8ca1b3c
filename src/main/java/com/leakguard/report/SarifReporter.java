package com.leakguard.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leakguard.rules.Rule;
import com.leakguard.scanner.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes findings as a SARIF 2.1.0 log for code-scanning dashboards.
 */
public class SarifReporter {
    private static final Logger logger = LoggerFactory.getLogger(SarifReporter.class);

    static final String TOOL_NAME = "LeakGuard";
    static final String TOOL_VERSION = "1.0.0";

    private final File outFile;

    public SarifReporter(File outFile) {
        this.outFile = outFile;
    }

    public void generate(List<Finding> findings, List<Rule> rules) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);

        ObjectNode root = mapper.createObjectNode();
        root.put("version", "2.1.0");
        root.put("$schema", "https://json.schemastore.org/sarif-2.1.0.json");

        ArrayNode runs = root.putArray("runs");
        ObjectNode run = runs.addObject();

        // Tool Info
        ObjectNode driver = run.putObject("tool").putObject("driver");
        driver.put("name", TOOL_NAME);
        driver.put("version", TOOL_VERSION);
        ArrayNode ruleNodes = driver.putArray("rules");
        for (Rule rule : rules) {
            ObjectNode ruleNode = ruleNodes.addObject();
            ruleNode.put("id", rule.getName());
            ruleNode.putObject("shortDescription").put("text", "Potential " + rule.getName());
        }

        // Results
        ArrayNode results = run.putArray("results");
        for (Finding finding : findings) {
            ObjectNode result = results.addObject();
            result.put("ruleId", finding.getRuleName());
            result.put("level", "error");
            result.putObject("message").put("text", "Potential " + finding.getRuleName());

            ObjectNode physicalLocation = result.putArray("locations").addObject().putObject("physicalLocation");
            physicalLocation.putObject("artifactLocation").put("uri", toUri(finding.getPath()));
            physicalLocation.putObject("region").put("startLine", finding.getLineNumber());
        }

        File parent = outFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create directory: " + parent);
        }
        mapper.writeValue(outFile, root);
        logger.info("SARIF report generated: {}", outFile.getAbsolutePath());
    }

    /**
     * Relative URI reference for a path: forward slashes, each segment percent-encoded.
     */
    static String toUri(String path) {
        String[] segments = path.replace('\\', '/').split("/", -1);
        StringBuilder uri = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                uri.append('/');
            }
            // URLEncoder is form encoding; a space must be %20 in a URI path
            uri.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return uri.toString();
    }
}
