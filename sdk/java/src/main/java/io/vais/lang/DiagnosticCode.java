package io.vais.lang;

/**
 * Catalogue of validator codes. The leading digit groups them: 1 structural,
 * 2 field/type, 3 intent, 4 flow, 5 cross-reference, 6 execution, 7 verify.
 */
public enum DiagnosticCode {
    MISSING_UNIT("E1001", "Missing UNIT block"),
    MISSING_META("E1002", "Missing META block"),
    MISSING_INPUT("E1003", "Missing INPUT block"),
    MISSING_OUTPUT("E1004", "Missing OUTPUT block"),
    MISSING_INTENT("E1005", "Missing INTENT block"),
    MISSING_CONSTRAINT("E1006", "Missing CONSTRAINT block"),
    MISSING_FLOW("E1007", "Missing FLOW block"),
    MISSING_EXECUTION("E1008", "Missing EXECUTION block"),
    MISSING_VERIFY("E1009", "Missing VERIFY block"),

    DUPLICATE_INPUT_FIELD("E2001", "Duplicate input field"),
    DUPLICATE_OUTPUT_FIELD("E2002", "Duplicate output field"),
    MISSING_META_ENTRY("E2010", "Missing required META entry"),
    INVALID_META_VALUE("E2011", "Invalid META value type"),

    MISSING_GOAL_TYPE("E3001", "Missing GOAL type"),
    MISSING_GOAL_INPUTS("E3002", "Missing GOAL inputs"),
    MISSING_GOAL_OUTPUTS("E3003", "Missing GOAL outputs"),

    DUPLICATE_FLOW_NODE("E4001", "Duplicate flow node"),
    MISSING_NODE_PARAM("E4010", "Missing required node parameter"),
    UNKNOWN_EDGE_INPUT("E4020", "Unknown input field in edge"),
    UNKNOWN_SOURCE_NODE("E4021", "Unknown source node in edge"),
    UNKNOWN_EDGE_OUTPUT("E4022", "Unknown output field in edge"),
    UNKNOWN_TARGET_NODE("E4023", "Unknown target node in edge"),
    DISCONNECTED_NODE("E4030", "Disconnected node"),

    UNKNOWN_INPUT_REF("E5001", "Unknown input field reference"),
    UNKNOWN_OUTPUT_REF("E5002", "Unknown output field reference"),

    MISSING_MEMORY_LIMIT("E6001", "Missing memory limit for BOUNDED"),

    MISSING_TEST_REF("E7001", "Missing test reference"),
    MISSING_VERIFY_EXPR("E7002", "Missing verify expression");

    private final String code;
    private final String title;

    DiagnosticCode(String code, String title) {
        this.code = code;
        this.title = title;
    }

    public String code() { return code; }

    public String title() { return title; }

    public static DiagnosticCode of(String code) {
        for (DiagnosticCode c : values()) {
            if (c.code.equals(code)) return c;
        }
        throw new IllegalArgumentException("Unknown diagnostic code: " + code);
    }
}
