package org.ecaflow.graph;

/**
 * Recoverable problem found while compiling automations into the flow graph.
 *
 * None of these stops the build. Each one means the graph may hold fewer
 * edges or findings than a fully modeled and cataloged input would give.
 */
public sealed interface BuildDiagnostic permits
        BuildDiagnostic.UnknownTriggerKind,
        BuildDiagnostic.UnknownConditionKind,
        BuildDiagnostic.UnknownActionKind,
        BuildDiagnostic.MissingCatalogEntry,
        BuildDiagnostic.MalformedRuleStructure {

    String automationId();

    String message();

    // ========================================================================
    // Taxonomy
    // ========================================================================

    /**
     * Trigger platform outside the modeled set; kept as an opaque Event node.
     */
    record UnknownTriggerKind(String automationId, String platform) implements BuildDiagnostic {
        public String message() {
            return "Unknown trigger platform '" + platform + "' treated as opaque event";
        }
    }

    record UnknownConditionKind(String automationId, String conditionType) implements BuildDiagnostic {
        public String message() {
            return "Unknown condition '" + conditionType + "' ignored";
        }
    }

    /**
     * Action step outside the modeled set; kept as an opaque, uncataloged Action node.
     */
    record UnknownActionKind(String automationId, String actionType) implements BuildDiagnostic {
        public String message() {
            return "Unknown action '" + actionType + "' treated as opaque action";
        }
    }

    /**
     * Service call with no effect entry; its node gets no effect-edges and
     * never takes part in inconsistency checks.
     */
    record MissingCatalogEntry(String automationId, String signature) implements BuildDiagnostic {
        public String message() {
            return "No effect cataloged for '" + signature + "'";
        }
    }

    /**
     * Control structure missing required children; contributes no actions.
     */
    record MalformedRuleStructure(String automationId, String structure, String detail) implements BuildDiagnostic {
        public String message() {
            return "Malformed '" + structure + "': " + detail;
        }
    }
}
