package com.bastion.validation.readiness;

import java.util.Locale;

/**
 * Renders a {@link ReadinessSnapshot} as a Markdown deployment-readiness report.
 */
public final class ReadinessReportRenderer {

    private ReadinessReportRenderer() {
        // utility class
    }

    public static String render(ReadinessSnapshot snapshot) {
        StringBuilder out = new StringBuilder();
        out.append("# Validation gateway readiness\n\n");
        out.append("Window: ").append(snapshot.windowStart()).append(" to ").append(snapshot.windowEnd())
                .append(" (").append(snapshot.recordCount()).append(" requests)\n\n");

        out.append("| Criterion | Target | Actual | Result |\n");
        out.append("|---|---:|---:|---|\n");
        for (CriterionResult result : snapshot.criteria().values()) {
            out.append("| ").append(result.criterion().title())
                    .append(" | ").append(pct(result.target()))
                    .append(" | ").append(pct(result.actual()))
                    .append(" | ").append(result.passed() ? "PASSED" : "FAILED")
                    .append(" |\n");
        }

        out.append("\n## Performance\n\n");
        out.append("- Cache hit rate: ").append(pct(snapshot.cacheHitRatePercent())).append('\n');
        out.append("- Mean legacy minus enhanced duration: ")
                .append(String.format(Locale.ROOT, "%.2f ms", snapshot.averagePerformanceDeltaMillis())).append('\n');

        out.append("\n## Security\n\n");
        out.append("- Cross-tenant requests blocked: ").append(snapshot.crossTenantBlocks()).append('\n');
        out.append("- Blocked requests legacy allowed: ").append(snapshot.securityDiscrepancies()).append('\n');

        out.append("\n**Ready for promotion: ").append(snapshot.readyForPromotion() ? "YES" : "NO").append("**\n");
        return out.toString();
    }

    private static String pct(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}
