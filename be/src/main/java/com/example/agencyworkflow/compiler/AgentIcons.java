package com.example.agencyworkflow.compiler;

import java.util.List;
import java.util.Locale;

/**
 * Keyword to icon table for decompiled nodes. Case-insensitive substring match, first hit wins.
 */
public final class AgentIcons {

    public static final String DEFAULT_ICON = "⚙️";
    public static final String NESTED_WORKFLOW_ICON = "🔄";

    private record Rule(String icon, List<String> keywords) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule("👥", List.of("customer", "support")),
            new Rule("📊", List.of("data", "process")),
            new Rule("📧", List.of("email", "notification")),
            new Rule("✅", List.of("validation", "verify")),
            new Rule("🤖", List.of("ai", "assistant")),
            new Rule("📈", List.of("report", "analytics")),
            new Rule("🔗", List.of("integration", "api")),
            new Rule("🔒", List.of("security", "auth")),
            new Rule("💳", List.of("payment", "billing")),
            new Rule("🏥", List.of("monitor", "health"))
    );

    private AgentIcons() {
    }

    public static String iconFor(String agentName) {
        if (agentName == null) {
            return DEFAULT_ICON;
        }
        String name = agentName.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (name.contains(keyword)) {
                    return rule.icon();
                }
            }
        }
        return DEFAULT_ICON;
    }
}
