package com.openforge.recall.belief;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Active belief sources.
 *
 * application.yml:
 *
 * recall:
 *   beliefs:
 *     tags: [core.identity.honesty, project.recall]
 *     file: /var/lib/recall/active_beliefs.json   # JSON array of strings, optional
 *     important-namespaces: [core.identity, core.ethic]
 *     refresh-ms: 60000                             # re-read interval for tags and file
 */
@ConfigurationProperties(prefix = "recall.beliefs")
public record BeliefProperties(
        List<String> tags,
        String file,
        @DefaultValue({"core.identity", "core.ethic"}) List<String> importantNamespaces
) {
    public BeliefProperties {
        tags                = tags == null ? List.of() : List.copyOf(tags);
        importantNamespaces = importantNamespaces == null ? List.of() : List.copyOf(importantNamespaces);
    }
}
