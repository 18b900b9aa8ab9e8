package com.delta.feedscout.feed.audit;

import com.delta.feedscout.config.FeedScoutProperties;
import com.delta.feedscout.feed.model.AuditFinding;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only review pass over a finished result mapping. Findings are advisory
 * and meant for an operator; nothing here rejects or edits results.
 */
@Component
public class ResultSanityAuditor {
    private final int shortTitleThreshold;
    private final int sparseFeedThreshold;

    @Autowired
    public ResultSanityAuditor(FeedScoutProperties properties) {
        this(properties.getAudit().getShortTitleThreshold(), properties.getAudit().getSparseFeedThreshold());
    }

    public ResultSanityAuditor(int shortTitleThreshold, int sparseFeedThreshold) {
        this.shortTitleThreshold = Math.max(0, shortTitleThreshold);
        this.sparseFeedThreshold = Math.max(0, sparseFeedThreshold);
    }

    public List<AuditFinding> audit(Map<String, List<String>> feeds) {
        if (feeds == null || feeds.isEmpty()) {
            return List.of();
        }
        List<AuditFinding> findings = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : feeds.entrySet()) {
            String url = entry.getKey();
            List<String> titles = entry.getValue() == null ? List.of() : entry.getValue();
            if (titles.isEmpty()) {
                findings.add(AuditFinding.emptyTitles(url));
                continue;
            }
            for (String title : titles) {
                if (title == null || title.length() < shortTitleThreshold) {
                    findings.add(AuditFinding.shortTitle(url, title));
                }
            }
            if (titles.size() < sparseFeedThreshold) {
                findings.add(AuditFinding.sparseFeed(url, titles));
            }
        }
        return findings;
    }
}
