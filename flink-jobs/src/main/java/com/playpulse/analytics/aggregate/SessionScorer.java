package com.playpulse.analytics.aggregate;

import com.playpulse.analytics.verdict.Outcome;
import com.playpulse.analytics.verdict.Verdict;

import java.util.List;

/**
 * Weighted share of passing occurrences: PASS counts 1, WARN 0.5, FAIL 0.
 */
public final class SessionScorer {
    private SessionScorer() {}

    public static SessionScore score(String sessionId, List<Verdict> verdicts) {
        SessionScore result = new SessionScore();
        result.sessionId = sessionId;
        double weighted = 0.0;
        if (verdicts != null) {
            for (Verdict verdict : verdicts) {
                if (verdict == null || verdict.outcome == null) {
                    continue;
                }
                weighted += verdict.outcome.weight();
                if (verdict.outcome == Outcome.PASS) {
                    result.passCount++;
                } else if (verdict.outcome == Outcome.WARN) {
                    result.warnCount++;
                } else {
                    result.failCount++;
                }
            }
        }
        int total = result.total();
        result.score = total == 0 ? 0.0 : weighted / total;
        return result;
    }
}
