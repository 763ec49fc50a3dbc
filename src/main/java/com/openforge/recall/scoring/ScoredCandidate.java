package com.openforge.recall.scoring;

import com.openforge.recall.candidate.Candidate;

public record ScoredCandidate(Candidate candidate, ScoreBreakdown breakdown) {

    public double finalScore() {
        return breakdown.finalScore();
    }

    public String id() {
        return candidate.id();
    }
}
