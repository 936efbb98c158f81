package com.stpa.coverage.model;

import java.util.List;

public record ScoreResult(int value, String rationale, List<ScoreContribution> contributions, String version) {}
