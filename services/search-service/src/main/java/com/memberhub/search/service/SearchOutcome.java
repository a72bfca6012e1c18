package com.memberhub.search.service;

import java.util.List;

public record SearchOutcome<T>(List<T> hits, String queryLogId, long tookMs) {
}
