package com.adlanda.resumetailor.ai;

public record SummaryResult(String summary) {
}
