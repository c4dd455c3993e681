package com.smurthy.ai.advisor.model;

public record SourceRef(String title, String url) {
}
