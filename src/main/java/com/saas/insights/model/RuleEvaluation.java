package com.saas.insights.model;

/**
 * Outcome of applying one rule to a snapshot. {@code message} is empty when not triggered.
 */
public record RuleEvaluation(boolean triggered, double value, String message) {
}
