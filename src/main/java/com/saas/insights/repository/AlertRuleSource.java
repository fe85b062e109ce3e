package com.saas.insights.repository;

import com.saas.insights.model.AlertRule;

import java.util.List;

public interface AlertRuleSource {

    List<AlertRule> listEnabledRules();
}
