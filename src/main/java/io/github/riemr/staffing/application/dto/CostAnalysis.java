package io.github.riemr.staffing.application.dto;

import java.util.Map;

/**
 * @param opportunityCost   未充足アイテム数 × 1 アイテムあたり粗利
 * @param costPerItemServed 処理アイテムがなければ null
 */
public record CostAnalysis(
    double totalWageCost,
    Map<String, Double> costByRole,
    double unmetItems,
    double opportunityCost,
    double itemsServed,
    Double costPerItemServed
) {}
