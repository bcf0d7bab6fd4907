package io.github.riemr.staffing.domain.model;

import java.util.HashSet;
import java.util.List;

import io.github.riemr.staffing.exception.SchedulerConfigException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 複数職種で構成される生産ライン。contribFactor は理論処理量のうち実際に実現できる割合。
 */
@Value
public class ProductionChain {

    String id;
    List<String> roleIds;
    double contribFactor;

    @Builder
    public ProductionChain(String id, @Singular("roleId") List<String> roleIds, Double contribFactor) {
        if (id == null || id.isBlank()) {
            throw new SchedulerConfigException("ProductionChain id is required");
        }
        if (roleIds == null || roleIds.isEmpty()) {
            throw SchedulerConfigException.of("ProductionChain", id, "at least one role is required");
        }
        if (new HashSet<>(roleIds).size() != roleIds.size()) {
            throw SchedulerConfigException.of("ProductionChain", id, "duplicate role ids " + roleIds);
        }
        double factor = contribFactor == null ? 1.0 : contribFactor;
        if (!(factor > 0) || factor > 1.0) {
            throw SchedulerConfigException.of("ProductionChain", id, "contribFactor must be in (0, 1] but was " + factor);
        }
        double percent = factor * 100.0;
        if (Math.abs(percent - Math.rint(percent)) > 1e-6) {
            throw SchedulerConfigException.of("ProductionChain", id, "contribFactor must be a multiple of 0.01 but was " + factor);
        }
        this.id = id;
        this.roleIds = List.copyOf(roleIds);
        this.contribFactor = factor;
    }

    public boolean contains(String roleId) {
        return roleIds.contains(roleId);
    }
}
