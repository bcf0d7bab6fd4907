package io.github.riemr.staffing.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.github.riemr.staffing.exception.SchedulerConfigException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 1 回の求解に必要な入力一式。構築時に相互参照を検証し、以後は不変。
 */
@Value
public class SchedulerInput {

    List<Role> roles;
    List<Employee> employees;
    List<ProductionChain> chains;
    SchedulerConfig config;

    @Builder
    public SchedulerInput(@Singular List<Role> roles,
                          @Singular List<Employee> employees,
                          @Singular List<ProductionChain> chains,
                          SchedulerConfig config) {
        this.roles = roles == null ? List.of() : List.copyOf(roles);
        this.employees = employees == null ? List.of() : List.copyOf(employees);
        this.chains = chains == null ? List.of() : List.copyOf(chains);
        this.config = config == null ? SchedulerConfig.builder().build() : config;
        validate();
    }

    private void validate() {
        Map<String, Role> declared = new LinkedHashMap<>();
        for (Role role : roles) {
            if (declared.put(role.getId(), role) != null) {
                throw SchedulerConfigException.of("Role", role.getId(), "declared twice");
            }
        }
        Map<String, Employee> seen = new LinkedHashMap<>();
        for (Employee employee : employees) {
            if (seen.put(employee.getId(), employee) != null) {
                throw SchedulerConfigException.of("Employee", employee.getId(), "declared twice");
            }
            for (String roleId : employee.getRoleIds()) {
                if (!declared.containsKey(roleId)) {
                    throw SchedulerConfigException.of("Employee", employee.getId(), "references undeclared role " + roleId);
                }
            }
        }
        Map<String, ProductionChain> chainIds = new LinkedHashMap<>();
        for (ProductionChain chain : chains) {
            if (chainIds.put(chain.getId(), chain) != null) {
                throw SchedulerConfigException.of("ProductionChain", chain.getId(), "declared twice");
            }
            for (String roleId : chain.getRoleIds()) {
                if (!declared.containsKey(roleId)) {
                    throw SchedulerConfigException.of("ProductionChain", chain.getId(), "references undeclared role " + roleId);
                }
            }
        }
    }

    public Role role(String roleId) {
        return roles.stream()
                .filter(r -> r.getId().equals(roleId))
                .findFirst()
                .orElseThrow(() -> new SchedulerConfigException("Unknown role " + roleId));
    }

    public List<Employee> eligibleEmployees(String roleId) {
        List<Employee> result = new ArrayList<>();
        for (Employee e : employees) {
            if (e.canPerform(roleId)) {
                result.add(e);
            }
        }
        return result;
    }

    public List<ProductionChain> chainsOf(String roleId) {
        return chains.stream().filter(c -> c.contains(roleId)).toList();
    }

    /**
     * 非独立職種と同時に配置されている必要がある相手職種。
     * 同じ生産ラインに属する職種、どのラインにも属さなければ他の全職種。
     */
    public List<String> partnerRoleIds(String roleId) {
        List<String> partners = new ArrayList<>();
        for (ProductionChain chain : chainsOf(roleId)) {
            for (String other : chain.getRoleIds()) {
                if (!other.equals(roleId) && !partners.contains(other)) {
                    partners.add(other);
                }
            }
        }
        if (partners.isEmpty() && chainsOf(roleId).isEmpty()) {
            for (Role r : roles) {
                if (!Objects.equals(r.getId(), roleId)) {
                    partners.add(r.getId());
                }
            }
        }
        return partners;
    }
}
