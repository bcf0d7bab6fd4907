package io.github.riemr.staffing.optimization.model;

import java.util.List;

import io.github.riemr.staffing.domain.model.ProductionChain;
import io.github.riemr.staffing.domain.model.Role;

/**
 * 需要を処理する生産ライン。宣言された生産チェーン、またはどのチェーンにも属さない
 * 生産職種 1 つだけの暗黙ライン（貢献率 1）。
 * <p>チェーン ID と職種 ID は別の名前空間なので、id には種別の接頭辞を付ける。</p>
 */
public record ProductionLine(String id, List<Role> roles, ModelScale.Fraction contribution, boolean implicit) {

    public static ProductionLine ofChain(ProductionChain chain, List<Role> roles) {
        return new ProductionLine("chain:" + chain.getId(), roles, ModelScale.contribution(chain.getContribFactor()), false);
    }

    public static ProductionLine implicitFor(Role role) {
        return new ProductionLine("role:" + role.getId(), List.of(role), new ModelScale.Fraction(1, 1), true);
    }

    public List<Role> producingRoles() {
        return roles.stream().filter(Role::isProducing).toList();
    }
}
