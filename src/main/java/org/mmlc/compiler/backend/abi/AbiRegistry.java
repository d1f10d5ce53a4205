package org.mmlc.compiler.backend.abi;

import org.mmlc.compiler.backend.abi.rules.LargeStructByvalRule;
import org.mmlc.compiler.backend.abi.rules.LargeStructIndirectRule;
import org.mmlc.compiler.backend.abi.rules.PackTwoWordStructRule;
import org.mmlc.compiler.backend.abi.rules.SplitSmallStructRule;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the struct lowering rules of each target, applied in registration order.
 */
public final class AbiRegistry {

    private final Map<TargetAbi, List<IStructLoweringRule>> rules = new EnumMap<>(TargetAbi.class);

    /**
     * Registers the ordered rule list of a target, replacing any previous one.
     * @param target The target.
     * @param targetRules The rules in priority order.
     */
    public void register(TargetAbi target, List<IStructLoweringRule> targetRules) {
        rules.put(target, List.copyOf(targetRules));
    }

    /**
     * @param target The target.
     * @return The rules of the target, empty if none are registered.
     */
    public List<IStructLoweringRule> rules(TargetAbi target) {
        return rules.getOrDefault(target, List.of());
    }

    /**
     * Creates the strategy for a target and module.
     * @param target The target.
     * @param layouts The module's struct layouts.
     * @param strictLayout Whether an aggregate without a layout is an error.
     * @return The strategy.
     */
    public AbiStrategy strategyFor(TargetAbi target, StructLayoutTable layouts, boolean strictLayout) {
        return new RuleBasedAbiStrategy(target, rules(target), layouts, strictLayout);
    }

    /**
     * Initializes a new registry with the default rules: x86-64 splits small structs and
     * passes the rest byval, AArch64 packs two-word structs and passes large ones
     * indirectly, every other target has no rules.
     * @return A new registry with default rules.
     */
    public static AbiRegistry initializeWithDefaults() {
        AbiRegistry reg = new AbiRegistry();
        reg.register(TargetAbi.X86_64, List.of(new SplitSmallStructRule(), new LargeStructByvalRule()));
        reg.register(TargetAbi.AARCH64, List.of(new PackTwoWordStructRule(), new LargeStructIndirectRule()));
        reg.register(TargetAbi.DEFAULT, List.of());
        return reg;
    }
}
