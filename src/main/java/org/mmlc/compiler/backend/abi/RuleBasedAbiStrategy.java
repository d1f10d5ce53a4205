package org.mmlc.compiler.backend.abi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An {@link AbiStrategy} driven by an ordered list of {@link IStructLoweringRule}s: for
 * each aggregate with a known, non-empty layout the first applicable rule decides.
 * An empty rule list passes everything through unchanged.
 */
public final class RuleBasedAbiStrategy implements AbiStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(RuleBasedAbiStrategy.class);
    private static final int SRET_ALIGNMENT = 8;

    private final TargetAbi target;
    private final List<IStructLoweringRule> rules;
    private final StructLayoutTable layouts;
    private final boolean strictLayout;

    /**
     * @param target The target architecture.
     * @param rules The rules in priority order.
     * @param layouts The layouts of the module being emitted.
     * @param strictLayout Whether an aggregate without a layout is an error instead of opaque.
     */
    public RuleBasedAbiStrategy(TargetAbi target, List<IStructLoweringRule> rules, StructLayoutTable layouts,
                                boolean strictLayout) {
        this.target = target;
        this.rules = List.copyOf(rules);
        this.layouts = layouts;
        this.strictLayout = strictLayout;
    }

    @Override
    public TargetAbi target() {
        return target;
    }

    /**
     * @return The rules in priority order.
     */
    public List<IStructLoweringRule> rules() {
        return rules;
    }

    @Override
    public List<String> lowerParamTypes(List<String> paramTypes) {
        List<String> lowered = new ArrayList<>(paramTypes.size());
        for (String type : paramTypes) {
            Optional<Match> match = match(type);
            if (match.isPresent()) {
                lowered.addAll(match.get().rule().lowerParamTypes(match.get().layout()));
            } else {
                lowered.add(type);
            }
        }
        return lowered;
    }

    @Override
    public ArgLowering lowerArgs(List<NativeArg> args, LoweringState state) {
        List<NativeArg> lowered = new ArrayList<>(args.size());
        LoweringState current = state;
        for (NativeArg arg : args) {
            Optional<Match> match = match(arg.type());
            if (match.isPresent()) {
                ArgLowering result = match.get().rule().lowerArg(arg, match.get().layout(), current);
                lowered.addAll(result.args());
                current = result.state();
            } else {
                lowered.add(arg);
            }
        }
        return new ArgLowering(lowered, current);
    }

    @Override
    public boolean needsSret(String returnType) {
        return match(returnType).map(m -> m.rule().returnsIndirectly()).orElse(false);
    }

    @Override
    public ReturnLowering lowerReturnType(String returnType) {
        if (needsSret(returnType)) {
            return new ReturnLowering("void", sretParam(returnType));
        }
        return new ReturnLowering(returnType, null);
    }

    @Override
    public LoweredSignature lowerSignature(List<String> paramTypes, String returnType) {
        ReturnLowering ret = lowerReturnType(returnType);
        List<String> params = new ArrayList<>();
        if (ret.isIndirect()) {
            params.add(ret.sretParam());
        }
        params.addAll(lowerParamTypes(paramTypes));
        return new LoweredSignature(ret.returnType(), params);
    }

    @Override
    public SretCall prepareCall(String returnType, List<NativeArg> args, LoweringState state) {
        if (!needsSret(returnType)) {
            ArgLowering lowered = lowerArgs(args, state);
            return new SretCall(lowered.args(), null, lowered.state());
        }
        String slot = state.nextValue();
        int alignment = Math.max(SRET_ALIGNMENT, layouts.lookup(returnType).map(StructLayout::alignment).orElse(1));
        LoweringState allocated = state.assign("alloca " + returnType + ", align " + alignment);
        ArgLowering lowered = lowerArgs(args, allocated);
        List<NativeArg> all = new ArrayList<>(lowered.args().size() + 1);
        all.add(new NativeArg(slot, sretParam(returnType)));
        all.addAll(lowered.args());
        return new SretCall(all, slot, lowered.state());
    }

    private static String sretParam(String returnType) {
        return "ptr sret(" + returnType + ") align " + SRET_ALIGNMENT;
    }

    private record Match(IStructLoweringRule rule, StructLayout layout) {}

    private Optional<Match> match(String type) {
        if (rules.isEmpty() || !NativeTypes.isStruct(type)) {
            return Optional.empty();
        }
        Optional<StructLayout> layout = layouts.lookup(type);
        if (layout.isEmpty()) {
            if (strictLayout) {
                throw new IllegalStateException("No struct layout registered for " + type + " on " + target);
            }
            LOG.warn("No struct layout registered for {}, passing it unchanged on {}", type, target);
            return Optional.empty();
        }
        if (layout.get().fieldCount() == 0) {
            return Optional.empty();
        }
        for (IStructLoweringRule rule : rules) {
            if (rule.isApplicable(layout.get())) {
                LOG.debug("{} lowers {} on {}", rule.name(), type, target);
                return Optional.of(new Match(rule, layout.get()));
            }
        }
        return Optional.empty();
    }
}
