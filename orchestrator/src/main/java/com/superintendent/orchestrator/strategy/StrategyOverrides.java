package com.superintendent.orchestrator.strategy;

import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;

/** Explicit choices that replace what the strategy would compute. Null means "decide". */
public record StrategyOverrides(Mode mode, Target target, Integer parallelism) {

    public static StrategyOverrides none() {
        return new StrategyOverrides(null, null, null);
    }
}
