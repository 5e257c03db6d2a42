package com.prospect.leadengine.qualify.techno;

import java.util.List;

/**
 * Buying-intent estimate derived from technology gaps. Each indicator keeps the points it added.
 */
public record IntentSignals(int score, List<Indicator> indicators, IntentUrgency urgency) {
    public IntentSignals {
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
        urgency = urgency == null ? IntentUrgency.LOW : urgency;
    }

    public static IntentSignals none() {
        return new IntentSignals(0, List.of(), IntentUrgency.LOW);
    }

    public record Indicator(String reason, int points) {
    }
}
