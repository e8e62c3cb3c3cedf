package com.signalsentinel.core.fusion;

import com.signalsentinel.core.model.BayesianResult;
import com.signalsentinel.core.model.CausalityResult;
import com.signalsentinel.core.model.DisproportionalityResult;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.MultiSourceComponents;
import com.signalsentinel.core.model.ScoringError;
import com.signalsentinel.core.model.SingleSourceComponents;
import com.signalsentinel.core.model.TemporalResult;

import java.util.List;

/**
 * Per-pair component results between the parallel scoring phase and fusion.
 * Either {@link #error} is set or the component fields are.
 */
final class PairAnalysis {

    final DrugEventPair pair;
    final DisproportionalityResult disproportionality;
    final BayesianResult bayesian;
    final CausalityResult causality;
    final TemporalResult temporal;
    final SingleSourceComponents singleSource;
    final MultiSourceComponents multiSource;
    final List<String> notes;
    final ScoringError error;

    PairAnalysis(DrugEventPair pair, DisproportionalityResult disproportionality, BayesianResult bayesian,
            CausalityResult causality, TemporalResult temporal, SingleSourceComponents singleSource,
            MultiSourceComponents multiSource, List<String> notes) {
        this(pair, disproportionality, bayesian, causality, temporal, singleSource, multiSource, notes, null);
    }

    private PairAnalysis(DrugEventPair pair, DisproportionalityResult disproportionality,
            BayesianResult bayesian, CausalityResult causality, TemporalResult temporal,
            SingleSourceComponents singleSource, MultiSourceComponents multiSource, List<String> notes,
            ScoringError error) {
        this.pair = pair;
        this.disproportionality = disproportionality;
        this.bayesian = bayesian;
        this.causality = causality;
        this.temporal = temporal;
        this.singleSource = singleSource;
        this.multiSource = multiSource;
        this.notes = List.copyOf(notes);
        this.error = error;
    }

    static PairAnalysis failed(DrugEventPair pair, ScoringError error) {
        return new PairAnalysis(pair, null, null, null, null, null, null, List.of(), error);
    }

    boolean isFailed() {
        return error != null;
    }

    PairAnalysis withBayesian(BayesianResult adjusted) {
        return new PairAnalysis(pair, disproportionality, adjusted, causality, temporal, singleSource,
                multiSource, notes, error);
    }
}
