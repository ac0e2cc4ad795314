package com.chicu.causalimpact.web.dto;

import com.chicu.causalimpact.effect.InferenceRow;
import com.chicu.causalimpact.effect.ResultField;
import com.chicu.causalimpact.engine.ImpactAnalysis;
import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.series.Period;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ImpactAnalyzeResponse(
        String seriesId,
        String groupKey,
        Period prePeriod,
        Period postPeriod,
        List<Map<String, Object>> rows,
        SummaryView summary,
        Map<String, Map<String, Double>> summaryTable,
        ModelHyperparameters hyperparameters,
        Map<String, Double> coefficients,
        double logLikelihood,
        int optimizerEvaluations,
        boolean converged,
        List<String> covariates,
        List<String> droppedCovariates,
        List<String> warnings,
        long seed,
        int numDraws,
        long tookMs
) {

    public static ImpactAnalyzeResponse from(ImpactAnalysis a) {
        List<Map<String, Object>> rows = new ArrayList<>(a.result().size());
        for (InferenceRow r : a.result().rows()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("timestamp", r.timestamp().toString());
            for (ResultField f : ResultField.values()) {
                m.put(f.key(), r.get(f));
            }
            rows.add(m);
        }

        return new ImpactAnalyzeResponse(
                a.seriesId(),
                a.groupKey(),
                a.pre(),
                a.post(),
                rows,
                SummaryView.from(a.summary()),
                a.summary().table().rounded(a.summary().precision()).asKeyedMap(),
                a.hyperparameters(),
                a.coefficients(),
                a.logLikelihood(),
                a.optimizerEvaluations(),
                a.converged(),
                a.covariates(),
                a.droppedCovariates(),
                a.warnings(),
                a.seed(),
                a.numDraws(),
                a.tookMs()
        );
    }
}
