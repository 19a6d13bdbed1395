package com.ashscreener.runner;

import com.ashscreener.model.Criterion;
import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.ProgressEvent;
import com.ashscreener.strategy.EntityCheck;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndividualCheckRunnerTest {

    @Test
    void onlyFailShouldEliminate() throws Exception {
        ScriptedCheck check = new ScriptedCheck(Map.of(
                "600000", FilterOutcome.PASS,
                "000001", FilterOutcome.FAIL,
                "300750", FilterOutcome.INDETERMINATE
        ));
        check.throwing.add("688981");

        List<String> kept = new IndividualCheckRunner(4, 20)
                .run(List.of("600000", "000001", "300750", "688981"), check, e -> { });

        // thrown checks and missing data both keep the stock
        assertEquals(List.of("600000", "300750", "688981"), kept);
    }

    @Test
    void everyCodeShouldBeEvaluatedExactlyOnce() throws Exception {
        List<String> codes = new ArrayList<>();
        for (int i = 0; i < 57; i++) {
            codes.add(String.format("600%03d", i));
        }
        ScriptedCheck check = new ScriptedCheck(Map.of());

        List<String> kept = new IndividualCheckRunner(16, 20).run(codes, check, e -> { });

        assertEquals(codes, kept);
        assertEquals(57, check.seen.size());
        assertTrue(check.seen.values().stream().allMatch(n -> n == 1));
    }

    @Test
    void progressShouldBeReportedEveryNCompletionsAndAtTheEnd() throws Exception {
        List<String> codes = new ArrayList<>();
        for (int i = 0; i < 45; i++) {
            codes.add(String.format("000%03d", i));
        }
        List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());

        new IndividualCheckRunner(8, 20).run(codes, new ScriptedCheck(Map.of()), events::add);

        assertEquals(3, events.size());
        assertEquals(25, events.get(0).remaining);
        assertEquals(0, events.get(2).remaining);
        assertTrue(events.get(2).message.contains("45/45"));
    }

    @Test
    void emptyInputShouldReturnEmpty() throws Exception {
        assertTrue(new IndividualCheckRunner(16, 20).run(List.of(), new ScriptedCheck(Map.of()), e -> { }).isEmpty());
    }

    @Test
    void outcomeFoldShouldKeepPassAndIndeterminate() {
        assertTrue(IndividualCheckRunner.retains(FilterOutcome.PASS));
        assertTrue(IndividualCheckRunner.retains(FilterOutcome.INDETERMINATE));
        assertFalse(IndividualCheckRunner.retains(FilterOutcome.FAIL));
    }

    private static final class ScriptedCheck implements EntityCheck {
        private final Map<String, FilterOutcome> outcomes;
        final Set<String> throwing = ConcurrentHashMap.newKeySet();
        final Map<String, Integer> seen = new ConcurrentHashMap<>();

        ScriptedCheck(Map<String, FilterOutcome> outcomes) {
            this.outcomes = outcomes;
        }

        @Override
        public Criterion criterion() {
            return Criterion.DIVIDEND_YIELD;
        }

        @Override
        public String label() {
            return "scripted";
        }

        @Override
        public FilterOutcome evaluate(String code) {
            seen.merge(code, 1, Integer::sum);
            if (throwing.contains(code)) {
                throw new IllegalStateException("parse error for " + code);
            }
            return outcomes.getOrDefault(code, FilterOutcome.PASS);
        }
    }
}
