package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.Stock;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * At most one distinct actual controller on record. No record at all counts as stable.
 */
public final class ControllerStabilityCheck implements EntityCheck {
    private final LazyIndex<Map<String, Set<String>>> controllersByCode;

    public ControllerStabilityCheck(MarketDataService data) {
        this.controllersByCode = new LazyIndex<>(() -> index(data.controllerInfo()));
    }

    @Override
    public Criterion criterion() {
        return Criterion.CONTROLLER_STABLE;
    }

    @Override
    public String label() {
        return Criterion.CONTROLLER_STABLE.label;
    }

    @Override
    public FilterOutcome evaluate(String code) {
        Optional<Map<String, Set<String>>> index = controllersByCode.get();
        if (index.isEmpty()) {
            return FilterOutcome.INDETERMINATE;
        }
        return judge(index.get().getOrDefault(code, Set.of()));
    }

    static FilterOutcome judge(Set<String> controllers) {
        return FilterOutcome.of(controllers.size() <= 1);
    }

    static Optional<Map<String, Set<String>>> index(Table controllers) {
        if (controllers.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Set<String>> out = new HashMap<>();
        for (TableRow row : controllers.rows()) {
            String code = Stock.normalizeCode(row.getString(Fields.CODE));
            String name = row.getString(Fields.CONTROLLER_NAME);
            if (code.isEmpty() || name.isEmpty()) {
                continue;
            }
            out.computeIfAbsent(code, k -> new LinkedHashSet<>()).add(name);
        }
        return Optional.of(out);
    }
}
