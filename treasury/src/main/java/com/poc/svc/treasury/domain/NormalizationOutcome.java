package com.poc.svc.treasury.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record NormalizationOutcome(List<NormalizedPosition> positions, List<ExcludedBalance> excluded) {

    public NormalizationOutcome {
        positions = positions == null ? List.of() : List.copyOf(positions);
        excluded = excluded == null ? List.of() : List.copyOf(excluded);
    }

    public Map<String, NormalizedPosition> positionsByAccount() {
        Map<String, NormalizedPosition> byAccount = new LinkedHashMap<>();
        for (NormalizedPosition position : positions) {
            byAccount.putIfAbsent(position.accountId(), position);
        }
        return byAccount;
    }

    public List<ExcludedBalance> excludedFor(ExclusionReason reason) {
        return excluded.stream().filter(balance -> balance.reason() == reason).toList();
    }
}
