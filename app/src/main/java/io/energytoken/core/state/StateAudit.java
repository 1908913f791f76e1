package io.energytoken.core.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cross-checks the supply counters against the balance table.
 * Returns human-readable violations; empty means the state is consistent.
 */
public final class StateAudit {
    private StateAudit(){}

    public static List<String> check(StateStore state, long maxSupply) {
        List<String> problems = new ArrayList<>();
        long sum = 0L;
        for (Map.Entry<String, Long> e : state.getBalances().entrySet()) {
            if (e.getValue() < 0) {
                problems.add("negative balance " + e.getKey() + ":" + e.getValue());
            }
            sum = Math.addExact(sum, e.getValue());
        }
        long supply = state.getTotalSupply();
        if (sum != supply) {
            problems.add("sum of balances " + sum + " != total supply " + supply);
        }
        if (supply > state.getTotalMinted()) {
            problems.add("total supply " + supply + " > total minted " + state.getTotalMinted());
        }
        if (supply > maxSupply) {
            problems.add("total supply " + supply + " > max supply " + maxSupply);
        }
        return problems;
    }
}
