package org.aviator.service.crash.settlement;

import java.math.BigDecimal;

// Bilan du balayage de fin de round ; alreadySettled = paris réglés entre-temps par un autre chemin
public record SettlementSummary(int won, int lost, int alreadySettled, int failed, BigDecimal paidOut) {

    public static SettlementSummary empty() {
        return new SettlementSummary(0, 0, 0, 0, BigDecimal.ZERO);
    }

    // failed : échecs du dernier passage seulement
    public SettlementSummary plus(SettlementSummary o) {
        return new SettlementSummary(won + o.won, lost + o.lost, alreadySettled + o.alreadySettled,
                o.failed, paidOut.add(o.paidOut));
    }
}
