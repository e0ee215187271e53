package org.aviator.dto;

import java.math.BigDecimal;

// mise à jour partielle : les champs null sont ignorés
public class SettingsUpdateRequest {
    public BigDecimal houseEdge;
    public Integer bettingDurationSeconds;
    public Integer gameIntervalSeconds;
    public BigDecimal minBet;
    public BigDecimal maxBet;
    public BigDecimal maxCashoutMultiplier;
    public Integer maxFlightSeconds;
    public Boolean maintenanceMode;

    public SettingsUpdateRequest() {}
}
