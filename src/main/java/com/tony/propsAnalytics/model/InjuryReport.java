package com.tony.propsAnalytics.model;

public record InjuryReport(String athleteId, String status, String position, String teamId) {

    public boolean isOut() {
        return "OUT".equalsIgnoreCase(status == null ? null : status.trim());
    }

    /** Poste principal listé : meneur/arrière (G), ailier (F) ou pivot (C). */
    public boolean hasPrimaryPosition() {
        if (position == null) return false;
        String p = position.toUpperCase();
        return p.contains("G") || p.contains("F") || p.contains("C");
    }
}
