package com.tony.propsAnalytics.model;

public enum RecommendedSide {
    OVER, UNDER, PUSH;

    /** Le côté suit le signe de l'edge ; edge nul = push (rien à exploiter). */
    public static RecommendedSide fromEdge(double edge) {
        if (edge > 0) return OVER;
        if (edge < 0) return UNDER;
        return PUSH;
    }
}
