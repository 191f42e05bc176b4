package com.tony.propsAnalytics.util;

import com.tony.propsAnalytics.exception.InvalidOddsException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class OddsMath {

    private OddsMath() {}

    /**
     * Cote américaine vers cote décimale.
     * +150 -> 2.50 ; -110 -> 1.909
     *
     * @throws InvalidOddsException si la cote est absente ou nulle
     */
    public static double americanToDecimal(Integer americanOdds) {
        if (americanOdds == null || americanOdds == 0) {
            log.warn("Cote américaine invalide : {}", americanOdds);
            throw new InvalidOddsException("Cote américaine invalide : " + americanOdds);
        }
        if (americanOdds > 0) {
            return (americanOdds / 100.0) + 1.0;
        }
        return (100.0 / -(double) americanOdds) + 1.0;
    }

    /**
     * Cote décimale vers cote américaine (arrondie à l'unité).
     * Une cote décimale <= 1 n'a pas d'équivalent américain fini.
     */
    public static int decimalToAmerican(double decimalOdds) {
        if (Double.isNaN(decimalOdds) || decimalOdds <= 1.0) {
            log.warn("Cote décimale invalide : {}", decimalOdds);
            throw new InvalidOddsException("Cote décimale invalide : " + decimalOdds);
        }
        if (decimalOdds >= 2.0) {
            return (int) Math.round((decimalOdds - 1.0) * 100.0);
        }
        return (int) -Math.round(100.0 / (decimalOdds - 1.0));
    }

    /** Probabilité implicite (marge du bookmaker incluse). */
    public static double impliedProbability(Integer americanOdds) {
        return 1.0 / americanToDecimal(americanOdds);
    }

    public static String formatAmerican(int americanOdds) {
        return americanOdds > 0 ? "+" + americanOdds : String.valueOf(americanOdds);
    }
}
