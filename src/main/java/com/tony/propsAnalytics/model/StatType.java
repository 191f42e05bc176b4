package com.tony.propsAnalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Catégories de statistiques couvertes par les props joueurs.
 * Les variantes combinées (PRA, Pts+Reb...) sont décrites par leurs composantes de base.
 */
public enum StatType {
    POINTS("Points"),
    REBOUNDS("Rebounds"),
    ASSISTS("Assists"),
    STEALS("Steals"),
    BLOCKS("Blocks"),
    THREE_POINTERS("3-Pointers"),
    POINTS_REBOUNDS("Points + Rebounds", POINTS, REBOUNDS),
    POINTS_ASSISTS("Points + Assists", POINTS, ASSISTS),
    REBOUNDS_ASSISTS("Rebounds + Assists", REBOUNDS, ASSISTS),
    POINTS_REBOUNDS_ASSISTS("Points + Rebounds + Assists", POINTS, REBOUNDS, ASSISTS),
    STEALS_BLOCKS("Steals + Blocks", STEALS, BLOCKS);

    private static final Pattern THREES = Pattern.compile(
            "3[- ]?(pointers?|points?|pts?)( field goals?| made| shots?)?|three[ _-]?pointers?|threes|3pm");
    private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9]+");

    private static final Map<String, StatType> ALIASES = new HashMap<>();
    private static final Map<String, List<StatType>> SHORTHANDS = new HashMap<>();
    private static final Set<String> NOISE = Set.of("total", "player", "and", "plus", "made", "game");

    static {
        for (String a : List.of("points", "point", "pts", "pt")) ALIASES.put(a, POINTS);
        for (String a : List.of("rebounds", "rebound", "reb", "rebs", "boards")) ALIASES.put(a, REBOUNDS);
        for (String a : List.of("assists", "assist", "ast", "asts")) ALIASES.put(a, ASSISTS);
        for (String a : List.of("steals", "steal", "stl", "stls")) ALIASES.put(a, STEALS);
        for (String a : List.of("blocks", "block", "blk", "blks")) ALIASES.put(a, BLOCKS);
        ALIASES.put("threes", THREE_POINTERS);

        SHORTHANDS.put("pra", List.of(POINTS, REBOUNDS, ASSISTS));
        SHORTHANDS.put("pr", List.of(POINTS, REBOUNDS));
        SHORTHANDS.put("pa", List.of(POINTS, ASSISTS));
        SHORTHANDS.put("ra", List.of(REBOUNDS, ASSISTS));
        SHORTHANDS.put("stocks", List.of(STEALS, BLOCKS));
    }

    private final String label;
    private final Set<StatType> components;

    StatType(String label, StatType... components) {
        this.label = label;
        this.components = components.length == 0 ? null : Set.of(components);
    }

    /** Libellé d'affichage, aussi utilisé en JSON. */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Composantes de base (elle-même pour une stat simple). */
    public Set<StatType> baseComponents() {
        return components == null ? Set.of(this) : components;
    }

    /** Props "à volume offensif" : sensibles au rythme du match. */
    public boolean isScoringType() {
        Set<StatType> base = baseComponents();
        return base.contains(POINTS) || base.contains(ASSISTS);
    }

    /** Stats défensives/rebonds : favorisées par les matchs lents. */
    public boolean isDefensiveCountType() {
        Set<StatType> base = baseComponents();
        return base.contains(REBOUNDS) || base.contains(BLOCKS);
    }

    /**
     * Normalise un libellé bookmaker ou modèle ("Total Points", "points", "Pts + Reb",
     * "Total 3-Point Field Goals", "Player Points O/U") vers un type connu.
     * Vide si aucun jeton de stat n'est reconnu ou si la combinaison n'existe pas.
     */
    public static Optional<StatType> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();

        String normalized = THREES.matcher(label.toLowerCase(Locale.ROOT).replace('_', ' ')).replaceAll(" threes ");

        Set<StatType> found = EnumSet.noneOf(StatType.class);
        for (String token : SEPARATORS.split(normalized.trim())) {
            if (token.isEmpty() || NOISE.contains(token)) continue;

            StatType alias = ALIASES.get(token);
            if (alias != null) {
                found.add(alias);
            } else if (SHORTHANDS.containsKey(token)) {
                found.addAll(SHORTHANDS.get(token));
            }
            // Mots hors stat ("scored", "o/u", "incl. ot") ignorés
        }
        if (found.isEmpty()) return Optional.empty();

        for (StatType type : values()) {
            if (type.baseComponents().equals(found)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
