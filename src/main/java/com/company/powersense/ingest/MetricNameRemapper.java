package com.company.powersense.ingest;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the column labels of the history archive to the metric names used by the real-time feed.
 */
public final class MetricNameRemapper {

    private static final Map<String, String> KNOWN_LABELS = Map.ofEntries(
            Map.entry("Périmètre", "perimetre"),
            Map.entry("Nature", "nature"),
            Map.entry("Date", "date"),
            Map.entry("Heures", "heure"),
            Map.entry("Consommation", "consommation"),
            Map.entry("Prévision J-1", "prevision_j1"),
            Map.entry("Prévision J", "prevision_j"),
            Map.entry("Fioul", "fioul"),
            Map.entry("Charbon", "charbon"),
            Map.entry("Gaz", "gaz"),
            Map.entry("Nucléaire", "nucleaire"),
            Map.entry("Eolien", "eolien"),
            Map.entry("Eolien terrestre", "eolien_terrestre"),
            Map.entry("Eolien offshore", "eolien_offshore"),
            Map.entry("Solaire", "solaire"),
            Map.entry("Hydraulique", "hydraulique"),
            Map.entry("Pompage", "pompage"),
            Map.entry("Bioénergies", "bioenergies"),
            Map.entry("Bioénergies - Déchets", "bioenergies_dechets"),
            Map.entry("Bioénergies - Biomasse", "bioenergies_biomasse"),
            Map.entry("Bioénergies - Biogaz", "bioenergies_biogaz"),
            Map.entry("Ech. physiques", "ech_physiques"),
            Map.entry("Taux de Co2", "taux_co2"),
            Map.entry("Ech. comm. Angleterre", "ech_comm_angleterre"),
            Map.entry("Ech. comm. Espagne", "ech_comm_espagne"),
            Map.entry("Ech. comm. Italie", "ech_comm_italie"),
            Map.entry("Ech. comm. Suisse", "ech_comm_suisse"),
            Map.entry("Ech. comm. Allemagne-Belgique", "ech_comm_allemagne_belgique"),
            Map.entry("Fioul - TAC", "fioul_tac"),
            Map.entry("Fioul - Cogén.", "fioul_cogen"),
            Map.entry("Fioul - Autres", "fioul_autres"),
            Map.entry("Gaz - TAC", "gaz_tac"),
            Map.entry("Gaz - Cogén.", "gaz_cogen"),
            Map.entry("Gaz - CCG", "gaz_ccg"),
            Map.entry("Gaz - Autres", "gaz_autres"),
            Map.entry("Hydraulique - Fil de l'eau + éclusée", "hydraulique_fil_eau_eclusee"),
            Map.entry("Hydraulique - Lacs", "hydraulique_lacs"),
            Map.entry("Hydraulique - STEP turbinage", "hydraulique_step_turbinage"),
            Map.entry("Stockage batterie", "stockage_batterie"),
            Map.entry("Déstockage batterie", "destockage_batterie")
    );

    private MetricNameRemapper() {
    }

    /**
     * Known label to its fixed name; otherwise accents stripped, lower-cased, and runs of
     * non-alphanumerics collapsed to one underscore.
     */
    public static String remap(String label) {
        if (label == null) {
            return null;
        }
        String key = label.strip();
        String known = KNOWN_LABELS.get(key);
        if (known != null) {
            return known;
        }

        String ascii = Normalizer.normalize(key, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        String snake = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return snake.isEmpty() ? label : snake;
    }
}
