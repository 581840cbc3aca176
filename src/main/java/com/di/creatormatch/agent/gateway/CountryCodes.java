package com.di.creatormatch.agent.gateway;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the country names the provider reports in audience geography to ISO 3166-1 alpha-2 codes.
 */
public final class CountryCodes {

    private static final Map<String, String> NAME_TO_ISO = new HashMap<>();

    static {
        put("ES", "Spain", "España", "Espana", "Spanien", "Espagne");
        put("PT", "Portugal");
        put("FR", "France", "Francia");
        put("IT", "Italy", "Italia");
        put("DE", "Germany", "Alemania", "Deutschland");
        put("GB", "United Kingdom", "UK", "Reino Unido", "Great Britain", "England");
        put("IE", "Ireland");
        put("NL", "Netherlands", "Holland", "Países Bajos");
        put("BE", "Belgium", "Bélgica");
        put("CH", "Switzerland", "Suiza");
        put("AT", "Austria");
        put("PL", "Poland", "Polonia");
        put("SE", "Sweden");
        put("NO", "Norway");
        put("DK", "Denmark");
        put("US", "United States", "USA", "United States of America", "Estados Unidos");
        put("CA", "Canada");
        put("MX", "Mexico", "México");
        put("AR", "Argentina");
        put("CO", "Colombia");
        put("CL", "Chile");
        put("PE", "Peru", "Perú");
        put("VE", "Venezuela");
        put("EC", "Ecuador");
        put("UY", "Uruguay");
        put("BR", "Brazil", "Brasil");
        put("MA", "Morocco", "Marruecos");
        put("AD", "Andorra");
        put("TR", "Turkey", "Türkiye");
        put("RU", "Russia");
        put("IN", "India");
        put("ID", "Indonesia");
        put("AU", "Australia");
    }

    private CountryCodes() {
    }

    private static void put(String iso, String... names) {
        for (String name : names) {
            NAME_TO_ISO.put(name.toLowerCase(Locale.ROOT), iso);
        }
    }

    /** ISO code for a country name, or null when unknown. Two-letter inputs are treated as codes already. */
    public static String toIso(String countryName) {
        if (countryName == null || countryName.isBlank()) return null;
        String trimmed = countryName.trim();
        String iso = NAME_TO_ISO.get(trimmed.toLowerCase(Locale.ROOT));
        if (iso != null) return iso;
        if (trimmed.length() == 2 && trimmed.chars().allMatch(Character::isLetter)) {
            return trimmed.toUpperCase(Locale.ROOT);
        }
        return null;
    }
}
