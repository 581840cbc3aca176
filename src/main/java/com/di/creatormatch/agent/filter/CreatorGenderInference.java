package com.di.creatormatch.agent.filter;

import com.di.creatormatch.agent.campaign.GenderFilter;
import com.di.creatormatch.agent.creator.CreatorRecord;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers a creator's own gender from four independent signals and combines them by majority of the
 * signals that produced an answer. A tie goes to the strongest signal present, in the order
 * display name, bio, username, audience. No signal at all means unknown ({@link GenderFilter#ANY}).
 */
@Component
public class CreatorGenderInference {

    /** Signals in decreasing strength. */
    public enum Signal {
        DISPLAY_NAME,
        BIO,
        USERNAME,
        AUDIENCE
    }

    /** Audience share above which the creator is assumed to be of the opposite gender. */
    static final double AUDIENCE_INVERSE_PCT = 65.0;

    private static final Pattern NAME_SEPARATORS = Pattern.compile("[\\s|·•\\-_.]+");
    private static final Pattern USERNAME_SEPARATORS = Pattern.compile("[_.\\d]");
    private static final Pattern BIO_SEPARATORS = Pattern.compile("[^\\p{L}/]+");
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_LETTERS = Pattern.compile("^[^\\p{L}]+|[^\\p{L}]+$");

    private static final Set<String> FEMALE_NAMES = setOf(
            "maria", "ana", "elena", "lucia", "carmen", "laura", "marta", "sara", "paula", "claudia",
            "andrea", "irene", "alba", "nuria", "silvia", "rosa", "isabel", "cristina", "patricia", "eva",
            "pilar", "raquel", "monica", "blanca", "beatriz", "sandra", "ines", "julia", "natalia", "alicia",
            "diana", "carolina", "lola", "rocio", "marina", "olga", "sonia", "angeles", "vanessa", "veronica",
            "susana", "belen", "esther", "teresa", "begona", "agueda", "mariona", "jimena", "clara", "salma",
            "ingrid", "martina", "noa", "greta", "kira", "vera", "lea", "luna", "ariadna", "miriam",
            "helena", "nadia", "luciana", "jenny", "vicky", "bea", "lara", "candela", "nieves", "michelle",
            "sofia", "valentina", "camila", "gabriela", "alejandra", "lorena", "aroa", "noelia", "tamara", "lidia",
            "amparo", "mercedes", "yolanda", "gemma", "montserrat", "montse", "judith", "judit", "celia", "sheila",
            "carla", "ainara", "leire", "aitana", "anna", "emma", "laia", "mireia", "meritxell", "joana",
            "isabella", "daniela", "valeria", "paola", "adriana", "rebeca", "berta", "macarena", "ainhoa", "amaia",
            "itziar", "nerea", "miren", "idoia", "roser", "jessica", "jennifer", "natalie", "victoria", "alexandra",
            "aida", "elsa", "carlota", "nicole", "paloma", "lydia", "elisa", "arantxa", "gisela", "maribel");

    private static final Set<String> MALE_NAMES = setOf(
            "carlos", "david", "javier", "daniel", "jose", "miguel", "antonio", "francisco", "manuel", "pedro",
            "alejandro", "rafael", "fernando", "pablo", "sergio", "jorge", "alberto", "angel", "luis", "ramon",
            "juan", "diego", "victor", "enrique", "roberto", "marcos", "mario", "ivan", "adrian", "oscar",
            "santiago", "andres", "raul", "hugo", "ignacio", "gonzalo", "borja", "nacho", "alvaro", "emilio",
            "tomas", "nicolas", "jaime", "guillermo", "rodrigo", "arturo", "esteban", "hector", "joaquin", "lucas",
            "mateo", "ricardo", "ruben", "sebastian", "xavier", "felix", "german", "marcelo", "gerard", "marc",
            "eric", "pol", "arnau", "guillem", "pau", "xavi", "sergi", "joan", "jordi", "oriol",
            "carles", "albert", "iker", "unai", "asier", "aitor", "gorka", "mikel", "julen", "inaki",
            "alex", "kevin", "michael", "james", "thomas", "aaron", "fran", "jesus", "manu", "rafa",
            "leo", "javi", "pepe", "julio", "gabriel", "toni", "alfonso", "christian", "felipe", "santi");

    private static final Set<String> FEMALE_BIO_SIGNALS = setOf(
            "she/her", "ella", "mama", "madre", "actriz", "escritora", "maquilladora", "creadora", "fotografa",
            "disenadora", "profesora", "enfermera", "psicologa", "bailarina", "presentadora", "mujer");

    private static final Set<String> MALE_BIO_SIGNALS = setOf(
            "he/him", "papa", "padre", "actor", "escritor", "creador", "fotografo", "disenador",
            "profesor", "enfermero", "psicologo", "bailarin", "presentador");

    /** Outcome with the per-signal answers that produced it. */
    public static final class Inference {
        private final GenderFilter gender;
        private final Map<Signal, GenderFilter> signals;

        Inference(GenderFilter gender, Map<Signal, GenderFilter> signals) {
            this.gender = gender;
            this.signals = Collections.unmodifiableMap(signals);
        }

        /** FEMALE, MALE, or ANY when unknown. */
        public GenderFilter getGender() {
            return gender;
        }

        public Map<Signal, GenderFilter> getSignals() {
            return signals;
        }

        public boolean isKnown() {
            return gender.isSpecified();
        }
    }

    public Inference infer(CreatorRecord record) {
        Map<Signal, GenderFilter> signals = new EnumMap<>(Signal.class);
        put(signals, Signal.DISPLAY_NAME, fromDisplayName(record.getDisplayName()));
        put(signals, Signal.BIO, fromBio(record.getBio()));
        put(signals, Signal.USERNAME, fromUsername(record.getUsername()));
        put(signals, Signal.AUDIENCE, fromAudience(record.getMetrics().getAudienceGenders()));
        return new Inference(combine(signals), signals);
    }

    /** True when the creator is not known to be of a gender other than {@code requested}. */
    public boolean matches(CreatorRecord record, GenderFilter requested) {
        if (requested == null || !requested.isSpecified()) return true;
        Inference inference = infer(record);
        return !inference.isKnown() || inference.getGender() == requested;
    }

    static GenderFilter combine(Map<Signal, GenderFilter> signals) {
        int female = 0;
        int male = 0;
        for (GenderFilter g : signals.values()) {
            if (g == GenderFilter.FEMALE) female++;
            else if (g == GenderFilter.MALE) male++;
        }
        if (female > male) return GenderFilter.FEMALE;
        if (male > female) return GenderFilter.MALE;
        if (female == 0) return GenderFilter.ANY;
        // EnumMap iterates in declaration order, strongest first.
        return signals.values().iterator().next();
    }

    static GenderFilter fromAudience(Map<String, Double> genders) {
        if (genders == null || genders.isEmpty()) return GenderFilter.ANY;
        double malePct = pct(genders, "male");
        double femalePct = pct(genders, "female");
        if (malePct > AUDIENCE_INVERSE_PCT) return GenderFilter.FEMALE;
        if (femalePct > AUDIENCE_INVERSE_PCT) return GenderFilter.MALE;
        return GenderFilter.ANY;
    }

    static GenderFilter fromBio(String bio) {
        if (bio == null || bio.isBlank()) return GenderFilter.ANY;
        Set<String> words = new HashSet<>(Arrays.asList(BIO_SEPARATORS.split(fold(bio))));
        for (String s : FEMALE_BIO_SIGNALS) {
            if (words.contains(s)) return GenderFilter.FEMALE;
        }
        for (String s : MALE_BIO_SIGNALS) {
            if (words.contains(s)) return GenderFilter.MALE;
        }
        return GenderFilter.ANY;
    }

    static GenderFilter fromDisplayName(String displayName) {
        if (displayName == null || displayName.isBlank()) return GenderFilter.ANY;
        String[] parts = NAME_SEPARATORS.split(fold(displayName).trim());
        for (String part : parts) {
            String word = NON_LETTERS.matcher(part).replaceAll("");
            if (word.isEmpty()) continue;
            return byName(word);
        }
        return GenderFilter.ANY;
    }

    static GenderFilter fromUsername(String username) {
        if (username == null || username.isBlank()) return GenderFilter.ANY;
        String trimmed = fold(username).trim();
        while (trimmed.startsWith("_") || trimmed.startsWith(".") || trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        String[] segments = USERNAME_SEPARATORS.split(trimmed);
        String first = segments.length > 0 ? segments[0] : "";
        if (first.length() < 3) return GenderFilter.ANY;
        GenderFilter exact = byName(first);
        if (exact.isSpecified()) return exact;
        // "kirahuberman" starts with "kira"
        for (String name : FEMALE_NAMES) {
            if (name.length() >= 4 && first.startsWith(name)) return GenderFilter.FEMALE;
        }
        for (String name : MALE_NAMES) {
            if (name.length() >= 4 && first.startsWith(name)) return GenderFilter.MALE;
        }
        return GenderFilter.ANY;
    }

    private static GenderFilter byName(String word) {
        if (FEMALE_NAMES.contains(word)) return GenderFilter.FEMALE;
        if (MALE_NAMES.contains(word)) return GenderFilter.MALE;
        return GenderFilter.ANY;
    }

    /** NFKC (fancy Unicode fonts), accents stripped, lowercased. */
    static String fold(String text) {
        String nfkc = Normalizer.normalize(text, Normalizer.Form.NFKC);
        String decomposed = Normalizer.normalize(nfkc, Normalizer.Form.NFD);
        return MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private static double pct(Map<String, Double> genders, String key) {
        for (Map.Entry<String, Double> e : genders.entrySet()) {
            if (key.equalsIgnoreCase(e.getKey()) && e.getValue() != null) return e.getValue();
        }
        return 0.0;
    }

    private static void put(Map<Signal, GenderFilter> signals, Signal signal, GenderFilter value) {
        if (value.isSpecified()) signals.put(signal, value);
    }

    private static Set<String> setOf(String... values) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(values)));
    }
}
