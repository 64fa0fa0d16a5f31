package com.labelbridge.shipmentprocessor.address;

import com.labelbridge.shipmentprocessor.domain.AbbreviatedAddress;
import com.labelbridge.shipmentprocessor.domain.CarrierFieldLimits;
import com.labelbridge.shipmentprocessor.domain.NormalizedAddress;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shortens Italian address text to a carrier field budget.
 *
 * <ol>
 *   <li>Text already within budget is returned as is.</li>
 *   <li>Dictionary substitutions, longest phrase first, whole words only, one entry at a time
 *       until the text fits. "Via" is never abbreviated. An all-caps match gets an all-caps
 *       abbreviation.</li>
 *   <li>Ordinal words become numerals and articles ({@code del}, {@code della} ...) are dropped.</li>
 *   <li>Truncation at the last whitespace when it falls within the final 5 characters of the
 *       budget, otherwise a hard cut.</li>
 * </ol>
 *
 * <p>The result depends only on the text, the budget and the fixed dictionary, so the same
 * address always yields the same abbreviation.
 */
@Component
public class AddressAbbreviator {

    /** Window, counted back from the budget, in which a word boundary is preferred to a hard cut. */
    static final int BOUNDARY_WINDOW = 5;

    private static final List<Substitution> DICTIONARY;
    private static final List<Substitution> ORDINALS;
    private static final Pattern ARTICLES =
            Pattern.compile("(?<=\\s)(del|della|dei|delle|degli|dello)\\s+", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static {
        Map<String, String> words = new LinkedHashMap<>();
        words.put("Viale", "V.le");
        words.put("Piazza", "P.za");
        words.put("Piazzale", "P.le");
        words.put("Corso", "C.so");
        words.put("Largo", "L.go");
        words.put("Vicolo", "Vic.");
        words.put("Strada", "Str.");
        words.put("Contrada", "C.da");
        words.put("Località", "Loc.");
        words.put("Localita'", "Loc.");
        words.put("Frazione", "Fraz.");
        words.put("Traversa", "Trav.");
        words.put("Galleria", "Gall.");
        words.put("Lungomare", "L.mare");
        words.put("Lungotevere", "L.tevere");
        words.put("Lungoadige", "L.adige");
        words.put("Lungarno", "L.arno");
        words.put("Circonvallazione", "Circ.");
        words.put("Passaggio", "Pass.");
        words.put("Salita", "Sal.");
        words.put("Discesa", "Disc.");
        words.put("Rampa", "Rpa");
        words.put("Borgo", "B.go");
        words.put("Rione", "R.ne");
        words.put("Quartiere", "Q.re");
        words.put("Centro Commerciale", "C.C.");
        words.put("Parco Commerciale", "P.C.");
        words.put("Zona Industriale", "Z.I.");
        words.put("Area Industriale", "A.I.");
        words.put("Strada Statale", "S.S.");
        words.put("Strada Provinciale", "S.P.");
        words.put("Strada Regionale", "S.R.");
        words.put("Strada Comunale", "S.C.");
        words.put("Nazionale", "Naz.");
        words.put("Provinciale", "Prov.");
        words.put("Regionale", "Reg.");
        words.put("Comunale", "Com.");
        words.put("Generale", "Gen.");
        words.put("Maggiore", "Magg.");
        words.put("Colonnello", "Col.");
        words.put("Capitano", "Cap.");
        words.put("Tenente", "Ten.");
        words.put("Cavaliere", "Cav.");
        words.put("Commendatore", "Comm.");
        words.put("Professore", "Prof.");
        words.put("Dottore", "Dott.");
        words.put("Ingegnere", "Ing.");
        words.put("Avvocato", "Avv.");
        words.put("Senatore", "Sen.");
        words.put("Onorevole", "On.");
        words.put("Monsignore", "Mons.");
        words.put("Santo", "S.");
        words.put("Santa", "S.");
        words.put("San", "S.");
        words.put("Santi", "SS.");
        words.put("Beato", "B.");
        words.put("Beata", "B.");
        // stable order: longer phrases first, ties keep declaration order
        DICTIONARY = words.entrySet().stream()
                .map(e -> Substitution.of(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt((Substitution s) -> s.phrase.length()).reversed())
                .toList();

        Map<String, String> ordinals = new LinkedHashMap<>();
        ordinals.put("Primo", "1°");
        ordinals.put("Prima", "1ª");
        ordinals.put("Secondo", "2°");
        ordinals.put("Seconda", "2ª");
        ordinals.put("Terzo", "3°");
        ordinals.put("Terza", "3ª");
        ordinals.put("Quarto", "4°");
        ordinals.put("Quarta", "4ª");
        ordinals.put("Quinto", "5°");
        ordinals.put("Quinta", "5ª");
        ORDINALS = ordinals.entrySet().stream()
                .map(e -> Substitution.of(e.getKey(), e.getValue()))
                .toList();
    }

    /**
     * @param text      address text, may be {@code null}
     * @param maxLength field budget, {@code >= 0}
     * @return text of at most {@code maxLength} characters; {@code null} stays {@code null}
     */
    public String abbreviate(String text, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0: " + maxLength);
        }
        if (text == null || text.length() <= maxLength) {
            return text;
        }

        String result = text;
        for (Substitution substitution : DICTIONARY) {
            if (result.length() <= maxLength) {
                return result;
            }
            result = substitution.apply(result);
        }
        if (result.length() <= maxLength) {
            return result;
        }

        for (Substitution ordinal : ORDINALS) {
            result = ordinal.apply(result);
        }
        result = ARTICLES.matcher(result).replaceAll("");
        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        if (result.length() <= maxLength) {
            return result;
        }
        return truncate(result, maxLength);
    }

    /**
     * Street to {@link CarrierFieldLimits#STREET}, locality to {@link CarrierFieldLimits#LOCALITY};
     * postal code and province are copied unchanged.
     */
    public AbbreviatedAddress abbreviate(NormalizedAddress address) {
        return new AbbreviatedAddress(
                abbreviate(address.street(), CarrierFieldLimits.STREET),
                abbreviate(address.locality(), CarrierFieldLimits.LOCALITY),
                address.province(),
                address.postalCode());
    }

    static String truncate(String text, int maxLength) {
        if (maxLength == 0) {
            return "";
        }
        int cut = maxLength;
        if (!Character.isWhitespace(text.charAt(maxLength))) {
            int boundary = -1;
            for (int i = maxLength - 1; i >= Math.max(1, maxLength - BOUNDARY_WINDOW); i--) {
                if (Character.isWhitespace(text.charAt(i))) {
                    boundary = i;
                    break;
                }
            }
            if (boundary > 0) {
                cut = boundary;
            }
        }
        return stripTrailingSeparators(text.substring(0, cut));
    }

    private static String stripTrailingSeparators(String text) {
        int end = text.length();
        while (end > 0) {
            char c = text.charAt(end - 1);
            if (Character.isWhitespace(c) || c == ',' || c == ';' || c == '-') {
                end--;
            } else {
                break;
            }
        }
        return text.substring(0, end);
    }

    private static final class Substitution {

        private final String phrase;
        private final String replacement;
        private final Pattern pattern;

        private Substitution(String phrase, String replacement, Pattern pattern) {
            this.phrase = phrase;
            this.replacement = replacement;
            this.pattern = pattern;
        }

        static Substitution of(String phrase, String replacement) {
            String regex = "(?<![\\p{L}\\p{N}'])" + Pattern.quote(phrase).replace(" ", "\\E\\s+\\Q") + "(?![\\p{L}\\p{N}])";
            return new Substitution(phrase, replacement,
                    Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }

        String apply(String text) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return text;
            }
            StringBuilder out = new StringBuilder();
            do {
                String found = matcher.group();
                boolean allCaps = found.equals(found.toUpperCase(Locale.ITALIAN))
                        && !found.equals(found.toLowerCase(Locale.ITALIAN));
                String value = allCaps ? replacement.toUpperCase(Locale.ITALIAN) : replacement;
                matcher.appendReplacement(out, Matcher.quoteReplacement(value));
            } while (matcher.find());
            matcher.appendTail(out);
            return out.toString();
        }
    }
}
