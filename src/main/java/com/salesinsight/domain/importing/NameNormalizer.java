package com.salesinsight.domain.importing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Dedup key for master data: "ООО «Ромашка»", "Ромашка" and " ромашка "
 * all normalize to "ромашка".
 *
 * Steps: trim, lower case (root locale), quotes to spaces, collapse
 * whitespace, drop legal-form tokens at either end. A name consisting only
 * of a legal form keeps it.
 */
public final class NameNormalizer {

    static final Set<String> LEGAL_FORMS = Set.of(
            "ооо", "оао", "зао", "ип", "чуп", "уп",
            "llc", "ltd", "inc"
    );

    private static final Pattern QUOTES = Pattern.compile("[\"'`«»„“”‘’]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String value = name.trim().toLowerCase(Locale.ROOT);
        value = QUOTES.matcher(value).replaceAll(" ");
        value = WHITESPACE.matcher(value).replaceAll(" ").trim();
        if (value.isEmpty()) {
            return value;
        }

        List<String> tokens = new ArrayList<>(Arrays.asList(value.split(" ")));
        while (tokens.size() > 1 && isLegalForm(tokens.get(0))) {
            tokens.remove(0);
        }
        while (tokens.size() > 1 && isLegalForm(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        return String.join(" ", tokens);
    }

    private static boolean isLegalForm(String token) {
        String bare = token.replaceAll("[.,]+$", "");
        return LEGAL_FORMS.contains(bare);
    }
}
