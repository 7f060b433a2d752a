package com.askdata.vocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer shared by the column resolver and the plan compiler.
 *
 * <p>Lower-cases its input, drops apostrophes and splits on anything that is not a letter, digit,
 * {@code _}, {@code .} or {@code -}. Comparison symbols ({@code >=}, {@code !=}, ...) are kept as
 * tokens of their own.
 */
public final class QueryTokens {
    private static final Pattern TOKEN = Pattern.compile(">=|<=|!=|==|=|>|<|[\\p{L}\\p{N}_.\\-]+");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private QueryTokens() {
    }

    public static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        String lowered = text.toLowerCase(Locale.ROOT).replace("'", "").replace("’", "");
        Matcher m = TOKEN.matcher(lowered);
        while (m.find()) {
            String token = trimPunctuation(m.group());
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * Normalizes a column name or phrase for loose equality: lower case, {@code _}, {@code -}
     * and whitespace collapsed into single spaces.
     *
     * @param text input text
     * @return normalized text, empty for null
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).replaceAll("[_\\-\\s]+", " ").trim();
    }

    /**
     * Splits a column name into its compound parts ({@code Unit_Price} -> {@code unit}, {@code price}).
     *
     * @param column column name
     * @return lower-case parts
     */
    public static List<String> columnTokens(String column) {
        List<String> out = new ArrayList<>();
        for (String part : normalize(column).split(" ")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    /**
     * Finds a token sequence inside a token list.
     *
     * @param tokens tokens to search
     * @param phrase phrase tokens
     * @param from first index to consider
     * @return start index of the first occurrence at or after {@code from}, or -1
     */
    public static int indexOf(List<String> tokens, List<String> phrase, int from) {
        if (phrase.isEmpty()) {
            return -1;
        }
        for (int i = Math.max(0, from); i + phrase.size() <= tokens.size(); i++) {
            boolean match = true;
            for (int j = 0; j < phrase.size(); j++) {
                if (!tokens.get(i + j).equals(phrase.get(j))) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return i;
            }
        }
        return -1;
    }

    public static boolean isNumber(String token) {
        return token != null && NUMBER.matcher(token).matches();
    }

    private static String trimPunctuation(String token) {
        if (isNumber(token)) {
            return token;
        }
        int start = 0;
        int end = token.length();
        while (start < end && (token.charAt(start) == '.' || token.charAt(start) == '-')) {
            start++;
        }
        while (end > start && (token.charAt(end - 1) == '.' || token.charAt(end - 1) == '-')) {
            end--;
        }
        return token.substring(start, end);
    }
}
