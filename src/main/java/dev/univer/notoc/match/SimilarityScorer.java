package dev.univer.notoc.match;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;

/**
 * Name similarity on a 0..100 scale. Three measures are computed and the best one wins:
 * <ul>
 *     <li>{@link #ratio} - whole-string edit similarity (typos),</li>
 *     <li>{@link #partialRatio} - best window of the longer string (abbreviations, "Tun" in "Tuan"),</li>
 *     <li>{@link #tokenSortRatio} - word order ignored ("Duy Khanh" vs "Khanh Duy").</li>
 * </ul>
 * Callers pass lower-cased input; the scorer itself does not change case except in the token pass.
 */
@Component
public class SimilarityScorer {

    public int score(String query, String candidate) {
        int best = ratio(query, candidate);
        if (best == 100) return best;
        best = Math.max(best, partialRatio(query, candidate));
        if (best == 100) return best;
        return Math.max(best, tokenSortRatio(query, candidate));
    }

    /**
     * Normalized edit similarity where a substitution costs two edits (insert + delete),
     * i.e. {@code 2 * LCS / (len(a) + len(b))}.
     */
    public int ratio(String a, String b) {
        return ratio(codePoints(a), codePoints(b));
    }

    public int partialRatio(String a, String b) {
        int[] x = codePoints(a);
        int[] y = codePoints(b);
        int[] shorter = x.length <= y.length ? x : y;
        int[] longer = x.length <= y.length ? y : x;
        int m = shorter.length;
        int n = longer.length;
        if (m == 0) return 0;
        if (m == n) return ratio(shorter, longer);

        int best = 0;
        // full-length windows
        for (int start = 0; start + m <= n && best < 100; start++) {
            best = Math.max(best, ratio(shorter, Arrays.copyOfRange(longer, start, start + m)));
        }
        // windows cut by the edges of the longer string
        for (int len = 1; len < m && best < 100; len++) {
            best = Math.max(best, ratio(shorter, Arrays.copyOfRange(longer, 0, len)));
            best = Math.max(best, ratio(shorter, Arrays.copyOfRange(longer, n - len, n)));
        }
        return best;
    }

    public int tokenSortRatio(String a, String b) {
        String sa = sortedTokens(a);
        String sb = sortedTokens(b);
        if (sa.isEmpty() || sb.isEmpty()) return 0;
        return ratio(sa, sb);
    }

    static String sortedTokens(String s) {
        if (s == null) return "";
        StringBuilder cleaned = new StringBuilder(s.length());
        s.toLowerCase(Locale.ROOT).codePoints()
         .map(cp -> Character.isLetterOrDigit(cp) ? cp : ' ')
         .forEach(cleaned::appendCodePoint);
        String trimmed = cleaned.toString().trim();
        if (trimmed.isEmpty()) return "";
        String[] tokens = trimmed.split("\\s+");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    private static int ratio(int[] a, int[] b) {
        int total = a.length + b.length;
        if (a.length == 0 || b.length == 0) return 0;
        int lcs = lcsLength(a, b);
        return (int) Math.round(200.0 * lcs / total);
    }

    private static int lcsLength(int[] a, int[] b) {
        int[] prev = new int[b.length + 1];
        int[] cur = new int[b.length + 1];
        for (int i = 1; i <= a.length; i++) {
            for (int j = 1; j <= b.length; j++) {
                cur[j] = a[i - 1] == b[j - 1]
                         ? prev[j - 1] + 1
                         : Math.max(prev[j], cur[j - 1]);
            }
            int[] tmp = prev; prev = cur; cur = tmp;
        }
        return prev[b.length];
    }

    private static int[] codePoints(String s) {
        return s == null ? new int[0] : s.codePoints().toArray();
    }
}
