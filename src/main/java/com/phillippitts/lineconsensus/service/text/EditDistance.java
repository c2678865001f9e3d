package com.phillippitts.lineconsensus.service.text;

/**
 * Levenshtein distance: the minimum number of single-character insertions, deletions and
 * substitutions turning one string into another. Characters are compared as Unicode code
 * points, so a surrogate pair counts as one character.
 */
public final class EditDistance {

    private EditDistance() {
    }

    public static int between(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        int[] s = a.codePoints().toArray();
        int[] t = b.codePoints().toArray();
        if (s.length == 0) {
            return t.length;
        }
        if (t.length == 0) {
            return s.length;
        }

        // Two rows instead of the full matrix
        int[] prev = new int[t.length + 1];
        int[] curr = new int[t.length + 1];
        for (int j = 0; j <= t.length; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= s.length; i++) {
            curr[0] = i;
            for (int j = 1; j <= t.length; j++) {
                int substitution = prev[j - 1] + (s[i - 1] == t[j - 1] ? 0 : 1);
                int deletion = prev[j] + 1;
                int insertion = curr[j - 1] + 1;
                curr[j] = Math.min(substitution, Math.min(deletion, insertion));
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[t.length];
    }
}
